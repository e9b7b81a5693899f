package io.gradeflow.core.progress;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// One progress notification for a run.
///
/// Sequence numbers are assigned by {@link ProgressBroadcaster} and are strictly increasing
/// per run. The payload holds only strings, numbers, booleans and lists of those so any
/// transport can encode it.
///
/// @param runId the run the event belongs to, not null
/// @param kind what happened, not null
/// @param sequence per-run sequence number, positive
/// @param timestamp when the event was published, not null
/// @param payload event detail, not null
public record ProgressEvent(
        String runId,
        ProgressEventKind kind,
        long sequence,
        Instant timestamp,
        Map<String, Object> payload) {

    public ProgressEvent {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    /// Returns the transport name of the event kind.
    public String type() {
        return kind.wireName();
    }
}
