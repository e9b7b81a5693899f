package io.gradeflow.core.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Normalized submission details recorded by the `intake` node.
///
/// @param title batch name, never blank
/// @param expectedTotal declared rubric total, may be null
/// @param expectedAnswerPages declared answer page count, may be null
/// @param roster trimmed student names, not null
/// @param receivedAt intake time, not null
public record IntakeSummary(
        String title,
        Double expectedTotal,
        Integer expectedAnswerPages,
        List<String> roster,
        Instant receivedAt) {

    public IntakeSummary {
        Objects.requireNonNull(title, "title must not be null");
        roster = roster != null ? List.copyOf(roster) : List.of();
        receivedAt = receivedAt != null ? receivedAt : Instant.now();
    }
}
