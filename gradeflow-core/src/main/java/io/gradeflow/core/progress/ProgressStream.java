package io.gradeflow.core.progress;

import io.gradeflow.core.run.WorkflowRun;
import java.util.Objects;

/// What a late-joining subscriber receives: the run as last checkpointed, followed by every
/// event published after the subscription was opened.
///
/// The subscription is opened before the snapshot is read, so no transition falls between
/// the two. If the snapshot is already terminal the event sequence is finite and may be empty.
///
/// @param snapshot checkpointed run at join time, not null
/// @param events live events from the join point on, not null
public record ProgressStream(WorkflowRun snapshot, ProgressSubscription events)
        implements AutoCloseable {

    public ProgressStream {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(events, "events must not be null");
    }

    @Override
    public void close() {
        events.close();
    }
}
