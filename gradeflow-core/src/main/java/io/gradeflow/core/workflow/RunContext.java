package io.gradeflow.core.workflow;

import io.gradeflow.core.grading.TaskListener;
import io.gradeflow.core.run.RunState;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/// Run-scoped view handed to a node.
///
/// Everything a node may touch about its run comes through here; nodes hold no state of
/// their own between runs.
///
/// @param runId the run being executed, not null
/// @param state accumulated state before the node, not null
/// @param attempt attempt number of this execution, starting at 1
/// @param cancellation reports whether the run has been cancelled, not null
/// @param taskListener receives grading task updates, not null
public record RunContext(
        String runId,
        RunState state,
        int attempt,
        BooleanSupplier cancellation,
        TaskListener taskListener) {

    public RunContext {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        taskListener = taskListener != null ? taskListener : TaskListener.NONE;
    }

    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }
}
