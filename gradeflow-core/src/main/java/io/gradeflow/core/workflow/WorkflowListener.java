package io.gradeflow.core.workflow;

import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.review.ReviewRequest;
import io.gradeflow.core.run.WorkflowRun;
import java.time.Duration;

/// Listener for grading run lifecycle events.
///
/// All methods have no-op defaults so implementations override only what they need.
/// Callbacks fire after the corresponding checkpoint has been saved.
///
/// ### Callback Lifecycle
/// ```
/// onRunSubmitted(run)
/// onNodeStarted(runId, node, attempt)      : once per node attempt
/// onTaskUpdate(runId, task)                : grade_dispatch only, from worker threads
/// onNodeCompleted(runId, node, elapsed)
/// onSuspended(runId, review)               : run waits for resume
/// onRunCompleted / onRunFailed / onRunBlocked / onRunCancelled
/// ```
///
/// @implNote Implementations must be thread-safe: task updates arrive concurrently and
/// different runs call back from different threads.
public interface WorkflowListener {

    default void onRunSubmitted(WorkflowRun run) {}

    default void onNodeStarted(String runId, String node, int attempt) {}

    default void onNodeCompleted(String runId, String node, Duration elapsed) {}

    default void onTaskUpdate(String runId, GradingTask task) {}

    default void onSuspended(String runId, ReviewRequest review) {}

    default void onRunCompleted(WorkflowRun run) {}

    /// Called when a node raised and the run became `FAILED`.
    ///
    /// @param runId the failed run, not null
    /// @param node node that raised, not null
    /// @param detail error detail, not null
    default void onRunFailed(String runId, String node, String detail) {}

    /// Called when the run returned to `PENDING` and needs a new submission.
    default void onRunBlocked(String runId, String node, String detail) {}

    default void onRunCancelled(String runId, String detail) {}

    /// No-op listener instance.
    WorkflowListener NOOP = new WorkflowListener() {};
}
