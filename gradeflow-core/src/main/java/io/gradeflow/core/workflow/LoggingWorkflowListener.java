package io.gradeflow.core.workflow;

import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.review.ReviewRequest;
import io.gradeflow.core.run.WorkflowRun;
import java.time.Duration;
import java.util.logging.Logger;

/// Writes run lifecycle events to `java.util.logging`.
public final class LoggingWorkflowListener implements WorkflowListener {

    private static final Logger logger = Logger.getLogger(LoggingWorkflowListener.class.getName());

    @Override
    public void onRunSubmitted(WorkflowRun run) {
        logger.info("Run submitted: " + run.runId());
    }

    @Override
    public void onNodeStarted(String runId, String node, int attempt) {
        logger.info("[" + runId + "] node " + node + " started (attempt " + attempt + ")");
    }

    @Override
    public void onNodeCompleted(String runId, String node, Duration elapsed) {
        logger.info("[" + runId + "] node " + node + " completed in " + elapsed.toMillis() + "ms");
    }

    @Override
    public void onTaskUpdate(String runId, GradingTask task) {
        logger.fine(
                "[" + runId + "] task " + task.taskId() + " (" + task.studentKey() + ") "
                        + task.status() + ", retries " + task.retryCount());
    }

    @Override
    public void onSuspended(String runId, ReviewRequest review) {
        logger.info("[" + runId + "] suspended at " + review.gate() + ": " + review.reasons());
    }

    @Override
    public void onRunCompleted(WorkflowRun run) {
        logger.info("Run completed: " + run.runId());
    }

    @Override
    public void onRunFailed(String runId, String node, String detail) {
        logger.warning("[" + runId + "] failed at " + node + ": " + detail);
    }

    @Override
    public void onRunBlocked(String runId, String node, String detail) {
        logger.warning("[" + runId + "] blocked at " + node + ", resubmission required: " + detail);
    }

    @Override
    public void onRunCancelled(String runId, String detail) {
        logger.info("[" + runId + "] cancelled: " + detail);
    }
}
