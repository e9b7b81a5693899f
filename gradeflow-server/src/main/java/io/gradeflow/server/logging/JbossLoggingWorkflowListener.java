package io.gradeflow.server.logging;

import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.review.ReviewRequest;
import io.gradeflow.core.run.WorkflowRun;
import io.gradeflow.core.workflow.WorkflowListener;
import java.time.Duration;
import org.jboss.logging.Logger;

/// Writes run lifecycle events through JBoss Logging.
///
/// Registered by {@link io.gradeflow.server.config.GradeflowEnvironmentProducer} in place
/// of the core's `java.util.logging` listener so that server logs share one backend.
public class JbossLoggingWorkflowListener implements WorkflowListener {

    private static final Logger LOG = Logger.getLogger(JbossLoggingWorkflowListener.class);

    @Override
    public void onRunSubmitted(WorkflowRun run) {
        LOG.infov("Run submitted: {0}", run.runId());
    }

    @Override
    public void onNodeStarted(String runId, String node, int attempt) {
        LOG.infov("[{0}] node {1} started (attempt {2})", runId, node, attempt);
    }

    @Override
    public void onNodeCompleted(String runId, String node, Duration elapsed) {
        LOG.infov("[{0}] node {1} completed in {2}ms", runId, node, elapsed.toMillis());
    }

    @Override
    public void onTaskUpdate(String runId, GradingTask task) {
        if (LOG.isDebugEnabled()) {
            LOG.debugv(
                    "[{0}] task {1} ({2}) {3}, retries {4}",
                    runId, task.taskId(), task.studentKey(), task.status(), task.retryCount());
        }
    }

    @Override
    public void onSuspended(String runId, ReviewRequest review) {
        LOG.infov("[{0}] suspended at {1}: {2}", runId, review.gate(), review.reasons());
    }

    @Override
    public void onRunCompleted(WorkflowRun run) {
        LOG.infov("Run completed: {0}", run.runId());
    }

    @Override
    public void onRunFailed(String runId, String node, String detail) {
        LOG.errorv("[{0}] failed at {1}: {2}", runId, node, detail);
    }

    @Override
    public void onRunBlocked(String runId, String node, String detail) {
        LOG.warnv("[{0}] blocked at {1}, resubmission required: {2}", runId, node, detail);
    }

    @Override
    public void onRunCancelled(String runId, String detail) {
        LOG.infov("[{0}] cancelled: {1}", runId, detail);
    }
}
