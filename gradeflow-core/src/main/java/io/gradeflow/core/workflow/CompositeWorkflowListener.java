package io.gradeflow.core.workflow;

import io.gradeflow.core.grading.GradingTask;
import io.gradeflow.core.review.ReviewRequest;
import io.gradeflow.core.run.WorkflowRun;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans every callback out to several listeners.
///
/// A listener that throws is logged and skipped; the remaining listeners and the run are
/// unaffected.
public final class CompositeWorkflowListener implements WorkflowListener {

    private static final Logger logger =
            Logger.getLogger(CompositeWorkflowListener.class.getName());

    private final List<WorkflowListener> delegates;

    public CompositeWorkflowListener(List<WorkflowListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    /// Returns a single listener for `listeners`. Even one delegate is wrapped so that its
    /// failures never reach the engine.
    public static WorkflowListener of(List<WorkflowListener> listeners) {
        if (listeners.isEmpty()) {
            return NOOP;
        }
        return new CompositeWorkflowListener(listeners);
    }

    @Override
    public void onRunSubmitted(WorkflowRun run) {
        each(l -> l.onRunSubmitted(run));
    }

    @Override
    public void onNodeStarted(String runId, String node, int attempt) {
        each(l -> l.onNodeStarted(runId, node, attempt));
    }

    @Override
    public void onNodeCompleted(String runId, String node, Duration elapsed) {
        each(l -> l.onNodeCompleted(runId, node, elapsed));
    }

    @Override
    public void onTaskUpdate(String runId, GradingTask task) {
        each(l -> l.onTaskUpdate(runId, task));
    }

    @Override
    public void onSuspended(String runId, ReviewRequest review) {
        each(l -> l.onSuspended(runId, review));
    }

    @Override
    public void onRunCompleted(WorkflowRun run) {
        each(l -> l.onRunCompleted(run));
    }

    @Override
    public void onRunFailed(String runId, String node, String detail) {
        each(l -> l.onRunFailed(runId, node, detail));
    }

    @Override
    public void onRunBlocked(String runId, String node, String detail) {
        each(l -> l.onRunBlocked(runId, node, detail));
    }

    @Override
    public void onRunCancelled(String runId, String detail) {
        each(l -> l.onRunCancelled(runId, detail));
    }

    private void each(Consumer<WorkflowListener> callback) {
        for (WorkflowListener delegate : delegates) {
            try {
                callback.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Workflow listener " + delegate.getClass().getName() + " failed",
                        e);
            }
        }
    }
}
