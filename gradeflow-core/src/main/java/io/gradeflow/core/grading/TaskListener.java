package io.gradeflow.core.grading;

/// Receives every task status change as it happens. Called from worker threads.
@FunctionalInterface
public interface TaskListener {

    TaskListener NONE = task -> {};

    void onTaskUpdate(GradingTask task);
}
