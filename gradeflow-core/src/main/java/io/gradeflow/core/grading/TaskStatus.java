package io.gradeflow.core.grading;

/// Status of a {@link GradingTask}.
public enum TaskStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
