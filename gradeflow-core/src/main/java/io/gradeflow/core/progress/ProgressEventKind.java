package io.gradeflow.core.progress;

/// Kinds of progress events published for a run.
public enum ProgressEventKind {
    NODE_STARTED("node_started"),
    NODE_COMPLETED("node_completed"),
    TASK_UPDATE("task_update"),
    REVIEW_REQUIRED("review_required"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    ProgressEventKind(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name transports put on the wire, e.g. `task_update`.
    public String wireName() {
        return wireName;
    }

    /// Returns whether no further event follows this one for the run.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
