package io.gradeflow.core.run;

/// Lifecycle status of a {@link WorkflowRun}.
///
/// ```
/// PENDING ──► RUNNING ──► COMPLETED
///   ▲            │  ▲
///   │            │  └── resume ──┐
///   │            ├──► SUSPENDED ─┘
///   │            ├──► FAILED
///   └ mismatch ──┤
///                └──► CANCELLED
/// ```
public enum RunStatus {
    PENDING,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED,
    CANCELLED;

    /// Returns whether no further node can execute for a run in this status.
    ///
    /// @return true for `COMPLETED`, `FAILED` and `CANCELLED`
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
