package io.gradeflow.core.grading;

/// External vision/language grading capability.
///
/// Implementations may block on network I/O; the dispatcher calls them from worker threads
/// and enforces its own timeout.
@FunctionalInterface
public interface GradingCapability {

    /// Grades the pages of one task.
    ///
    /// @param request pages plus rubric, not null
    /// @return the outcome, never null
    /// @throws GradingException if grading fails; retryable failures are retried
    GradingOutcome grade(GradingRequest request) throws GradingException;
}
