package io.gradeflow.core.grading;

import java.util.List;
import java.util.Objects;

/// One unit of dispatched grading work.
///
/// A task covers one student segment, or one ordered sub-batch of a long segment.
///
/// ### Contracts
/// - **Invariant**: `retryCount` never exceeds the dispatcher's configured maximum
/// - **Invariant**: `result` is non-null exactly when the status is `DONE`
///
/// @param taskId unique within the run, not null
/// @param studentKey owning student segment, not null
/// @param subBatch zero-based position within the segment
/// @param pages answer page indices, not empty
/// @param status current status, not null
/// @param retryCount attempts made beyond the first
/// @param result grading output, null until done
/// @param errorDetail last failure, may be null
public record GradingTask(
        String taskId,
        String studentKey,
        int subBatch,
        List<Integer> pages,
        TaskStatus status,
        int retryCount,
        GradingOutcome result,
        String errorDetail) {

    public GradingTask {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(studentKey, "studentKey must not be null");
        Objects.requireNonNull(status, "status must not be null");
        pages = pages != null ? List.copyOf(pages) : List.of();
        if (status == TaskStatus.DONE && result == null) {
            throw new IllegalArgumentException("Task " + taskId + " is done without a result");
        }
    }

    public static GradingTask queued(String taskId, String studentKey, int subBatch, List<Integer> pages) {
        return new GradingTask(taskId, studentKey, subBatch, pages, TaskStatus.QUEUED, 0, null, null);
    }

    GradingTask running(int retries) {
        return new GradingTask(
                taskId, studentKey, subBatch, pages, TaskStatus.RUNNING, retries, null, errorDetail);
    }

    GradingTask withError(String detail) {
        return new GradingTask(
                taskId, studentKey, subBatch, pages, status, retryCount, result, detail);
    }

    GradingTask done(GradingOutcome outcome) {
        return new GradingTask(
                taskId, studentKey, subBatch, pages, TaskStatus.DONE, retryCount, outcome, null);
    }

    GradingTask failed(String detail) {
        return new GradingTask(
                taskId, studentKey, subBatch, pages, TaskStatus.FAILED, retryCount, null, detail);
    }
}
