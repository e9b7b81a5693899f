package io.gradeflow.core.grading;

import io.gradeflow.core.document.Page;
import io.gradeflow.core.rubric.RubricTree;
import java.util.List;
import java.util.Objects;

/// Input handed to the grading capability for one task.
///
/// @param runId owning run, not null
/// @param taskId task identifier, not null
/// @param studentKey student the pages belong to, not null
/// @param pages pages to grade, in order, not empty
/// @param rubric rubric to grade against, not null
/// @param attempt attempt number, starting at 1
public record GradingRequest(
        String runId,
        String taskId,
        String studentKey,
        List<Page> pages,
        RubricTree rubric,
        int attempt) {

    public GradingRequest {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(studentKey, "studentKey must not be null");
        Objects.requireNonNull(rubric, "rubric must not be null");
        pages = pages != null ? List.copyOf(pages) : List.of();
    }
}
