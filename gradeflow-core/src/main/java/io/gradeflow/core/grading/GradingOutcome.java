package io.gradeflow.core.grading;

import java.util.List;

/// Response of the grading capability for one task.
///
/// @param score total points awarded over the task's pages
/// @param confidence overall grader confidence in `[0, 1]`
/// @param feedback overall feedback, not null
/// @param questions per-question breakdown, not null
public record GradingOutcome(
        double score, double confidence, String feedback, List<QuestionScore> questions) {

    public GradingOutcome {
        feedback = feedback != null ? feedback : "";
        questions = questions != null ? List.copyOf(questions) : List.of();
    }
}
