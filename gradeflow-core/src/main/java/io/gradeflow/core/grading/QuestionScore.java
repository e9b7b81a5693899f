package io.gradeflow.core.grading;

import java.util.List;
import java.util.Objects;

/// Grade awarded for one question.
///
/// @param questionId canonical question id, not null
/// @param score points awarded
/// @param maxScore points available
/// @param confidence grader confidence in `[0, 1]`
/// @param feedback grader's reasoning, not null
/// @param earnedPoints ids of scoring points awarded in full, not null
/// @param missedPoints ids of scoring points not awarded, not null
public record QuestionScore(
        String questionId,
        double score,
        double maxScore,
        double confidence,
        String feedback,
        List<String> earnedPoints,
        List<String> missedPoints) {

    public QuestionScore {
        Objects.requireNonNull(questionId, "questionId must not be null");
        feedback = feedback != null ? feedback : "";
        earnedPoints = earnedPoints != null ? List.copyOf(earnedPoints) : List.of();
        missedPoints = missedPoints != null ? List.copyOf(missedPoints) : List.of();
    }

    /// Returns a copy with the score capped at `cap`.
    public QuestionScore cappedAt(double cap) {
        if (score <= cap) {
            return this;
        }
        return new QuestionScore(
                questionId, cap, cap, confidence, feedback, earnedPoints, missedPoints);
    }
}
