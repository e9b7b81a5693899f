package io.gradeflow.core.rubric;

import java.util.List;
import java.util.Objects;

/// A top-level rubric question with its scoring points.
///
/// @param questionId canonical id, see {@link QuestionIds}, not null
/// @param description question text or title, not null
/// @param maxScore points available for the question
/// @param points scoring points in rubric order, not null
/// @param standardAnswer reference answer, may be null
/// @param confidence extraction confidence in `[0, 1]`
public record RubricQuestion(
        String questionId,
        String description,
        double maxScore,
        List<ScoringPoint> points,
        String standardAnswer,
        double confidence) {

    public RubricQuestion {
        Objects.requireNonNull(questionId, "questionId must not be null");
        description = description != null ? description : "";
        points = points != null ? List.copyOf(points) : List.of();
        if (maxScore < 0) {
            throw new IllegalArgumentException(
                    "maxScore must be >= 0 for question " + questionId);
        }
    }

    /// Returns the sum of the scoring points' maxima.
    public double pointsTotal() {
        return points.stream().mapToDouble(ScoringPoint::maxScore).sum();
    }
}
