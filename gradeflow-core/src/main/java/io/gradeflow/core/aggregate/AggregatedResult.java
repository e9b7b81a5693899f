package io.gradeflow.core.aggregate;

import io.gradeflow.core.grading.QuestionScore;
import java.util.List;
import java.util.Objects;

/// Final grade of one student.
///
/// ### Contracts
/// - **Invariant**: `score` never exceeds the sum of the per-question maxima
///
/// @param studentKey student identifier, not null
/// @param score points awarded
/// @param maxScore points available under the rubric
/// @param questions reconciled per-question grades, not null
/// @param confidence mean question confidence
/// @param lowConfidenceQuestionIds questions below the review threshold, not null
/// @param gapPages pages of failed tasks that were not graded, not null
/// @param discarded duplicate grades dropped during reconciliation, not null
/// @param needsReview whether the result must pass the review gate
public record AggregatedResult(
        String studentKey,
        double score,
        double maxScore,
        List<QuestionScore> questions,
        double confidence,
        List<String> lowConfidenceQuestionIds,
        List<Integer> gapPages,
        List<DiscardedDuplicate> discarded,
        boolean needsReview) {

    public AggregatedResult {
        Objects.requireNonNull(studentKey, "studentKey must not be null");
        questions = questions != null ? List.copyOf(questions) : List.of();
        lowConfidenceQuestionIds =
                lowConfidenceQuestionIds != null ? List.copyOf(lowConfidenceQuestionIds) : List.of();
        gapPages = gapPages != null ? List.copyOf(gapPages) : List.of();
        discarded = discarded != null ? List.copyOf(discarded) : List.of();
    }

    /// Returns whether some pages of the student could not be graded.
    public boolean isPartial() {
        return !gapPages.isEmpty();
    }

    /// Returns the score as a percentage of `maxScore`, 0 when nothing is available.
    public double percentage() {
        return maxScore > 0 ? score / maxScore * 100 : 0;
    }
}
