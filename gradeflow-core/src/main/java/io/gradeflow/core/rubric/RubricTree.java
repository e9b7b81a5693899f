package io.gradeflow.core.rubric;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Parsed grading standard: ordered top-level questions plus the parser's self-report.
///
/// ### Contracts
/// - **Invariant**: `totalScore` equals the sum of the questions' `maxScore`
/// - **Invariant**: a question whose points do not add up to its `maxScore` is flagged in
///   the report under `points_sum:<questionId>`
///
/// @param questions top-level questions in order, not null
/// @param totalScore sum of question maxima
/// @param report parse self-report, not null
public record RubricTree(List<RubricQuestion> questions, double totalScore, ParseReport report) {

    private static final double EPSILON = 1e-6;

    public RubricTree {
        questions = questions != null ? List.copyOf(questions) : List.of();
        Objects.requireNonNull(report, "report must not be null");
        double sum = sumOf(questions);
        if (Math.abs(sum - totalScore) > EPSILON) {
            throw new IllegalArgumentException(
                    "totalScore " + totalScore + " does not match question maxima sum " + sum);
        }
    }

    /// Creates a tree whose total is recomputed from the questions.
    public static RubricTree of(List<RubricQuestion> questions, ParseReport report) {
        return new RubricTree(questions, sumOf(questions), report);
    }

    public Optional<RubricQuestion> question(String questionId) {
        return questions.stream().filter(q -> q.questionId().equals(questionId)).findFirst();
    }

    public int questionCount() {
        return questions.size();
    }

    private static double sumOf(List<RubricQuestion> questions) {
        return questions == null
                ? 0
                : questions.stream().mapToDouble(RubricQuestion::maxScore).sum();
    }
}
