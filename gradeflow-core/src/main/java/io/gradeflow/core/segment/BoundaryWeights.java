package io.gradeflow.core.segment;

/// Weights and limits of the segment confidence score.
///
/// The three weights are normalized by their sum, so only their ratios matter.
///
/// @param monotonicity weight of how cleanly question numbers climb within a segment
/// @param questionCount weight of the match between observed and rubric question counts
/// @param restartClarity weight of how unambiguous the segment's boundaries are
/// @param unmarkedPagePenalty confidence removed per page without question numbers
/// @param ambiguityCap upper bound on the confidence of an ambiguously split segment
public record BoundaryWeights(
        double monotonicity,
        double questionCount,
        double restartClarity,
        double unmarkedPagePenalty,
        double ambiguityCap) {

    public static final BoundaryWeights DEFAULT = new BoundaryWeights(0.4, 0.3, 0.3, 0.05, 0.5);

    public BoundaryWeights {
        if (monotonicity < 0 || questionCount < 0 || restartClarity < 0) {
            throw new IllegalArgumentException("weights must be >= 0");
        }
        if (monotonicity + questionCount + restartClarity <= 0) {
            throw new IllegalArgumentException("at least one weight must be positive");
        }
    }

    double weightSum() {
        return monotonicity + questionCount + restartClarity;
    }
}
