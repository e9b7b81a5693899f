package io.gradeflow.core.rubric;

import io.gradeflow.core.exception.GradeflowException;
import java.io.Serial;

/// Thrown when the parsed rubric total differs from the total declared at submission.
///
/// This is a hard stop: the run is parked in `PENDING` and needs a corrected submission.
public class RubricScoreMismatchException extends GradeflowException {

    @Serial private static final long serialVersionUID = 2207719563341460177L;

    private final double expectedTotal;
    private final double parsedTotal;
    private final transient RubricTree rubric;

    public RubricScoreMismatchException(double expectedTotal, double parsedTotal, RubricTree rubric) {
        super(
                "Parsed rubric total "
                        + parsedTotal
                        + " does not match declared total "
                        + expectedTotal);
        this.expectedTotal = expectedTotal;
        this.parsedTotal = parsedTotal;
        this.rubric = rubric;
    }

    public double getExpectedTotal() {
        return expectedTotal;
    }

    public double getParsedTotal() {
        return parsedTotal;
    }

    /// Returns the rubric as parsed, for showing the user what was read.
    public RubricTree getRubric() {
        return rubric;
    }
}
