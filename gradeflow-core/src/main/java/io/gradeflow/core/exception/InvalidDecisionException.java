package io.gradeflow.core.exception;

import java.io.Serial;

/// Thrown when a review decision cannot be applied to a run.
///
/// Covers decisions addressed to a gate the run is not waiting at, edits whose payload
/// type does not match the reviewed value, and resumes of runs that are not suspended.
public class InvalidDecisionException extends GradeflowException {

    @Serial private static final long serialVersionUID = -1730086611352204962L;

    public InvalidDecisionException(String message) {
        super(message);
    }
}
