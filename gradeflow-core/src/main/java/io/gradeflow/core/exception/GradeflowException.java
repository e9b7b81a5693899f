package io.gradeflow.core.exception;

import java.io.Serial;

/// Root of the unchecked exceptions raised by the grading workflow core.
///
/// Subclasses identify the failure class so callers can tell apart problems with the
/// submission, with a reviewer's decision and with a run that does not exist.
public class GradeflowException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4126813904527710833L;

    public GradeflowException(String message) {
        super(message);
    }

    public GradeflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
