package io.gradeflow.core.grading;

import io.gradeflow.core.exception.GradeflowException;
import java.io.Serial;

/// Failure reported by a grading collaborator.
///
/// Retryable failures (rate limits, network errors, malformed model output) are retried by
/// the dispatcher; permanent ones fail the task immediately.
public class GradingException extends GradeflowException {

    @Serial private static final long serialVersionUID = -6047405148402217290L;

    private final boolean retryable;

    public GradingException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public GradingException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static GradingException transientFailure(String message, Throwable cause) {
        return new GradingException(message, true, cause);
    }

    public static GradingException permanentFailure(String message) {
        return new GradingException(message, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
