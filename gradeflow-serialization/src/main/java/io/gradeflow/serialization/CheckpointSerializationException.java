package io.gradeflow.serialization;

import io.gradeflow.core.exception.GradeflowException;
import java.io.Serial;

/// A checkpoint, event or review decision could not be converted to or from JSON.
public class CheckpointSerializationException extends GradeflowException {

    @Serial private static final long serialVersionUID = 4318907526113870045L;

    public CheckpointSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
