package io.gradeflow.core.exception;

import java.io.Serial;

/// Thrown when a run id has no checkpoint.
public class RunNotFoundException extends GradeflowException {

    @Serial private static final long serialVersionUID = 7061232908874157342L;

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
