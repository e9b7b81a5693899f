package io.gradeflow.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a submission is malformed: a document is missing, a declared count is not
/// positive, or the rasterized page count differs from the declared one.
///
/// When raised from {@code WorkflowEngine.submit} no run is created.
public class InputValidationException extends GradeflowException {

    @Serial private static final long serialVersionUID = -3385520113945218476L;

    private final List<String> violations;

    public InputValidationException(List<String> violations) {
        super("Invalid submission: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InputValidationException(String violation) {
        this(List.of(violation));
    }

    /// Returns every problem found, in detection order.
    ///
    /// @return the violations, never empty
    public List<String> getViolations() {
        return violations;
    }
}
