package io.gradeflow.core.rubric;

import java.util.Objects;

/// Result of one rubric quality check.
///
/// @param name check name, e.g. `expected_total` or `points_sum:7`, not null
/// @param passed whether the check passed
/// @param severity how much a failure matters, not null
/// @param message human-readable detail, not null
public record QualityCheck(String name, boolean passed, Severity severity, String message) {

    public QualityCheck {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        message = message != null ? message : "";
    }

    public static QualityCheck pass(String name, String message) {
        return new QualityCheck(name, true, Severity.INFO, message);
    }

    public static QualityCheck fail(String name, Severity severity, String message) {
        return new QualityCheck(name, false, severity, message);
    }

    public enum Severity {
        INFO,
        CAUTION,
        ERROR
    }
}
