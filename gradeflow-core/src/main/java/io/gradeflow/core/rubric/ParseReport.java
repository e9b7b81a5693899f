package io.gradeflow.core.rubric;

import java.util.List;

/// Self-report produced with a parsed rubric.
///
/// @param confidence overall parse confidence in `[0, 1]`
/// @param status overall verdict derived from the failed checks, not null
/// @param checks every quality check run, not null
/// @param notes free-text uncertainty notes, not null
/// @param fallbackUsed whether the configured fallback rubric replaced a failed extraction
public record ParseReport(
        double confidence,
        Status status,
        List<QualityCheck> checks,
        List<String> notes,
        boolean fallbackUsed) {

    public ParseReport {
        status = status != null ? status : Status.OK;
        checks = checks != null ? List.copyOf(checks) : List.of();
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    /// Returns the failed checks.
    public List<QualityCheck> failedChecks() {
        return checks.stream().filter(c -> !c.passed()).toList();
    }

    /// Returns whether a failed check with the given name is recorded.
    public boolean isFlagged(String checkName) {
        return checks.stream().anyMatch(c -> !c.passed() && c.name().equals(checkName));
    }

    public enum Status {
        OK,
        CAUTION,
        ERROR
    }
}
