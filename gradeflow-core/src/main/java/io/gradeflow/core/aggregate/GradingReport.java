package io.gradeflow.core.aggregate;

import java.util.List;
import java.util.Objects;

/// Everything the aggregate node produces: per-student results plus the class summary.
///
/// @param students results in segment order, not null
/// @param summary class statistics, not null
public record GradingReport(List<AggregatedResult> students, ClassSummary summary) {

    public GradingReport {
        students = students != null ? List.copyOf(students) : List.of();
        Objects.requireNonNull(summary, "summary must not be null");
    }

    public List<AggregatedResult> flagged() {
        return students.stream().filter(AggregatedResult::needsReview).toList();
    }
}
