package io.gradeflow.core.export;

import io.gradeflow.core.aggregate.GradingReport;
import java.time.Instant;

/// Destination of finished grading reports, e.g. a gradebook or a file store.
///
/// Called once by the `export` node with the report as approved at `result_review`.
@FunctionalInterface
public interface ResultExporter {

    /// Exports a report.
    ///
    /// @param runId run the report belongs to, not null
    /// @param report final report, not null
    /// @return receipt recorded in the run state, never null
    ExportReceipt export(String runId, GradingReport report);

    /// Returns an exporter that keeps the report in the run state only.
    static ResultExporter inMemory() {
        return (runId, report) ->
                new ExportReceipt("memory:" + runId, Instant.now(), report.students().size());
    }
}
