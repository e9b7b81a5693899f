package io.gradeflow.core.export;

import java.time.Instant;
import java.util.Objects;

/// Proof that a finished report was handed over, stored as the run's last output.
///
/// @param location where the exporter put the report, not null
/// @param exportedAt export time, not null
/// @param studentCount number of student results exported
public record ExportReceipt(String location, Instant exportedAt, int studentCount) {

    public ExportReceipt {
        Objects.requireNonNull(location, "location must not be null");
        exportedAt = exportedAt != null ? exportedAt : Instant.now();
    }
}
