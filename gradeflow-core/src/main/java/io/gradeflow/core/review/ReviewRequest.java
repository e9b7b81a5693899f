package io.gradeflow.core.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Pending review persisted with a suspended run.
///
/// The reviewed value itself stays in the run state under `reviewedField`; this record
/// only says which gate is waiting and why.
///
/// @param gate name of the gate node the run is suspended at, not null
/// @param reviewedField state field the reviewer is asked to check, not null
/// @param reasons why the gate did not auto-approve, not null
/// @param requestedAt when the run was suspended, not null
public record ReviewRequest(
        String gate, String reviewedField, List<String> reasons, Instant requestedAt) {

    public ReviewRequest {
        Objects.requireNonNull(gate, "gate must not be null");
        Objects.requireNonNull(reviewedField, "reviewedField must not be null");
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        requestedAt = requestedAt != null ? requestedAt : Instant.now();
    }
}
