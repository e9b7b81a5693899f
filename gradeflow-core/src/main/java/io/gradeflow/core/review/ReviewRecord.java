package io.gradeflow.core.review;

import java.time.Instant;
import java.util.Objects;

/// Outcome of a review gate, stored in the run state under the gate's record field.
///
/// @param gate gate node name, not null
/// @param action what was decided, not null
/// @param comment reviewer note or rejection reason, may be null
/// @param decidedAt decision time, not null
public record ReviewRecord(String gate, Action action, String comment, Instant decidedAt) {

    public ReviewRecord {
        Objects.requireNonNull(gate, "gate must not be null");
        Objects.requireNonNull(action, "action must not be null");
        decidedAt = decidedAt != null ? decidedAt : Instant.now();
    }

    public enum Action {
        AUTO_APPROVED,
        APPROVED,
        EDITED,
        REJECTED
    }
}
