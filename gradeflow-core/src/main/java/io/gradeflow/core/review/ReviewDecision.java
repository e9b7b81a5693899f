package io.gradeflow.core.review;

import java.util.Objects;

/// External decision that releases a run suspended at a review gate.
///
/// Every decision names the gate it answers, so a decision delivered twice, or delivered
/// after the run has moved on, is recognized instead of being applied to a later gate.
///
/// ### Permitted Subtypes
/// - {@link Approve} - accept the reviewed value as is
/// - {@link Edit} - replace the reviewed value with a corrected one
/// - {@link Reject} - abort the run
///
/// @see ReviewGate for how decisions are validated and merged
public sealed interface ReviewDecision {

    /// Returns the gate node the decision answers.
    String gate();

    /// Approval of the reviewed value.
    ///
    /// @param gate gate node name, not null
    /// @param comment reviewer note, may be null
    record Approve(String gate, String comment) implements ReviewDecision {

        public Approve {
            Objects.requireNonNull(gate, "gate must not be null");
        }

        public Approve(String gate) {
            this(gate, null);
        }
    }

    /// Replacement of the reviewed value.
    ///
    /// The edited value must have the reviewed field's type, e.g. a `RubricTree` at
    /// `rubric_review` or a `GradingReport` at `result_review`.
    ///
    /// @param gate gate node name, not null
    /// @param editedValue corrected value, not null
    /// @param comment reviewer note, may be null
    record Edit(String gate, Object editedValue, String comment) implements ReviewDecision {

        public Edit {
            Objects.requireNonNull(gate, "gate must not be null");
            Objects.requireNonNull(editedValue, "editedValue must not be null");
        }
    }

    /// Rejection that aborts the run.
    ///
    /// @param gate gate node name, not null
    /// @param reason why the run is aborted, not null
    record Reject(String gate, String reason) implements ReviewDecision {

        public Reject {
            Objects.requireNonNull(gate, "gate must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
