package io.gradeflow.core.review;

import io.gradeflow.core.exception.InvalidDecisionException;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.StateKey;
import io.gradeflow.core.run.StatePatch;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Interrupt point that asks a human to check one state field before the run proceeds.
///
/// The gate inspects the state when the engine reaches it. If no review reason applies the
/// gate approves automatically; otherwise the engine suspends the run with the
/// {@link ReviewRequest} from {@link #evaluate}. A decision is turned into a state patch
/// holding a {@link ReviewRecord} and, for edits, the corrected value under a separate
/// field, so the originally parsed value is never overwritten.
///
/// ### Usage
/// {@snippet :
/// ReviewGate<RubricTree> gate =
///         new ReviewGate<>("rubric_review", RUBRIC, RUBRIC_EDITED, RUBRIC_REVIEW, reasons);
/// RubricTree rubric = gate.effectiveValue(state); // edited value if present
/// }
///
/// @param <T> type of the reviewed value
public final class ReviewGate<T> {

    private final String name;
    private final StateKey<T> reviewedKey;
    private final StateKey<T> editedKey;
    private final StateKey<ReviewRecord> recordKey;
    private final Function<RunState, List<String>> reasons;

    /// Creates a gate.
    ///
    /// @param name gate node name, not null
    /// @param reviewedKey field the reviewer checks, not null
    /// @param editedKey field receiving an edited value, not null
    /// @param recordKey field receiving the decision record, not null
    /// @param reasons returns why review is needed; empty means auto-approve, not null
    public ReviewGate(
            String name,
            StateKey<T> reviewedKey,
            StateKey<T> editedKey,
            StateKey<ReviewRecord> recordKey,
            Function<RunState, List<String>> reasons) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.reviewedKey = Objects.requireNonNull(reviewedKey, "reviewedKey must not be null");
        this.editedKey = Objects.requireNonNull(editedKey, "editedKey must not be null");
        this.recordKey = Objects.requireNonNull(recordKey, "recordKey must not be null");
        this.reasons = Objects.requireNonNull(reasons, "reasons must not be null");
    }

    /// Decides whether the run must stop here.
    ///
    /// @param state accumulated state at the gate, not null
    /// @return the review request, or empty to approve automatically
    public Optional<ReviewRequest> evaluate(RunState state) {
        List<String> found = reasons.apply(state);
        if (found == null || found.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ReviewRequest(name, reviewedKey.name(), found, Instant.now()));
    }

    public StatePatch autoApprove() {
        return StatePatch.of(
                recordKey,
                new ReviewRecord(name, ReviewRecord.Action.AUTO_APPROVED, null, Instant.now()));
    }

    /// Converts a decision into the gate's output.
    ///
    /// @param decision the reviewer's decision, not null
    /// @return patch holding the decision record and any edited value, never null
    /// @throws InvalidDecisionException if the decision names another gate or an edit carries
    ///     a value of the wrong type
    public StatePatch apply(ReviewDecision decision) {
        Objects.requireNonNull(decision, "decision must not be null");
        if (!name.equals(decision.gate())) {
            throw new InvalidDecisionException(
                    "Decision for " + decision.gate() + " cannot be applied at " + name);
        }
        Instant now = Instant.now();
        if (decision instanceof ReviewDecision.Edit edit) {
            if (!reviewedKey.type().isInstance(edit.editedValue())) {
                throw new InvalidDecisionException(
                        "Edit at " + name + " must carry a " + reviewedKey.type().getSimpleName()
                                + ", got " + edit.editedValue().getClass().getSimpleName());
            }
            return StatePatch.of(
                            recordKey,
                            new ReviewRecord(name, ReviewRecord.Action.EDITED, edit.comment(), now))
                    .and(editedKey, reviewedKey.cast(edit.editedValue()));
        }
        if (decision instanceof ReviewDecision.Reject reject) {
            return StatePatch.of(
                    recordKey,
                    new ReviewRecord(name, ReviewRecord.Action.REJECTED, reject.reason(), now));
        }
        ReviewDecision.Approve approve = (ReviewDecision.Approve) decision;
        return StatePatch.of(
                recordKey,
                new ReviewRecord(name, ReviewRecord.Action.APPROVED, approve.comment(), now));
    }

    /// Returns whether the gate has already been passed in `state`.
    public boolean isDecided(RunState state) {
        return state.has(recordKey.name());
    }

    /// Returns the reviewed value, preferring an edited one.
    ///
    /// @throws IllegalStateException if neither value is present
    public T effectiveValue(RunState state) {
        return state.get(editedKey).orElseGet(() -> state.require(reviewedKey));
    }

    public String name() {
        return name;
    }

    public StateKey<T> reviewedKey() {
        return reviewedKey;
    }

    public StateKey<ReviewRecord> recordKey() {
        return recordKey;
    }
}
