package io.gradeflow.core.run;

import io.gradeflow.core.review.ReviewRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Checkpointed record of one grading run.
///
/// Instances are immutable; every transition returns a copy with a fresh `updatedAt`. Only
/// the engine creates transitions.
///
/// ### Contracts
/// - **Invariant**: `currentNode` is non-null for every non-terminal status
/// - **Invariant**: `pendingReview` is non-null only while `SUSPENDED`
/// - **Invariant**: `lastSequence` never decreases
///
/// @param runId unique run identifier, not null
/// @param currentNode node to execute next, or the gate the run waits at; null once terminal
/// @param status lifecycle status, not null
/// @param createdAt submission time, not null
/// @param updatedAt time of the last transition, not null
/// @param state accumulated node outputs, not null
/// @param executions node attempt history in execution order, not null
/// @param lastSequence highest progress event sequence issued for the run
/// @param errorDetail failure or block reason, may be null
/// @param pendingReview open review request, may be null
public record WorkflowRun(
        String runId,
        String currentNode,
        RunStatus status,
        Instant createdAt,
        Instant updatedAt,
        RunState state,
        List<NodeExecution> executions,
        long lastSequence,
        String errorDetail,
        ReviewRequest pendingReview) {

    public WorkflowRun {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        state = state != null ? state : RunState.empty();
        executions = executions != null ? List.copyOf(executions) : List.of();
        if (!status.isTerminal() && currentNode == null) {
            throw new IllegalArgumentException("A " + status + " run needs a current node");
        }
    }

    /// Creates a freshly submitted run positioned at its first node.
    public static WorkflowRun submitted(String runId, String firstNode, RunState state) {
        Instant now = Instant.now();
        return new WorkflowRun(
                runId, firstNode, RunStatus.PENDING, now, now, state, List.of(), 0, null, null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /// Returns whether the run was stopped before completing and waits for a new submission,
    /// e.g. after a rubric total mismatch.
    public boolean isBlocked() {
        return status == RunStatus.PENDING && errorDetail != null;
    }

    /// Returns the attempt number the next execution of `nodeName` will carry.
    public int nextAttempt(String nodeName) {
        int max = 0;
        for (NodeExecution execution : executions) {
            if (execution.nodeName().equals(nodeName)) {
                max = Math.max(max, execution.attempt());
            }
        }
        return max + 1;
    }

    public WorkflowRun running(String node) {
        return new WorkflowRun(
                runId, node, RunStatus.RUNNING, createdAt, Instant.now(), state, executions,
                lastSequence, null, null);
    }

    public WorkflowRun suspended(ReviewRequest review) {
        Objects.requireNonNull(review, "review must not be null");
        return new WorkflowRun(
                runId, review.gate(), RunStatus.SUSPENDED, createdAt, Instant.now(), state,
                executions, lastSequence, null, review);
    }

    public WorkflowRun completed() {
        return terminal(RunStatus.COMPLETED, null);
    }

    public WorkflowRun failed(String detail) {
        return terminal(RunStatus.FAILED, detail);
    }

    public WorkflowRun cancelled(String detail) {
        return terminal(RunStatus.CANCELLED, detail);
    }

    /// Returns the run stopped at `node` in `PENDING` with the reason recorded.
    public WorkflowRun blocked(String node, String detail) {
        return new WorkflowRun(
                runId, node, RunStatus.PENDING, createdAt, Instant.now(), state, executions,
                lastSequence, detail, null);
    }

    public WorkflowRun withState(RunState newState) {
        return new WorkflowRun(
                runId, currentNode, status, createdAt, Instant.now(), newState, executions,
                lastSequence, errorDetail, pendingReview);
    }

    public WorkflowRun withExecution(NodeExecution execution) {
        List<NodeExecution> history = new ArrayList<>(executions);
        history.add(Objects.requireNonNull(execution, "execution must not be null"));
        return new WorkflowRun(
                runId, currentNode, status, createdAt, Instant.now(), state, history,
                lastSequence, errorDetail, pendingReview);
    }

    public WorkflowRun withLastSequence(long sequence) {
        return new WorkflowRun(
                runId, currentNode, status, createdAt, updatedAt, state, executions,
                Math.max(lastSequence, sequence), errorDetail, pendingReview);
    }

    private WorkflowRun terminal(RunStatus terminal, String detail) {
        return new WorkflowRun(
                runId, null, terminal, createdAt, Instant.now(), state, executions, lastSequence,
                detail, null);
    }
}
