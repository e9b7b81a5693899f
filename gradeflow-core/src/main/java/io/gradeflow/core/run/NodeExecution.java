package io.gradeflow.core.run;

import java.time.Instant;
import java.util.Objects;

/// One attempt at executing a workflow node.
///
/// Attempts for a node are numbered from 1 and increase monotonically. A review gate that
/// suspends the run records an `INTERRUPTED` attempt; the decision that releases it records
/// the next attempt.
///
/// @param runId owning run, not null
/// @param nodeName executed node, not null
/// @param attempt attempt number, starting at 1
/// @param startedAt when the node was entered, not null
/// @param endedAt when the node returned or raised, not null
/// @param outcome how the attempt ended, not null
/// @param errorDetail failure detail, null unless the outcome is `ERROR`
public record NodeExecution(
        String runId,
        String nodeName,
        int attempt,
        Instant startedAt,
        Instant endedAt,
        Outcome outcome,
        String errorDetail) {

    public NodeExecution {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(endedAt, "endedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
    }

    public static NodeExecution ok(String runId, String nodeName, int attempt, Instant startedAt) {
        return new NodeExecution(runId, nodeName, attempt, startedAt, Instant.now(), Outcome.OK, null);
    }

    public static NodeExecution interrupted(
            String runId, String nodeName, int attempt, Instant startedAt) {
        return new NodeExecution(
                runId, nodeName, attempt, startedAt, Instant.now(), Outcome.INTERRUPTED, null);
    }

    public static NodeExecution error(
            String runId, String nodeName, int attempt, Instant startedAt, String errorDetail) {
        return new NodeExecution(
                runId, nodeName, attempt, startedAt, Instant.now(), Outcome.ERROR, errorDetail);
    }

    /// How a node attempt ended.
    public enum Outcome {
        OK,
        ERROR,
        INTERRUPTED
    }
}
