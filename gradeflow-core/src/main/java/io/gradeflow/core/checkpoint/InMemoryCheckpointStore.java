package io.gradeflow.core.checkpoint;

import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.WorkflowRun;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory checkpoint store (default implementation).
///
/// Thread-safe, no external dependencies. Checkpoints do not survive the process.
///
/// @see CheckpointStore for contract
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, WorkflowRun> storage = new ConcurrentHashMap<>();

    @Override
    public void save(String runId, WorkflowRun run) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(run, "run must not be null");
        if (!runId.equals(run.runId())) {
            throw new IllegalArgumentException(
                    "Checkpoint key " + runId + " does not match run " + run.runId());
        }
        storage.put(runId, run);
    }

    @Override
    public Optional<WorkflowRun> load(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return Optional.ofNullable(storage.get(runId));
    }

    @Override
    public boolean delete(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return storage.remove(runId) != null;
    }

    @Override
    public List<WorkflowRun> findByStatus(RunStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return storage.values().stream()
                .filter(run -> run.status() == status)
                .sorted(Comparator.comparing(WorkflowRun::createdAt))
                .toList();
    }

    /// Returns the number of stored checkpoints (useful for testing).
    public int size() {
        return storage.size();
    }
}
