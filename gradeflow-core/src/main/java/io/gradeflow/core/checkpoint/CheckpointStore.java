package io.gradeflow.core.checkpoint;

import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.WorkflowRun;
import java.util.List;
import java.util.Optional;

/// Durable key-value record of run state, keyed by run id.
///
/// The engine writes a checkpoint after every node transition and reloads it to resume a
/// suspended run or to re-enter a run interrupted by a crash. Only the latest `save` per run
/// needs to survive; implementations keep one record per run.
///
/// ### Usage
/// {@snippet :
/// store.save(run.runId(), run);
///
/// Optional<WorkflowRun> restored = store.load(runId);
/// restored.ifPresent(r -> engine.resume(r.runId(), decision));
/// }
///
/// @implNote Implementations must be safe for concurrent use across runs. The engine
/// linearizes writes for a single run.
/// @see InMemoryCheckpointStore for the default implementation
public interface CheckpointStore {

    /// Saves the run, replacing any earlier checkpoint with the same id.
    ///
    /// @param runId the run identifier, not null
    /// @param run the state to persist, not null
    /// @throws NullPointerException if an argument is null
    /// @throws IllegalArgumentException if `runId` differs from `run.runId()`
    void save(String runId, WorkflowRun run);

    /// Loads the latest checkpoint of a run.
    ///
    /// @param runId the run identifier, not null
    /// @return the checkpoint if one exists, empty otherwise
    Optional<WorkflowRun> load(String runId);

    /// Deletes a run's checkpoint.
    ///
    /// @param runId the run identifier, not null
    /// @return true if a checkpoint was removed
    boolean delete(String runId);

    /// Lists checkpoints in the given status, oldest first.
    ///
    /// Used on startup to find runs a crashed process left `RUNNING`.
    ///
    /// @param status the status to match, not null
    /// @return matching runs, never null
    List<WorkflowRun> findByStatus(RunStatus status);
}
