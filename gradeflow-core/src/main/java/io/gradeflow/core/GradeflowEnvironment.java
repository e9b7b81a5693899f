package io.gradeflow.core;

import io.gradeflow.core.checkpoint.CheckpointStore;
import io.gradeflow.core.progress.ProgressBroadcaster;
import io.gradeflow.core.workflow.GradingWorkflow;
import io.gradeflow.core.workflow.WorkflowEngine;
import java.util.concurrent.ExecutorService;

/// Container holding the wired grading components.
///
/// Implements {@link AutoCloseable} to release the shared thread pool.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link GradeflowFactory.Builder} rather than directly.
/// @see GradeflowFactory
public final class GradeflowEnvironment implements AutoCloseable {

    private final GradeflowConfig config;
    private final WorkflowEngine engine;
    private final GradingWorkflow workflow;
    private final CheckpointStore checkpointStore;
    private final ProgressBroadcaster broadcaster;
    private final ExecutorService executorService;

    public GradeflowEnvironment(
            GradeflowConfig config,
            WorkflowEngine engine,
            GradingWorkflow workflow,
            CheckpointStore checkpointStore,
            ProgressBroadcaster broadcaster,
            ExecutorService executorService) {
        this.config = config;
        this.engine = engine;
        this.workflow = workflow;
        this.checkpointStore = checkpointStore;
        this.broadcaster = broadcaster;
        this.executorService = executorService;
    }

    public GradeflowConfig getConfig() {
        return config;
    }

    /// Returns the engine that accepts submissions and decisions.
    ///
    /// @return the engine, never null
    public WorkflowEngine getEngine() {
        return engine;
    }

    public GradingWorkflow getWorkflow() {
        return workflow;
    }

    public CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }

    public ProgressBroadcaster getBroadcaster() {
        return broadcaster;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts down the thread pool.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block. Running grading
    /// tasks finish; runs suspended at a gate stay in the checkpoint store.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
