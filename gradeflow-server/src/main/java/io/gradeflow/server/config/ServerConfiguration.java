package io.gradeflow.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gradeflow.core.GradeflowEnvironment;
import io.gradeflow.core.checkpoint.CheckpointStore;
import io.gradeflow.core.workflow.WorkflowEngine;
import io.gradeflow.serialization.CheckpointSerializer;
import io.gradeflow.server.streaming.RunEventStreams;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server beans.
///
/// The environment itself comes from {@link GradeflowEnvironmentProducer}; this class
/// exposes its parts for direct injection.
@ApplicationScoped
public class ServerConfiguration {

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return CheckpointSerializer.createMapper();
    }

    @Produces
    @Singleton
    public WorkflowEngine workflowEngine(GradeflowEnvironment env) {
        return env.getEngine();
    }

    @Produces
    @Singleton
    public CheckpointStore checkpointStore(GradeflowEnvironment env) {
        return env.getCheckpointStore();
    }

    /// Produces the reactive event streams, pumping on the environment's thread pool.
    ///
    /// @param env the initialized environment, not null
    /// @return the streams, never null
    @Produces
    @Singleton
    public RunEventStreams runEventStreams(GradeflowEnvironment env) {
        return new RunEventStreams(env.getEngine(), env.getExecutorService());
    }
}
