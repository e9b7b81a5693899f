package io.gradeflow.core;

import io.gradeflow.core.aggregate.ResultAggregator;
import io.gradeflow.core.checkpoint.CheckpointStore;
import io.gradeflow.core.checkpoint.InMemoryCheckpointStore;
import io.gradeflow.core.document.PageRasterizer;
import io.gradeflow.core.export.ResultExporter;
import io.gradeflow.core.grading.GradingCapability;
import io.gradeflow.core.grading.GradingDispatcher;
import io.gradeflow.core.progress.ProgressBroadcaster;
import io.gradeflow.core.rubric.RubricExtractor;
import io.gradeflow.core.rubric.RubricParser;
import io.gradeflow.core.rubric.RubricTree;
import io.gradeflow.core.segment.BoundaryDetector;
import io.gradeflow.core.segment.PageIndexer;
import io.gradeflow.core.workflow.CompositeWorkflowListener;
import io.gradeflow.core.workflow.GradingWorkflow;
import io.gradeflow.core.workflow.LoggingWorkflowListener;
import io.gradeflow.core.workflow.WorkflowEngine;
import io.gradeflow.core.workflow.WorkflowListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for wiring a {@link GradeflowEnvironment}.
///
/// The external collaborators (rasterizer, rubric extractor, page indexer and grading
/// capability) are required; everything else defaults to an in-process implementation.
///
/// ### Usage
/// {@snippet :
/// try (GradeflowEnvironment env = GradeflowFactory.builder()
///         .config(GradeflowConfig.fromProperties(properties))
///         .rasterizer(pdfRenderer)
///         .rubricExtractor(visionExtractor)
///         .pageIndexer(visionIndexer)
///         .gradingCapability(visionGrader)
///         .checkpointStore(jdbcStore)
///         .build()) {
///     String runId = env.getEngine().submit(request);
/// }
/// }
///
/// @implNote The default executor is a cached thread pool: grading workers block on the
/// capability call of a separate pool thread, so a fixed pool smaller than twice the worker
/// count could starve.
///
/// @see GradeflowEnvironment
/// @see GradeflowConfig
public final class GradeflowFactory {

    private static final Logger logger = Logger.getLogger(GradeflowFactory.class.getName());

    private GradeflowFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GradeflowEnvironment}.
    public static class Builder {
        private GradeflowConfig config = GradeflowConfig.defaults();
        private PageRasterizer rasterizer;
        private RubricExtractor rubricExtractor;
        private PageIndexer pageIndexer;
        private GradingCapability gradingCapability;
        private ResultExporter exporter = ResultExporter.inMemory();
        private CheckpointStore checkpointStore;
        private ProgressBroadcaster broadcaster;
        private ExecutorService executorService;
        private RubricTree fallbackRubric;
        private final List<WorkflowListener> listeners = new ArrayList<>();
        private boolean loggingListener = true;

        private Builder() {}

        public Builder config(GradeflowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder rasterizer(PageRasterizer rasterizer) {
            this.rasterizer = rasterizer;
            return this;
        }

        public Builder rubricExtractor(RubricExtractor rubricExtractor) {
            this.rubricExtractor = rubricExtractor;
            return this;
        }

        public Builder pageIndexer(PageIndexer pageIndexer) {
            this.pageIndexer = pageIndexer;
            return this;
        }

        public Builder gradingCapability(GradingCapability gradingCapability) {
            this.gradingCapability = gradingCapability;
            return this;
        }

        public Builder exporter(ResultExporter exporter) {
            this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
            return this;
        }

        /// Sets the checkpoint store. Defaults to {@link InMemoryCheckpointStore}.
        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder broadcaster(ProgressBroadcaster broadcaster) {
            this.broadcaster = broadcaster;
            return this;
        }

        /// Sets the thread pool for run drivers and grading tasks.
        ///
        /// The environment shuts it down on close.
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Enables degraded rubric parsing: when extraction fails, `rubric` is used instead
        /// and the run is forced through rubric review.
        ///
        /// @param rubric fallback rubric, null to disable the fallback
        /// @return this builder for chaining, never null
        public Builder fallbackRubric(RubricTree rubric) {
            this.fallbackRubric = rubric;
            return this;
        }

        public Builder listener(WorkflowListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
            return this;
        }

        /// Controls whether a {@link LoggingWorkflowListener} is registered. Enabled by default.
        public Builder loggingListener(boolean enabled) {
            this.loggingListener = enabled;
            return this;
        }

        /// Wires the environment.
        ///
        /// @return a ready environment, never null
        /// @throws IllegalStateException if a required collaborator is missing
        public GradeflowEnvironment build() {
            require(rasterizer, "rasterizer");
            require(rubricExtractor, "rubricExtractor");
            require(pageIndexer, "pageIndexer");
            require(gradingCapability, "gradingCapability");

            ExecutorService executor =
                    executorService != null ? executorService : Executors.newCachedThreadPool();
            CheckpointStore store =
                    checkpointStore != null ? checkpointStore : new InMemoryCheckpointStore();
            ProgressBroadcaster progress =
                    broadcaster != null
                            ? broadcaster
                            : new ProgressBroadcaster(config.getSubscriberBufferSize());
            if (fallbackRubric != null) {
                logger.warning("Rubric fallback enabled; extraction failures will not stop runs");
            }

            GradingWorkflow workflow =
                    new GradingWorkflow(
                            config,
                            rasterizer,
                            new RubricParser(
                                    rubricExtractor,
                                    config.getRubricPagesPerBatch(),
                                    config.getScoreTolerance(),
                                    fallbackRubric),
                            pageIndexer,
                            new BoundaryDetector(
                                    config.getMaxPagesPerSegment(),
                                    config.getConfirmationThreshold(),
                                    config.getBoundaryWeights()),
                            new GradingDispatcher(
                                    gradingCapability,
                                    executor,
                                    config.getMaxWorkers(),
                                    config.getMaxRetries(),
                                    config.getTaskTimeout(),
                                    config.getBatchSize()),
                            new ResultAggregator(
                                    config.getResultReviewThreshold(), config.getPassRatio()),
                            exporter);

            List<WorkflowListener> all = new ArrayList<>();
            if (loggingListener) {
                all.add(new LoggingWorkflowListener());
            }
            all.addAll(listeners);

            WorkflowEngine engine =
                    new WorkflowEngine(
                            workflow.definition(),
                            store,
                            progress,
                            executor,
                            CompositeWorkflowListener.of(all));
            return new GradeflowEnvironment(config, engine, workflow, store, progress, executor);
        }

        private static void require(Object collaborator, String name) {
            if (collaborator == null) {
                throw new IllegalStateException(name + " must be configured");
            }
        }
    }
}
