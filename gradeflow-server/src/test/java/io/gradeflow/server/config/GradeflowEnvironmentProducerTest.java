package io.gradeflow.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.gradeflow.core.GradeflowEnvironment;
import io.gradeflow.core.checkpoint.InMemoryCheckpointStore;
import io.gradeflow.core.document.PageRasterizer;
import io.gradeflow.core.export.ResultExporter;
import io.gradeflow.core.grading.GradingCapability;
import io.gradeflow.core.rubric.RubricExtractor;
import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.segment.PageIndexer;
import io.gradeflow.core.workflow.WorkflowListener;
import io.gradeflow.server.ScriptedGrading;
import io.gradeflow.server.persistence.JdbcCheckpointStore;
import jakarta.enterprise.inject.Instance;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import javax.sql.DataSource;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.sqlite.SQLiteDataSource;

@DisplayName("GradeflowEnvironmentProducer")
@ExtendWith(MockitoExtension.class)
class GradeflowEnvironmentProducerTest {

    @Mock private Config config;
    @Mock private Instance<DataSource> dataSourceInstance;
    @Mock private Instance<PageRasterizer> rasterizer;
    @Mock private Instance<RubricExtractor> rubricExtractor;
    @Mock private Instance<PageIndexer> pageIndexer;
    @Mock private Instance<GradingCapability> gradingCapability;
    @Mock private Instance<ResultExporter> exporterInstance;
    @Mock private Instance<WorkflowListener> listeners;
    @Mock private WorkflowListener cdiListener;

    @TempDir Path tempDir;

    private GradeflowEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        producer = new GradeflowEnvironmentProducer();
        producer.config = config;
        producer.dataSourceInstance = dataSourceInstance;
        producer.rasterizer = rasterizer;
        producer.rubricExtractor = rubricExtractor;
        producer.pageIndexer = pageIndexer;
        producer.gradingCapability = gradingCapability;
        producer.exporterInstance = exporterInstance;
        producer.listeners = listeners;
    }

    @AfterEach
    void tearDown() {
        producer.cleanup();
    }

    private static <T> void resolvable(Instance<T> instance, T bean) {
        when(instance.isResolvable()).thenReturn(true);
        when(instance.get()).thenReturn(bean);
    }

    private void scriptedCollaborators() {
        resolvable(rasterizer, ScriptedGrading.rasterizer());
        resolvable(rubricExtractor, ScriptedGrading.extractor());
        resolvable(pageIndexer, ScriptedGrading.indexer());
        resolvable(gradingCapability, ScriptedGrading.grader());
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("copies only gradeflow.* keys from MicroProfile Config")
        void shouldExtractGradeflowProperties() {
            when(config.getPropertyNames())
                    .thenReturn(List.of("gradeflow.dispatch.max-workers", "quarkus.http.port"));
            when(config.getOptionalValue("gradeflow.dispatch.max-workers", String.class))
                    .thenReturn(Optional.of("3"));

            Properties properties = producer.extractGradeflowProperties();

            assertThat(properties).containsOnlyKeys("gradeflow.dispatch.max-workers");
            assertThat(properties.getProperty("gradeflow.dispatch.max-workers")).isEqualTo("3");
        }

        @Test
        @DisplayName("applies configured values to the environment")
        void shouldApplyConfiguredValues() {
            when(config.getPropertyNames()).thenReturn(List.of("gradeflow.dispatch.max-workers"));
            when(config.getOptionalValue("gradeflow.dispatch.max-workers", String.class))
                    .thenReturn(Optional.of("3"));
            scriptedCollaborators();
            when(listeners.iterator()).thenReturn(List.<WorkflowListener>of().iterator());

            GradeflowEnvironment env = producer.gradeflowEnvironment();

            assertThat(env.getConfig().getMaxWorkers()).isEqualTo(3);
        }

        @Test
        @DisplayName("fails when a grading collaborator bean is missing")
        void shouldFailWithoutGradingCapability() {
            when(config.getPropertyNames()).thenReturn(List.of());
            resolvable(rasterizer, ScriptedGrading.rasterizer());
            resolvable(rubricExtractor, ScriptedGrading.extractor());
            resolvable(pageIndexer, ScriptedGrading.indexer());
            when(gradingCapability.isResolvable()).thenReturn(false);

            assertThatThrownBy(() -> producer.gradeflowEnvironment())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No unique GradingCapability bean is available");
        }
    }

    @Nested
    @DisplayName("checkpoint store")
    class Store {

        @BeforeEach
        void collaborators() {
            when(config.getPropertyNames()).thenReturn(List.of());
            scriptedCollaborators();
            when(listeners.iterator()).thenReturn(List.<WorkflowListener>of().iterator());
        }

        @Test
        @DisplayName("uses JDBC when a DataSource bean exists")
        void shouldUseJdbcStoreWithDataSource() {
            SQLiteDataSource sqlite = new SQLiteDataSource();
            sqlite.setUrl("jdbc:sqlite:" + tempDir.resolve("runs.db"));
            resolvable(dataSourceInstance, sqlite);

            GradeflowEnvironment env = producer.gradeflowEnvironment();

            assertThat(env.getCheckpointStore()).isInstanceOf(JdbcCheckpointStore.class);
            assertThat(env.getCheckpointStore().findByStatus(RunStatus.RUNNING)).isEmpty();
        }

        @Test
        @DisplayName("falls back to memory without a DataSource")
        void shouldUseInMemoryStoreWithoutDataSource() {
            when(dataSourceInstance.isResolvable()).thenReturn(false);

            GradeflowEnvironment env = producer.gradeflowEnvironment();

            assertThat(env.getCheckpointStore()).isInstanceOf(InMemoryCheckpointStore.class);
        }

        @Test
        @DisplayName("ignores the DataSource when JDBC is disabled")
        void shouldSkipJdbcWhenDisabled() {
            when(config.getOptionalValue(
                            GradeflowEnvironmentProducer.JDBC_ENABLED_KEY, Boolean.class))
                    .thenReturn(Optional.of(false));

            GradeflowEnvironment env = producer.gradeflowEnvironment();

            assertThat(env.getCheckpointStore()).isInstanceOf(InMemoryCheckpointStore.class);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("registers CDI listeners and closes the environment on shutdown")
        void shouldRegisterListenersAndClose() throws Exception {
            when(config.getPropertyNames()).thenReturn(List.of());
            scriptedCollaborators();
            when(listeners.iterator()).thenReturn(List.of(cdiListener).iterator());

            GradeflowEnvironment env = producer.gradeflowEnvironment();
            String runId = env.getEngine().submit(ScriptedGrading.submission());
            env.getEngine().awaitSettled(runId, Duration.ofSeconds(10));

            verify(cdiListener, timeout(1000)).onRunCompleted(any());

            producer.cleanup();
            assertThat(env.getExecutorService().isShutdown()).isTrue();
        }
    }
}
