package io.gradeflow.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gradeflow.core.run.NodeExecution;
import io.gradeflow.core.run.RunState;
import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.WorkflowRun;
import io.gradeflow.core.workflow.GradingKeys;
import io.gradeflow.core.workflow.IntakeSummary;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/// Tests {@link JdbcCheckpointStore} against a SQLite database: UPSERT semantics, status
/// queries for recovery and the JSON checkpoint column.
class JdbcCheckpointStoreTest extends JdbcStoreTestBase {

    private static final Instant T0 = Instant.parse("2026-05-04T08:00:00Z");

    private JdbcCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcCheckpointStore(dataSource);
    }

    @Nested
    class SaveAndLoad {

        @Test
        void shouldRoundTripRunWithTypedState() {
            WorkflowRun run =
                    run("run-1", T0)
                            .running("preprocess")
                            .withExecution(NodeExecution.ok("run-1", "intake", 1, T0))
                            .withLastSequence(3);

            store.save("run-1", run);

            Optional<WorkflowRun> loaded = store.load("run-1");
            assertThat(loaded).contains(run);
            assertThat(loaded.get().state().require(GradingKeys.INTAKE).roster())
                    .containsExactly("Ann", "Ben");
        }

        @Test
        void shouldReplaceEarlierCheckpoint() {
            WorkflowRun run = run("run-1", T0);
            store.save("run-1", run);

            WorkflowRun completed = run.running("export").completed();
            store.save("run-1", completed);

            assertThat(store.load("run-1")).contains(completed);
            assertThat(store.findByStatus(RunStatus.PENDING)).isEmpty();
            assertThat(store.findByStatus(RunStatus.COMPLETED))
                    .extracting(WorkflowRun::runId)
                    .containsExactly("run-1");
        }

        @Test
        void shouldReturnEmptyForUnknownRun() {
            assertThat(store.load("missing")).isEmpty();
        }

        @Test
        void shouldRejectMismatchedRunId() {
            assertThatThrownBy(() -> store.save("run-2", run("run-1", T0)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("run-2");
        }

        @Test
        void shouldRejectNullRun() {
            assertThatThrownBy(() -> store.save("run-1", null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class Queries {

        @Test
        void shouldListRunsByStatusOldestFirst() {
            store.save("run-b", run("run-b", T0.plusSeconds(60)).running("grade_dispatch"));
            store.save("run-a", run("run-a", T0).running("aggregate"));
            store.save("run-c", run("run-c", T0.plusSeconds(30)));

            assertThat(store.findByStatus(RunStatus.RUNNING))
                    .extracting(WorkflowRun::runId)
                    .containsExactly("run-a", "run-b");
            assertThat(store.findByStatus(RunStatus.RUNNING))
                    .extracting(WorkflowRun::currentNode)
                    .containsExactly("aggregate", "grade_dispatch");
        }

        @Test
        void shouldDeleteCheckpoint() {
            store.save("run-1", run("run-1", T0));

            assertThat(store.delete("run-1")).isTrue();
            assertThat(store.delete("run-1")).isFalse();
            assertThat(store.load("run-1")).isEmpty();
        }
    }

    @Nested
    class Schema {

        @Test
        void shouldSkipAppliedMigrations() {
            store.save("run-1", run("run-1", T0));

            assertThat(CheckpointSchema.migrate(dataSource)).isZero();
            assertThat(store.load("run-1")).isPresent();
        }

        @Test
        void shouldMigrateEmptyDatabase() {
            DataSource fresh = dataSourceAt("fresh.db");

            assertThat(CheckpointSchema.migrate(fresh)).isEqualTo(1);
            assertThat(new JdbcCheckpointStore(fresh).findByStatus(RunStatus.RUNNING)).isEmpty();
        }

        @Test
        void shouldWrapSqlFailures() {
            JdbcCheckpointStore uninitialized = new JdbcCheckpointStore(dataSourceAt("empty.db"));

            assertThatThrownBy(() -> uninitialized.load("run-1"))
                    .isInstanceOf(PersistenceException.class)
                    .hasMessage("Failed to load checkpoint: run-1")
                    .hasCauseInstanceOf(SQLException.class);
        }
    }

    private static WorkflowRun run(String runId, Instant createdAt) {
        RunState state =
                RunState.of(
                        Map.of(
                                GradingKeys.INTAKE.name(),
                                new IntakeSummary(
                                        "Midterm", 30.0, null, List.of("Ann", "Ben"), createdAt)));
        return new WorkflowRun(
                runId,
                "intake",
                RunStatus.PENDING,
                createdAt,
                createdAt,
                state,
                List.of(),
                0,
                null,
                null);
    }
}
