package io.gradeflow.server.persistence;

import io.gradeflow.core.checkpoint.CheckpointStore;
import io.gradeflow.core.run.RunStatus;
import io.gradeflow.core.run.WorkflowRun;
import io.gradeflow.serialization.CheckpointSerializer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.jboss.logging.Logger;

/// Relational {@link CheckpointStore}: one row per run in `workflow_runs`, the full run
/// serialized as JSON in the `checkpoint` column.
///
/// `status`, `current_node` and `created_at` are copied out of the checkpoint so that
/// recovery can select runs by status without parsing every row.
///
/// ### Contracts
/// - **Precondition**: {@link CheckpointSchema#migrate} has run against the data source
/// - **Postcondition**: `save` is idempotent per `run_id` (UPSERT)
///
/// The SQL is accepted by both PostgreSQL and SQLite.
///
/// @implNote Thread-safe. Each call acquires its own connection via {@link JdbcSupport}.
/// @see CheckpointSerializer for the checkpoint JSON layout
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger LOG = Logger.getLogger(JdbcCheckpointStore.class);

    // --- SQL constants ---

    private static final String SQL_SAVE =
            """
            INSERT INTO workflow_runs
                (run_id, status, current_node, checkpoint, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (run_id)
            DO UPDATE SET
                status       = EXCLUDED.status,
                current_node = EXCLUDED.current_node,
                checkpoint   = EXCLUDED.checkpoint,
                updated_at   = EXCLUDED.updated_at
            """;

    private static final String SQL_LOAD =
            "SELECT checkpoint FROM workflow_runs WHERE run_id = ?";

    private static final String SQL_FIND_BY_STATUS =
            """
            SELECT checkpoint
            FROM workflow_runs
            WHERE status = ?
            ORDER BY created_at, run_id
            """;

    private static final String SQL_DELETE = "DELETE FROM workflow_runs WHERE run_id = ?";

    private final JdbcSupport jdbc;

    /// Creates a store backed by the given data source.
    ///
    /// @param dataSource the JDBC connection source, not null
    public JdbcCheckpointStore(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public void save(String runId, WorkflowRun run) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(run, "run must not be null");
        if (!runId.equals(run.runId())) {
            throw new IllegalArgumentException(
                    "runId " + runId + " does not match checkpoint " + run.runId());
        }

        String json = CheckpointSerializer.toJson(run);
        jdbc.update(
                SQL_SAVE,
                ps -> {
                    ps.setString(1, runId);
                    ps.setString(2, run.status().name());
                    ps.setString(3, run.currentNode());
                    ps.setString(4, json);
                    ps.setLong(5, run.createdAt().toEpochMilli());
                    ps.setLong(6, run.updatedAt().toEpochMilli());
                },
                "Failed to save checkpoint: " + runId);
        LOG.tracev("Saved checkpoint {0} ({1} at {2})", runId, run.status(), run.currentNode());
    }

    @Override
    public Optional<WorkflowRun> load(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");

        return jdbc.queryOne(
                SQL_LOAD,
                ps -> ps.setString(1, runId),
                rs -> CheckpointSerializer.fromJson(rs.getString("checkpoint")),
                "Failed to load checkpoint: " + runId);
    }

    @Override
    public boolean delete(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");

        return jdbc.update(
                        SQL_DELETE,
                        ps -> ps.setString(1, runId),
                        "Failed to delete checkpoint: " + runId)
                > 0;
    }

    @Override
    public List<WorkflowRun> findByStatus(RunStatus status) {
        Objects.requireNonNull(status, "status must not be null");

        return jdbc.queryList(
                SQL_FIND_BY_STATUS,
                ps -> ps.setString(1, status.name()),
                rs -> CheckpointSerializer.fromJson(rs.getString("checkpoint")),
                "Failed to query checkpoints with status " + status);
    }
}
