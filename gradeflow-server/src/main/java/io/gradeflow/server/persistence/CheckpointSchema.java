package io.gradeflow.server.persistence;

import java.util.Objects;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.jboss.logging.Logger;

/// Brings the checkpoint tables up to date with the Flyway migrations under
/// `classpath:db/migration`.
///
/// @see JdbcCheckpointStore
public final class CheckpointSchema {

    private static final Logger LOG = Logger.getLogger(CheckpointSchema.class);

    static final String MIGRATION_LOCATION = "classpath:db/migration";

    private CheckpointSchema() {}

    /// Applies pending migrations. Already applied migrations are skipped.
    ///
    /// @param dataSource the target database, not null
    /// @return number of migrations applied by this call
    /// @throws PersistenceException if a migration fails
    public static int migrate(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        try {
            MigrateResult result =
                    Flyway.configure()
                            .dataSource(dataSource)
                            .locations(MIGRATION_LOCATION)
                            .load()
                            .migrate();
            LOG.infov(
                    "Checkpoint schema at version {0} ({1} migrations applied)",
                    result.targetSchemaVersion, result.migrationsExecuted);
            return result.migrationsExecuted;
        } catch (FlywayException e) {
            throw new PersistenceException("Failed to migrate checkpoint schema", e);
        }
    }
}
