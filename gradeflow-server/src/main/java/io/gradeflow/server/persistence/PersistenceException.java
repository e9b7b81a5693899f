package io.gradeflow.server.persistence;

import java.io.Serial;

/// Unchecked exception for database persistence failures.
///
/// Wraps {@link java.sql.SQLException} so that {@link io.gradeflow.core.checkpoint.CheckpointStore},
/// which declares no checked exceptions, can be backed by JDBC.
///
/// @see JdbcCheckpointStore
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2291846615730935114L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
