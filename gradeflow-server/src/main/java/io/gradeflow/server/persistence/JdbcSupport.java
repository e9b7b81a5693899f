package io.gradeflow.server.persistence;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;

/// Small JDBC helper that owns connection handling and {@link SQLException} translation for
/// {@link JdbcCheckpointStore}.
///
/// SQL is always a constant; parameters are always bound through a {@link StatementPreparer}.
///
/// ### Contracts
/// - **Postcondition**: every acquired connection is released via try-with-resources
///
/// @implNote Thread-safe. Stateless beyond the injected {@link DataSource}; each call
/// acquires and releases its own connection.
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes an INSERT, UPDATE or DELETE.
    ///
    /// @param sql the statement, not null
    /// @param preparer binds parameters, not null
    /// @param errorContext message for {@link PersistenceException}, not null
    /// @return number of affected rows
    /// @throws PersistenceException if the statement fails
    int update(String sql, StatementPreparer preparer, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    <T> Optional<T> queryOne(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new PersistenceException(errorContext, e);
        }
    }

    /// Binds parameters to a {@link PreparedStatement}.
    @FunctionalInterface
    interface StatementPreparer {

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps the current {@link ResultSet} row.
    ///
    /// @param <T> the produced type
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }
}
