package org.loesak.sqlque.core.jdbc;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A single migration's view of the database: one connection, one open transaction, and the active
 * dialect. Offers the existence checks migrations use to skip work that was already done.
 */
@Slf4j
public class SchemaSession {

    private final Connection connection;
    private final Dialect dialect;

    SchemaSession(final Connection connection, final Dialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
    }

    public Dialect dialect() {
        return this.dialect;
    }

    public boolean isPostgres() {
        return this.dialect == Dialect.POSTGRESQL;
    }

    public boolean isSqlite() {
        return this.dialect == Dialect.SQLITE;
    }

    public Connection connection() {
        return this.connection;
    }

    public void execute(final String sql) throws SQLException {
        log.debug("Executing statement [{}]", sql);

        try (Statement statement = this.connection.createStatement()) {
            statement.execute(sql);
        }
    }

    public int update(final String sql, final Object... parameters) throws SQLException {
        log.debug("Executing update [{}]", sql);

        try (PreparedStatement statement = this.prepare(sql, parameters)) {
            return statement.executeUpdate();
        }
    }

    /**
     * Returns the first column of the first row as a long, or {@code null} when there is no row
     * or the value is SQL NULL.
     */
    public Long queryForLong(final String sql, final Object... parameters) throws SQLException {
        try (PreparedStatement statement = this.prepare(sql, parameters);
             ResultSet resultSet = statement.executeQuery()) {
            if (!resultSet.next()) {
                return null;
            }
            final long value = resultSet.getLong(1);
            return resultSet.wasNull() ? null : value;
        }
    }

    public boolean exists(final String sql, final Object... parameters) throws SQLException {
        try (PreparedStatement statement = this.prepare(sql, parameters);
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next();
        }
    }

    public boolean tableExists(final String table) throws SQLException {
        if (this.isPostgres()) {
            return this.exists(
                    "SELECT 1 FROM information_schema.tables WHERE table_schema = current_schema() AND table_name = ?",
                    table);
        }
        return this.exists("SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?", table);
    }

    public boolean columnExists(final String table, final String column) throws SQLException {
        if (this.isPostgres()) {
            return this.exists(
                    "SELECT 1 FROM information_schema.columns WHERE table_schema = current_schema() AND table_name = ? AND column_name = ?",
                    table,
                    column);
        }
        // table_xinfo also lists generated columns, which table_info hides
        return this.exists("SELECT 1 FROM pragma_table_xinfo(?) WHERE name = ?", table, column);
    }

    public boolean indexExists(final String index) throws SQLException {
        if (this.isPostgres()) {
            return this.exists("SELECT 1 FROM pg_indexes WHERE schemaname = current_schema() AND indexname = ?", index);
        }
        return this.exists("SELECT 1 FROM sqlite_master WHERE type = 'index' AND name = ?", index);
    }

    public boolean triggerExists(final String trigger) throws SQLException {
        if (this.isPostgres()) {
            return this.exists(
                    "SELECT 1 FROM information_schema.triggers WHERE trigger_schema = current_schema() AND trigger_name = ?",
                    trigger);
        }
        return this.exists("SELECT 1 FROM sqlite_master WHERE type = 'trigger' AND name = ?", trigger);
    }

    public boolean constraintExists(final String table, final String constraint) throws SQLException {
        if (this.isPostgres()) {
            return this.exists(
                    "SELECT 1 FROM information_schema.table_constraints WHERE table_schema = current_schema() AND table_name = ? AND constraint_name = ?",
                    table,
                    constraint);
        }
        // SQLite keeps constraints only inside the table definition
        final String definition = this.tableDefinition(table);
        return definition != null && definition.toLowerCase().contains(constraint.toLowerCase());
    }

    private String tableDefinition(final String table) throws SQLException {
        try (PreparedStatement statement = this.prepare("SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?", table);
             ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getString(1) : null;
        }
    }

    private PreparedStatement prepare(final String sql, final Object... parameters) throws SQLException {
        final PreparedStatement statement = this.connection.prepareStatement(sql);
        try {
            for (int i = 0; i < parameters.length; i++) {
                statement.setObject(i + 1, parameters[i]);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }
}
