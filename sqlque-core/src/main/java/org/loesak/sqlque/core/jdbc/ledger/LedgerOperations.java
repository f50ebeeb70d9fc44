package org.loesak.sqlque.core.jdbc.ledger;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.exception.LedgerException;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.jdbc.Dialect;
import org.loesak.sqlque.core.jdbc.DialectAdapter;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Durable bookkeeping of migration attempts. Every operation opens its own connection and commits
 * immediately, so a ledger write is never part of the transaction of the migration it describes.
 */
@Slf4j
public class LedgerOperations {

    public static final String DEFAULT_TABLE_NAME = "schema_migrations";

    private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    private static final String POSTGRESQL_CREATE_TABLE = ""
            + "CREATE TABLE IF NOT EXISTS %s ("
            + " id BIGSERIAL PRIMARY KEY,"
            + " version VARCHAR(255) NOT NULL UNIQUE,"
            + " name VARCHAR(500) NOT NULL,"
            + " applied_at TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,"
            + " execution_time_ms BIGINT,"
            + " success BOOLEAN NOT NULL DEFAULT TRUE,"
            + " error_message TEXT,"
            + " checksum INTEGER,"
            + " installed_by VARCHAR(255),"
            + " attempts INTEGER NOT NULL DEFAULT 1"
            + ")";

    private static final String SQLITE_CREATE_TABLE = ""
            + "CREATE TABLE IF NOT EXISTS %s ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " version TEXT NOT NULL UNIQUE,"
            + " name TEXT NOT NULL,"
            + " applied_at TEXT NOT NULL,"
            + " execution_time_ms INTEGER,"
            + " success INTEGER NOT NULL DEFAULT 1,"
            + " error_message TEXT,"
            + " checksum INTEGER,"
            + " installed_by TEXT,"
            + " attempts INTEGER NOT NULL DEFAULT 1"
            + ")";

    // both dialects accept ON CONFLICT ... DO UPDATE. the existing row is addressed by the table name
    private static final String UPSERT = ""
            + "INSERT INTO %1$s (version, name, applied_at, execution_time_ms, success, error_message, checksum, installed_by, attempts)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, 1)"
            + " ON CONFLICT (version) DO UPDATE SET"
            + " name = excluded.name,"
            + " applied_at = excluded.applied_at,"
            + " execution_time_ms = excluded.execution_time_ms,"
            + " success = excluded.success,"
            + " error_message = excluded.error_message,"
            + " checksum = excluded.checksum,"
            + " installed_by = excluded.installed_by,"
            + " attempts = %1$s.attempts + 1";

    // columns beyond version, name, applied_at, execution_time_ms, success and error_message
    private static final List<String[]> BOOKKEEPING_COLUMNS = List.of(
            new String[] {"checksum", "INTEGER"},
            new String[] {"installed_by", "VARCHAR(255)"},
            new String[] {"attempts", "INTEGER NOT NULL DEFAULT 1"});

    // accepts Instant.toString() output as well as the "yyyy-MM-dd HH:mm:ss" of CURRENT_TIMESTAMP
    private static final DateTimeFormatter SQLITE_TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private static final String SELECT_ALL = ""
            + "SELECT version, name, applied_at, execution_time_ms, success, error_message, checksum, installed_by, attempts FROM %s";

    private final DialectAdapter adapter;

    @Getter
    private final String tableName;

    private final String installedBy;

    public LedgerOperations(@NonNull final DialectAdapter adapter) {
        this(adapter, DEFAULT_TABLE_NAME, null);
    }

    public LedgerOperations(@NonNull final DialectAdapter adapter, @NonNull final String tableName, final String installedBy) {
        if (!TABLE_NAME_PATTERN.matcher(tableName).matches()) {
            throw new MigrationConfigurationException(String.format("invalid ledger table name [%s]", tableName));
        }
        this.adapter = adapter;
        this.tableName = tableName;
        this.installedBy = installedBy;
    }

    public boolean checkLedgerTableExists() {
        try {
            log.debug("Checking if ledger table with name [{}] exists", this.tableName);

            final boolean status = this.adapter.inTransaction(session -> session.tableExists(this.tableName));

            log.debug("Determined ledger table with name [{}] {}", this.tableName, status ? "exists" : "does not exist");

            return status;
        } catch (SQLException e) {
            throw new LedgerException(String.format("failed to check if ledger table [%s] exists", this.tableName), e);
        }
    }

    /**
     * Creates the ledger table when absent and adds the bookkeeping columns to a table that was
     * created with only the six base columns. Safe to call on every run.
     */
    public void ensureSchema() {
        log.info("Ensuring ledger table with name [{}] exists", this.tableName);

        try {
            this.adapter.inTransaction(session -> {
                session.execute(String.format(
                        session.isPostgres() ? POSTGRESQL_CREATE_TABLE : SQLITE_CREATE_TABLE,
                        this.tableName));

                for (String[] column : BOOKKEEPING_COLUMNS) {
                    if (!session.columnExists(this.tableName, column[0])) {
                        log.info("Adding column [{}] to ledger table [{}]", column[0], this.tableName);
                        session.execute(String.format("ALTER TABLE %s ADD COLUMN %s %s", this.tableName, column[0], column[1]));
                    }
                }
                return null;
            });
        } catch (SQLException e) {
            log.error("Failed to create ledger table with name [{}]", this.tableName, e);
            throw new LedgerException(String.format("failed to create ledger table [%s]", this.tableName), e);
        }
    }

    /**
     * All ledger entries, successful or not, in ascending version order.
     */
    public List<LedgerEntry> getLedgerEntries() {
        try (Connection connection = this.adapter.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(String.format(SELECT_ALL, this.tableName))) {
            final List<LedgerEntry> entries = new ArrayList<>();
            while (resultSet.next()) {
                entries.add(this.toEntry(resultSet));
            }
            entries.sort(Comparator.comparing(LedgerEntry::getVersion));

            log.debug("Found [{}] ledger entries", entries.size());

            return entries;
        } catch (SQLException e) {
            log.error("Failed to read ledger entries from [{}]", this.tableName, e);
            throw new LedgerException(String.format("failed to read ledger table [%s]", this.tableName), e);
        }
    }

    public Optional<LedgerEntry> getLedgerEntry(@NonNull final MigrationVersion version) {
        try (Connection connection = this.adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(String.format(SELECT_ALL + " WHERE version = ?", this.tableName))) {
            statement.setString(1, version.toString());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(this.toEntry(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new LedgerException(String.format("failed to read ledger entry for version [%s]", version), e);
        }
    }

    /**
     * Versions recorded as successfully applied, ascending.
     */
    public SortedSet<MigrationVersion> appliedVersions() {
        final SortedSet<MigrationVersion> applied = new TreeSet<>();
        this.getLedgerEntries().stream()
            .filter(LedgerEntry::isSuccess)
            .map(LedgerEntry::getVersion)
            .forEach(applied::add);
        return applied;
    }

    public void record(
            final MigrationVersion version,
            final String name,
            final long durationMs,
            final boolean success,
            final String errorMessage) {
        this.record(version, name, null, durationMs, success, errorMessage);
    }

    /**
     * Upserts the entry for {@code version}. {@code applied_at} is reset to now on every call so a
     * retried version shows its latest attempt.
     */
    public void record(
            @NonNull final MigrationVersion version,
            @NonNull final String name,
            final Integer checksum,
            final long durationMs,
            final boolean success,
            final String errorMessage) {
        try (Connection connection = this.adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(String.format(UPSERT, this.tableName))) {
            log.info("Recording {} ledger entry for version [{}]", success ? "successful" : "failed", version);

            statement.setString(1, version.toString());
            statement.setString(2, name);
            this.bindTimestamp(statement, 3, Instant.now());
            statement.setLong(4, durationMs);
            statement.setBoolean(5, success);
            statement.setString(6, errorMessage);
            if (checksum == null) {
                statement.setNull(7, Types.INTEGER);
            } else {
                statement.setInt(7, checksum);
            }
            statement.setString(8, this.installedBy);

            statement.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to record ledger entry for version [{}]", version, e);
            throw new LedgerException(String.format("failed to record ledger entry for version [%s]", version), e);
        }
    }

    /**
     * Removes the entry for {@code version}. Only used by rollback.
     *
     * @return whether an entry was removed
     */
    public boolean delete(@NonNull final MigrationVersion version) {
        return this.deleteWhere(version, false);
    }

    /**
     * Removes the entry for {@code version} only if it records a failure.
     *
     * @return whether an entry was removed
     */
    public boolean deleteFailed(@NonNull final MigrationVersion version) {
        return this.deleteWhere(version, true);
    }

    private boolean deleteWhere(final MigrationVersion version, final boolean onlyFailed) {
        final String sql = onlyFailed
                ? String.format("DELETE FROM %s WHERE version = ? AND success = ?", this.tableName)
                : String.format("DELETE FROM %s WHERE version = ?", this.tableName);

        try (Connection connection = this.adapter.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            log.info("Deleting {}ledger entry for version [{}]", onlyFailed ? "failed " : "", version);

            statement.setString(1, version.toString());
            if (onlyFailed) {
                statement.setBoolean(2, false);
            }

            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            log.error("Failed to delete ledger entry for version [{}]", version, e);
            throw new LedgerException(String.format("failed to delete ledger entry for version [%s]", version), e);
        }
    }

    private void bindTimestamp(final PreparedStatement statement, final int index, final Instant instant) throws SQLException {
        if (this.adapter.getDialect() == Dialect.POSTGRESQL) {
            statement.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        } else {
            statement.setString(index, instant.toString());
        }
    }

    /**
     * Timestamps without an offset are taken as UTC.
     */
    private Instant readTimestamp(final ResultSet resultSet, final String column) throws SQLException {
        if (this.adapter.getDialect() == Dialect.POSTGRESQL) {
            final Timestamp timestamp = resultSet.getTimestamp(column);
            return timestamp == null ? null : timestamp.toInstant();
        }

        final String value = resultSet.getString(column);
        if (value == null) {
            return null;
        }

        try {
            final TemporalAccessor parsed = SQLITE_TIMESTAMP_FORMAT.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new LedgerException(String.format(
                    "unreadable [%s] value [%s] in ledger table [%s]",
                    column,
                    value,
                    this.tableName), e);
        }
    }

    private LedgerEntry toEntry(final ResultSet resultSet) throws SQLException {
        final long executionTime = resultSet.getLong("execution_time_ms");
        final Long executionTimeMs = resultSet.wasNull() ? null : executionTime;
        final int checksum = resultSet.getInt("checksum");
        final Integer checksumValue = resultSet.wasNull() ? null : checksum;

        return new LedgerEntry(
                MigrationVersion.of(resultSet.getString("version")),
                resultSet.getString("name"),
                this.readTimestamp(resultSet, "applied_at"),
                executionTimeMs,
                resultSet.getBoolean("success"),
                resultSet.getString("error_message"),
                checksumValue,
                resultSet.getString("installed_by"),
                resultSet.getInt("attempts"));
    }
}
