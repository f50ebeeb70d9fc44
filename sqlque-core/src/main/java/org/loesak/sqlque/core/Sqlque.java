package org.loesak.sqlque.core;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.exception.SchemaOutOfDateException;
import org.loesak.sqlque.core.jdbc.DialectAdapter;
import org.loesak.sqlque.core.jdbc.ledger.LedgerOperations;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationVersion;
import org.loesak.sqlque.core.result.MigrationResult;
import org.loesak.sqlque.core.result.MigrationStatusReport;
import org.loesak.sqlque.core.result.RollbackResult;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Entry point: wires the dialect adapter, the ledger and the runner for one database.
 *
 * <pre>{@code
 * Sqlque sqlque = new Sqlque(SqlqueConfiguration.fromEnvironment(System.getenv()), registry);
 * MigrationResult result = sqlque.migrate();
 * }</pre>
 */
@Slf4j
public class Sqlque {

    @Getter
    private final DialectAdapter dialectAdapter;

    @Getter
    private final MigrationRegistry registry;

    private final MigrationExecutor executor;

    public Sqlque(@NonNull final SqlqueConfiguration configuration, @NonNull final MigrationRegistry registry) {
        this(configuration, registry, MigrationListener.NONE);
    }

    public Sqlque(
            @NonNull final SqlqueConfiguration configuration,
            @NonNull final MigrationRegistry registry,
            @NonNull final MigrationListener listener) {
        this.dialectAdapter = DialectAdapter.fromConnectionString(configuration.getDatabaseUrl());
        this.registry = registry;
        this.executor = new MigrationExecutor(
                this.dialectAdapter,
                new LedgerOperations(this.dialectAdapter, configuration.getTableName(), configuration.getInstalledBy()),
                registry,
                configuration.getMaxAttempts(),
                listener);
    }

    public MigrationResult migrate() {
        log.info("Starting sqlque execution against [{}]", this.dialectAdapter.getDialect().getDisplayName());

        final MigrationResult result = this.executor.migrate();

        if (result.isSuccessful()) {
            log.info("Completed sqlque execution. [{}] migration(s) applied", result.getAppliedCount());
        } else {
            log.error("Sqlque execution stopped at version [{}] ({}). [{}] applied, [{}] remaining",
                    result.getFailedVersion(),
                    result.getOutcome(),
                    result.getAppliedCount(),
                    result.getRemainingCount());
        }

        return result;
    }

    public MigrationStatusReport status() {
        return this.executor.status();
    }

    public RollbackResult rollback() {
        return this.executor.rollback();
    }

    public boolean repair(@NonNull final String version) {
        return this.executor.repair(MigrationVersion.of(version));
    }

    public MigrationExecutor.State getState() {
        return this.executor.getState();
    }

    /**
     * Fails when any registered migration is pending or failed. Applications call this at startup
     * before running business queries.
     *
     * @throws SchemaOutOfDateException listing the pending versions
     */
    public void ensureUpToDate() {
        final MigrationStatusReport report = this.status();
        if (!report.isUpToDate()) {
            throw new SchemaOutOfDateException(report.getPendingVersions());
        }

        log.info("Database schema is up to date at version [{}]", report.getCurrentVersion());
    }

    /**
     * A connection to a database whose schema is verified to be current.
     */
    public Connection getVerifiedConnection() throws SQLException {
        this.ensureUpToDate();
        return this.dialectAdapter.getConnection();
    }
}
