package org.loesak.sqlque.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.jdbc.ledger.LedgerEntry;
import org.loesak.sqlque.core.jdbc.ledger.LedgerOperations;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationUnit;
import org.loesak.sqlque.core.migration.MigrationVersion;
import org.loesak.sqlque.core.migration.Reversal;
import org.loesak.sqlque.core.result.AppliedMigration;
import org.loesak.sqlque.core.result.MigrationResult;
import org.loesak.sqlque.core.result.MigrationState;
import org.loesak.sqlque.core.result.MigrationStatusReport;
import org.loesak.sqlque.core.result.RollbackResult;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationExecutorTest extends AbstractSqliteTest {

    private static final MigrationVersion V1 = MigrationVersion.of("001");
    private static final MigrationVersion V2 = MigrationVersion.of("002");
    private static final MigrationVersion V3 = MigrationVersion.of("003");

    private LedgerOperations ledger;

    @BeforeEach
    void setUp() {
        ledger = new LedgerOperations(adapter);
    }

    @Test
    void scenarioA_appliesAllPendingUnits() throws SQLException {
        MigrationExecutor executor = executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.creatingTable("002", "vehicles"),
                ScriptedMigrationUnit.creatingTable("003", "customers")));

        MigrationResult result = executor.migrate();

        assertThat(result.getOutcome()).isEqualTo(MigrationResult.Outcome.COMPLETED);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getApplied()).extracting(AppliedMigration::getVersion).containsExactly(V1, V2, V3);
        assertThat(ledger.getLedgerEntries()).hasSize(3).allMatch(LedgerEntry::isSuccess);
        assertThat(executor.status().getPendingVersions()).isEmpty();
        assertThat(tableExists("customers")).isTrue();
        assertThat(executor.getState()).isEqualTo(MigrationExecutor.State.COMPLETED);
    }

    @Test
    void scenarioB_haltsAtTheFirstFailure() throws SQLException {
        ScriptedMigrationUnit third = ScriptedMigrationUnit.creatingTable("003", "customers");
        MigrationExecutor executor = executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.failing("002", "relation \"vehicles\" does not exist"),
                third));

        MigrationResult result = executor.migrate();

        assertThat(result.getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFailedVersion()).isEqualTo(V2);
        assertThat(result.getFailureMessage()).isEqualTo("relation \"vehicles\" does not exist");
        assertThat(result.getNotAttempted()).containsExactly(V3);
        assertThat(result.getRemainingCount()).isEqualTo(2);

        assertThat(ledger.getLedgerEntry(V1).orElseThrow().isSuccess()).isTrue();
        LedgerEntry failed = ledger.getLedgerEntry(V2).orElseThrow();
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getErrorMessage()).isEqualTo("relation \"vehicles\" does not exist");
        assertThat(ledger.getLedgerEntry(V3)).isEmpty();

        assertThat(third.getUpCount()).isZero();
        assertThat(tableExists("customers")).isFalse();
        assertThat(executor.getState()).isEqualTo(MigrationExecutor.State.HALTED);
    }

    @Test
    void scenarioC_rerunAfterFixResumesFromTheFailedVersion() {
        ScriptedMigrationUnit first = ScriptedMigrationUnit.creatingTable("001", "companies");
        ScriptedMigrationUnit second = ScriptedMigrationUnit.failing("002", "boom");
        ScriptedMigrationUnit third = ScriptedMigrationUnit.creatingTable("003", "customers");
        MigrationExecutor executor = executor(MigrationRegistry.of(first, second, third));

        executor.migrate();
        second.fix(session -> session.execute("CREATE TABLE vehicles (id INTEGER PRIMARY KEY)"));
        MigrationResult result = executor.migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getApplied()).extracting(AppliedMigration::getVersion).containsExactly(V2, V3);
        assertThat(first.getUpCount()).isEqualTo(1);
        assertThat(second.getUpCount()).isEqualTo(2);
        assertThat(third.getUpCount()).isEqualTo(1);

        assertThat(ledger.getLedgerEntries()).hasSize(3).allMatch(LedgerEntry::isSuccess);
        LedgerEntry retried = ledger.getLedgerEntry(V2).orElseThrow();
        assertThat(retried.getErrorMessage()).isNull();
        assertThat(retried.getAttempts()).isEqualTo(2);
    }

    @Test
    void scenarioD_rollbackRevertsOnlyTheHighestAppliedVersion() throws SQLException {
        ScriptedMigrationUnit first = ScriptedMigrationUnit.creatingTable("001", "companies");
        ScriptedMigrationUnit second = ScriptedMigrationUnit.creatingTable("002", "vehicles");
        ScriptedMigrationUnit third = ScriptedMigrationUnit.creatingTable("003", "customers");
        MigrationExecutor executor = executor(MigrationRegistry.of(first, second, third));
        executor.migrate();
        List<LedgerEntry> before = ledger.getLedgerEntries();

        RollbackResult result = executor.rollback();

        assertThat(result.getOutcome()).isEqualTo(RollbackResult.Outcome.ROLLED_BACK);
        assertThat(result.getVersion()).isEqualTo(V3);
        assertThat(third.getDownCount()).isEqualTo(1);
        assertThat(first.getDownCount()).isZero();
        assertThat(second.getDownCount()).isZero();
        assertThat(tableExists("customers")).isFalse();
        assertThat(ledger.getLedgerEntries()).containsExactlyElementsOf(before.subList(0, 2));
    }

    @Test
    void rollback_isStrictlyOneStep() {
        MigrationExecutor executor = executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.creatingTable("002", "vehicles")));
        executor.migrate();

        assertThat(executor.rollback().getVersion()).isEqualTo(V2);
        assertThat(executor.rollback().getVersion()).isEqualTo(V1);
        assertThat(executor.rollback().getOutcome()).isEqualTo(RollbackResult.Outcome.NOTHING_TO_ROLL_BACK);
        assertThat(ledger.getLedgerEntries()).isEmpty();
    }

    @Test
    void migrate_appliesUnitsInVersionOrder() {
        List<String> order = new ArrayList<>();
        MigrationExecutor executor = executor(new MigrationRegistry(List.of(
                recording("010", order),
                recording("002", order),
                recording("1.5", order))));

        executor.migrate();

        assertThat(order).containsExactly("1.5", "002", "010");
    }

    @Test
    void migrate_secondRunWithoutNewUnitsDoesNothing() {
        ScriptedMigrationUnit first = ScriptedMigrationUnit.creatingTable("001", "companies");
        ScriptedMigrationUnit second = ScriptedMigrationUnit.creatingTable("002", "vehicles");
        MigrationExecutor executor = executor(MigrationRegistry.of(first, second));
        executor.migrate();
        List<LedgerEntry> before = ledger.getLedgerEntries();

        MigrationResult result = executor.migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getAppliedCount()).isZero();
        assertThat(first.getUpCount()).isEqualTo(1);
        assertThat(second.getUpCount()).isEqualTo(1);
        assertThat(ledger.getLedgerEntries()).isEqualTo(before);
    }

    @Test
    void migrate_rollsBackTheFailingUnitButKeepsEarlierCommits() throws SQLException {
        MigrationExecutor executor = executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                new ScriptedMigrationUnit("002", "Half done", session -> {
                    session.execute("CREATE TABLE vehicles (id INTEGER PRIMARY KEY)");
                    session.execute("ALTER TABLE missing_table ADD COLUMN plate TEXT");
                }, session -> {
                }, Reversal.complete())));

        MigrationResult result = executor.migrate();

        assertThat(result.getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);
        assertThat(result.getFailureMessage()).contains("missing_table");
        assertThat(tableExists("companies")).isTrue();
        assertThat(tableExists("vehicles")).isFalse();
    }

    @Test
    void migrate_haltsWhenTheLedgerWriteFailsAndRetriesOnTheNextRun() throws SQLException {
        ScriptedMigrationUnit unit = new ScriptedMigrationUnit("001", "Drops the ledger", session -> {
            session.execute("CREATE TABLE IF NOT EXISTS companies (id INTEGER PRIMARY KEY)");
            if (session.tableExists(LedgerOperations.DEFAULT_TABLE_NAME)) {
                session.execute("DROP TABLE " + LedgerOperations.DEFAULT_TABLE_NAME);
            }
        }, session -> {
        }, Reversal.complete());
        MigrationExecutor executor = executor(MigrationRegistry.of(unit));

        MigrationResult first = executor.migrate();

        assertThat(first.getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);
        assertThat(first.getFailedVersion()).isEqualTo(V1);
        assertThat(first.getFailureMessage()).contains("ledger entry could not be written");
        assertThat(tableExists("companies")).isTrue();

        // the unit drops the ledger again on the second run; replace it with an idempotent step
        unit.fix(session -> session.execute("CREATE TABLE IF NOT EXISTS companies (id INTEGER PRIMARY KEY)"));
        MigrationResult second = executor.migrate();

        assertThat(second.isSuccessful()).isTrue();
        assertThat(unit.getUpCount()).isEqualTo(2);
        assertThat(ledger.appliedVersions()).containsExactly(V1);
    }

    @Test
    void migrate_blocksAVersionOnceItsAttemptsAreExhausted() {
        ScriptedMigrationUnit broken = ScriptedMigrationUnit.failing("001", "boom");
        MigrationExecutor executor = new MigrationExecutor(adapter, ledger, MigrationRegistry.of(broken), 2, MigrationListener.NONE);

        assertThat(executor.migrate().getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);
        assertThat(executor.migrate().getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);

        MigrationResult blocked = executor.migrate();

        assertThat(blocked.getOutcome()).isEqualTo(MigrationResult.Outcome.BLOCKED);
        assertThat(blocked.getFailedVersion()).isEqualTo(V1);
        assertThat(blocked.getFailureMessage()).contains("failed [2] time(s)").contains("boom").contains("repair");
        assertThat(broken.getUpCount()).isEqualTo(2);
        assertThat(ledger.getLedgerEntry(V1).orElseThrow().getAttempts()).isEqualTo(2);
    }

    @Test
    void repair_clearsAFailedEntrySoTheVersionIsRetried() {
        ScriptedMigrationUnit broken = ScriptedMigrationUnit.failing("001", "boom");
        MigrationExecutor executor = new MigrationExecutor(adapter, ledger, MigrationRegistry.of(broken), 1, MigrationListener.NONE);
        executor.migrate();
        assertThat(executor.migrate().getOutcome()).isEqualTo(MigrationResult.Outcome.BLOCKED);

        assertThat(executor.repair(V1)).isTrue();
        broken.fix(session -> session.execute("CREATE TABLE companies (id INTEGER PRIMARY KEY)"));
        MigrationResult result = executor.migrate();

        assertThat(result.isSuccessful()).isTrue();
        LedgerEntry entry = ledger.getLedgerEntry(V1).orElseThrow();
        assertThat(entry.isSuccess()).isTrue();
        assertThat(entry.getAttempts()).isEqualTo(1);
    }

    @Test
    void repair_refusesToClearAppliedVersions() {
        MigrationExecutor executor = executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies")));
        executor.migrate();

        assertThatThrownBy(() -> executor.repair(V1))
                .isInstanceOf(MigrationConfigurationException.class)
                .hasMessageContaining("rollback");
        assertThat(ledger.appliedVersions()).containsExactly(V1);
        assertThat(executor.repair(V2)).isFalse();
    }

    @Test
    void migrate_retriesWithoutLimitWhenMaxAttemptsIsZero() {
        ScriptedMigrationUnit broken = ScriptedMigrationUnit.failing("001", "boom");
        MigrationExecutor executor = new MigrationExecutor(adapter, ledger, MigrationRegistry.of(broken), 0, MigrationListener.NONE);

        for (int i = 0; i < 5; i++) {
            assertThat(executor.migrate().getOutcome()).isEqualTo(MigrationResult.Outcome.HALTED);
        }

        assertThat(broken.getUpCount()).isEqualTo(5);
    }

    @Test
    void migrate_rejectsAppliedUnitsWhoseChecksumChanged() {
        executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies").withChecksum(1))).migrate();
        MigrationExecutor executor = executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies").withChecksum(2)));

        assertThatThrownBy(executor::migrate)
                .isInstanceOf(MigrationConfigurationException.class)
                .hasMessageContaining("modified after it was applied");
        assertThat(executor.getState()).isEqualTo(MigrationExecutor.State.HALTED);
    }

    @Test
    void migrate_rejectsAppliedVersionsThatAreNoLongerRegistered() {
        executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.creatingTable("002", "vehicles"))).migrate();
        ScriptedMigrationUnit third = ScriptedMigrationUnit.creatingTable("003", "customers");
        MigrationExecutor executor = executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies"), third));

        assertThatThrownBy(executor::migrate)
                .isInstanceOf(MigrationConfigurationException.class)
                .hasMessageContaining("[002]");
        assertThat(third.getUpCount()).isZero();
    }

    @Test
    void migrate_recordsAnErrorThrownByAUnitAndRethrowsIt() {
        ScriptedMigrationUnit broken = new ScriptedMigrationUnit(
                "002",
                "Missing driver class",
                session -> {
                    throw new NoClassDefFoundError("org/example/GeometryType");
                },
                session -> {
                },
                Reversal.complete());
        MigrationExecutor executor = executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies"), broken));

        assertThatThrownBy(executor::migrate).isInstanceOf(NoClassDefFoundError.class);

        assertThat(executor.getState()).isEqualTo(MigrationExecutor.State.HALTED);
        LedgerEntry failed = ledger.getLedgerEntry(V2).orElseThrow();
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getErrorMessage()).contains("org/example/GeometryType");
        assertThat(ledger.appliedVersions()).containsExactly(V1);
    }

    @Test
    void migrate_upgradesALedgerTableWithOnlyTheBaseColumns() throws SQLException {
        adapter.inTransaction(session -> {
            session.execute("CREATE TABLE schema_migrations ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " version TEXT UNIQUE NOT NULL,"
                    + " name TEXT NOT NULL,"
                    + " applied_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " execution_time_ms INTEGER,"
                    + " success BOOLEAN DEFAULT 1,"
                    + " error_message TEXT)");
            session.execute("CREATE TABLE companies (id INTEGER PRIMARY KEY)");
            session.execute("INSERT INTO schema_migrations (version, name, execution_time_ms, success) VALUES ('001', 'Create companies', 5, 1)");
            return null;
        });
        ScriptedMigrationUnit first = ScriptedMigrationUnit.creatingTable("001", "companies");
        MigrationExecutor executor = executor(MigrationRegistry.of(first, ScriptedMigrationUnit.creatingTable("002", "vehicles")));

        MigrationResult result = executor.migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getApplied()).extracting(AppliedMigration::getVersion).containsExactly(V2);
        assertThat(first.getUpCount()).isZero();
        assertThat(executor.status().isUpToDate()).isTrue();
    }

    @Test
    void rollback_reportsNothingToRollBackOnAFreshDatabase() throws SQLException {
        MigrationExecutor executor = executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies")));

        RollbackResult result = executor.rollback();

        assertThat(result.getOutcome()).isEqualTo(RollbackResult.Outcome.NOTHING_TO_ROLL_BACK);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(tableExists(LedgerOperations.DEFAULT_TABLE_NAME)).isFalse();
    }

    @Test
    void rollback_reportsDegradedReversalsAndStillDeletesTheEntry() throws SQLException {
        ScriptedMigrationUnit unit = new ScriptedMigrationUnit(
                "001",
                "Add plan column",
                session -> session.execute("CREATE TABLE companies (id INTEGER PRIMARY KEY, plan TEXT)"),
                session -> {
                },
                Reversal.degraded("column [plan] is kept because the database cannot drop columns"));
        MigrationExecutor executor = executor(MigrationRegistry.of(unit));
        executor.migrate();

        RollbackResult result = executor.rollback();

        assertThat(result.getOutcome()).isEqualTo(RollbackResult.Outcome.ROLLED_BACK_DEGRADED);
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getMessage()).contains("cannot drop columns");
        assertThat(ledger.getLedgerEntries()).isEmpty();
        assertThat(columnExists("companies", "plan")).isTrue();
    }

    @Test
    void rollback_keepsTheLedgerEntryWhenDownFails() {
        ScriptedMigrationUnit unit = new ScriptedMigrationUnit(
                "001",
                "Irreversible",
                session -> session.execute("CREATE TABLE companies (id INTEGER PRIMARY KEY)"),
                session -> {
                    throw new SQLException("cannot revert");
                },
                Reversal.complete());
        MigrationExecutor executor = executor(MigrationRegistry.of(unit));
        executor.migrate();

        RollbackResult result = executor.rollback();

        assertThat(result.getOutcome()).isEqualTo(RollbackResult.Outcome.FAILED);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getMessage()).isEqualTo("cannot revert");
        assertThat(ledger.appliedVersions()).containsExactly(V1);
    }

    @Test
    void rollback_failsWhenTheAppliedVersionIsNotRegistered() {
        executor(MigrationRegistry.of(ScriptedMigrationUnit.creatingTable("001", "companies"))).migrate();

        RollbackResult result = executor(new MigrationRegistry(List.of())).rollback();

        assertThat(result.getOutcome()).isEqualTo(RollbackResult.Outcome.FAILED);
        assertThat(result.getVersion()).isEqualTo(V1);
        assertThat(ledger.appliedVersions()).containsExactly(V1);
    }

    @Test
    void status_reportsEveryStateWithoutWriting() throws SQLException {
        MigrationExecutor executor = executor(MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.failing("002", "boom"),
                ScriptedMigrationUnit.creatingTable("003", "customers")));

        MigrationStatusReport fresh = executor.status();
        assertThat(fresh.getPendingVersions()).containsExactly(V1, V2, V3);
        assertThat(fresh.getCurrentVersion()).isNull();
        assertThat(tableExists(LedgerOperations.DEFAULT_TABLE_NAME)).isFalse();

        executor.migrate();
        ledger.record(MigrationVersion.of("099"), "Removed later", 3, true, null);

        MigrationStatusReport report = executor.status();

        assertThat(report.getMigrations()).extracting(MigrationState::getState).containsExactly(
                MigrationState.State.APPLIED,
                MigrationState.State.FAILED,
                MigrationState.State.PENDING,
                MigrationState.State.UNKNOWN);
        assertThat(report.getAppliedVersions()).containsExactly(V1);
        assertThat(report.getPendingVersions()).containsExactly(V2, V3);
        assertThat(report.getFailedVersions()).containsExactly(V2);
        assertThat(report.getUnknownVersions()).containsExactly(MigrationVersion.of("099"));
        assertThat(report.getCurrentVersion()).isEqualTo(V1);
        assertThat(report.isUpToDate()).isFalse();
        assertThat(report.getMigrations().get(1).getErrorMessage()).isEqualTo("boom");
        assertThat(report.getMigrations().get(1).getAttempts()).isEqualTo(1);
    }

    @Test
    void migrate_notifiesTheListener() {
        List<String> events = new ArrayList<>();
        MigrationListener listener = new MigrationListener() {
            @Override
            public void onStart(List<MigrationUnit> pending) {
                events.add("start " + pending.size());
            }

            @Override
            public void onApplying(MigrationUnit unit) {
                events.add("applying " + unit.getVersion());
            }

            @Override
            public void onApplied(MigrationUnit unit, long durationMs) {
                events.add("applied " + unit.getVersion());
            }

            @Override
            public void onFailed(MigrationUnit unit, long durationMs, String message) {
                events.add("failed " + unit.getVersion() + " " + message);
            }

            @Override
            public void onFinish(MigrationResult result) {
                events.add("finish " + result.getOutcome());
            }
        };
        MigrationExecutor executor = new MigrationExecutor(adapter, ledger, MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.failing("002", "boom")), 3, listener);

        executor.migrate();

        assertThat(events).containsExactly(
                "start 2",
                "applying 001",
                "applied 001",
                "applying 002",
                "failed 002 boom",
                "finish HALTED");
    }

    @Test
    void getState_isIdleBeforeTheFirstRun() {
        assertThat(executor(new MigrationRegistry(List.of())).getState()).isEqualTo(MigrationExecutor.State.IDLE);
    }

    private MigrationExecutor executor(MigrationRegistry registry) {
        return new MigrationExecutor(adapter, ledger, registry, SqlqueConfiguration.DEFAULT_MAX_ATTEMPTS, MigrationListener.NONE);
    }

    private static ScriptedMigrationUnit recording(String version, List<String> order) {
        return new ScriptedMigrationUnit(version, "Records " + version, session -> order.add(version), session -> {
        }, Reversal.complete());
    }
}
