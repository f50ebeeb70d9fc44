package org.loesak.sqlque.core;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.exception.LedgerException;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.jdbc.DialectAdapter;
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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies pending migration units strictly one at a time in ascending version order, recording each
 * outcome in the ledger before moving on and halting at the first failure.
 *
 * <p>Concurrent executors against the same database are not coordinated. A single deployment
 * pipeline is expected to drive migrations.
 */
@Slf4j
public class MigrationExecutor {

    public enum State {
        IDLE,
        DISCOVERING,
        APPLYING,
        RECORDING,
        COMPLETED,
        HALTED
    }

    private final DialectAdapter adapter;
    private final LedgerOperations ledger;
    private final MigrationRegistry registry;
    private final int maxAttempts;
    private final MigrationListener listener;

    private volatile State state = State.IDLE;

    public MigrationExecutor(
            @NonNull final DialectAdapter adapter,
            @NonNull final LedgerOperations ledger,
            @NonNull final MigrationRegistry registry,
            final int maxAttempts,
            @NonNull final MigrationListener listener) {
        this.adapter = adapter;
        this.ledger = ledger;
        this.registry = registry;
        this.maxAttempts = maxAttempts;
        this.listener = listener;
    }

    public State getState() {
        return this.state;
    }

    public MigrationResult migrate() {
        this.state = State.DISCOVERING;
        try {
            this.ledger.ensureSchema();

            final List<LedgerEntry> history = this.ledger.getLedgerEntries();
            this.verifyStateIntegrity(history);

            final Map<MigrationVersion, LedgerEntry> entries = history.stream()
                    .collect(Collectors.toMap(LedgerEntry::getVersion, Function.identity()));
            final Set<MigrationVersion> applied = history.stream()
                    .filter(LedgerEntry::isSuccess)
                    .map(LedgerEntry::getVersion)
                    .collect(Collectors.toSet());

            final List<MigrationUnit> toRun = this.registry.pending(applied);

            if (toRun.isEmpty()) {
                log.info("Database schema is up to date. [{}] migration(s) applied", applied.size());
                return this.finish(State.COMPLETED, MigrationResult.completed(List.of()));
            }

            log.info("Found [{}] pending migration(s)", toRun.size());
            this.listener.onStart(toRun);

            return this.runMigrations(toRun, entries);
        } catch (RuntimeException | Error e) {
            this.state = State.HALTED;
            throw e;
        }
    }

    private MigrationResult runMigrations(final List<MigrationUnit> toRun, final Map<MigrationVersion, LedgerEntry> entries) {
        final List<AppliedMigration> appliedInRun = new ArrayList<>();

        for (int position = 0; position < toRun.size(); position++) {
            final MigrationUnit unit = toRun.get(position);
            final List<MigrationVersion> notAttempted = versionsOf(toRun.subList(position + 1, toRun.size()));

            final LedgerEntry previous = entries.get(unit.getVersion());
            if (this.isRetryExhausted(previous)) {
                final String message = String.format(
                        "migration [%s] failed [%d] time(s) and will not be retried automatically. last error: %s. fix the migration and run repair for this version",
                        unit.getVersion(),
                        previous.getAttempts(),
                        previous.getErrorMessage());
                log.error(message);
                return this.finish(
                        State.HALTED,
                        MigrationResult.stopped(MigrationResult.Outcome.BLOCKED, appliedInRun, notAttempted, unit.getVersion(), message));
            }

            this.state = State.APPLYING;
            log.info("Applying migration [{}] ({})", unit.getVersion(), unit.getDisplayName());
            this.listener.onApplying(unit);

            final long start = System.nanoTime();
            try {
                unit.up(this.adapter);
            } catch (Exception | Error e) {
                final long duration = elapsedMillis(start);
                final String message = describe(e);

                log.error("Migration [{}] failed after [{}] milliseconds", unit.getVersion(), duration, e);

                this.state = State.RECORDING;
                try {
                    this.ledger.record(unit.getVersion(), unit.getDisplayName(), unit.getChecksum(), duration, false, message);
                } catch (LedgerException ledgerError) {
                    log.error("Could not record the failure of migration [{}]", unit.getVersion(), ledgerError);
                }

                this.listener.onFailed(unit, duration, message);
                if (e instanceof Error) {
                    // recorded as failed, then propagated
                    throw (Error) e;
                }
                return this.finish(
                        State.HALTED,
                        MigrationResult.stopped(MigrationResult.Outcome.HALTED, appliedInRun, notAttempted, unit.getVersion(), message));
            }

            final long duration = elapsedMillis(start);
            this.state = State.RECORDING;
            try {
                this.ledger.record(unit.getVersion(), unit.getDisplayName(), unit.getChecksum(), duration, true, null);
            } catch (LedgerException e) {
                // the schema change is committed but unrecorded. the next run re-attempts this unit
                final String message = String.format(
                        "migration [%s] was applied but its ledger entry could not be written (%s). it will be attempted again on the next run",
                        unit.getVersion(),
                        describe(e.getCause() == null ? e : e.getCause()));
                log.error(message, e);
                this.listener.onFailed(unit, duration, message);
                return this.finish(
                        State.HALTED,
                        MigrationResult.stopped(MigrationResult.Outcome.HALTED, appliedInRun, notAttempted, unit.getVersion(), message));
            }

            log.info("Migration [{}] applied. Took [{}] milliseconds", unit.getVersion(), duration);
            appliedInRun.add(new AppliedMigration(unit.getVersion(), unit.getDisplayName(), duration));
            this.listener.onApplied(unit, duration);
        }

        log.info("Completed migrations. [{}] applied", appliedInRun.size());
        return this.finish(State.COMPLETED, MigrationResult.completed(appliedInRun));
    }

    /**
     * Reverts the single highest applied version and removes its ledger entry.
     */
    public RollbackResult rollback() {
        if (!this.ledger.checkLedgerTableExists()) {
            log.info("No ledger table found. Nothing to roll back");
            return new RollbackResult(RollbackResult.Outcome.NOTHING_TO_ROLL_BACK, null, null);
        }

        final List<MigrationVersion> applied = new ArrayList<>(this.ledger.appliedVersions());
        if (applied.isEmpty()) {
            log.info("No applied migrations. Nothing to roll back");
            return new RollbackResult(RollbackResult.Outcome.NOTHING_TO_ROLL_BACK, null, null);
        }

        final MigrationVersion last = applied.get(applied.size() - 1);
        final Optional<MigrationUnit> unit = this.registry.find(last);
        if (unit.isEmpty()) {
            final String message = String.format("no migration unit is registered for applied version [%s]", last);
            log.error(message);
            return new RollbackResult(RollbackResult.Outcome.FAILED, last, message);
        }

        log.info("Rolling back migration [{}] ({})", last, unit.get().getDisplayName());

        final Reversal reversal;
        try {
            reversal = unit.get().down(this.adapter);
        } catch (Exception e) {
            log.error("Failed to roll back migration [{}]. Its ledger entry was kept", last, e);
            return new RollbackResult(RollbackResult.Outcome.FAILED, last, describe(e));
        }

        try {
            this.ledger.delete(last);
        } catch (LedgerException e) {
            final String message = String.format(
                    "migration [%s] was reverted but its ledger entry could not be deleted (%s)",
                    last,
                    describe(e.getCause() == null ? e : e.getCause()));
            log.error(message, e);
            return new RollbackResult(RollbackResult.Outcome.FAILED, last, message);
        }

        if (reversal != null && !reversal.isComplete()) {
            log.warn("Migration [{}] was only partially reverted on [{}]: {}", last, this.adapter.getDialect().getDisplayName(), reversal.getLimitation());
            return new RollbackResult(RollbackResult.Outcome.ROLLED_BACK_DEGRADED, last, reversal.getLimitation());
        }

        log.info("Migration [{}] rolled back", last);
        return new RollbackResult(RollbackResult.Outcome.ROLLED_BACK, last, null);
    }

    /**
     * Clears the failed ledger entry of {@code version} so the next run attempts it again with a
     * fresh retry budget. Successful entries are never touched.
     *
     * @return whether a failed entry was removed
     */
    public boolean repair(@NonNull final MigrationVersion version) {
        if (!this.ledger.checkLedgerTableExists()) {
            return false;
        }

        final Optional<LedgerEntry> entry = this.ledger.getLedgerEntry(version);
        if (entry.isPresent() && entry.get().isSuccess()) {
            throw new MigrationConfigurationException(String.format(
                    "migration [%s] is recorded as applied. use rollback to revert applied migrations",
                    version));
        }

        final boolean removed = this.ledger.deleteFailed(version);
        log.info(removed ? "Cleared failed ledger entry for version [{}]" : "No failed ledger entry found for version [{}]", version);
        return removed;
    }

    /**
     * Read-only report. Does not create the ledger table.
     */
    public MigrationStatusReport status() {
        final List<LedgerEntry> history = this.ledger.checkLedgerTableExists() ? this.ledger.getLedgerEntries() : List.of();
        final Map<MigrationVersion, LedgerEntry> entries = history.stream()
                .collect(Collectors.toMap(LedgerEntry::getVersion, Function.identity()));

        final List<MigrationState> states = new ArrayList<>();
        for (MigrationUnit unit : this.registry.discover()) {
            final LedgerEntry entry = entries.remove(unit.getVersion());
            if (entry == null) {
                states.add(new MigrationState(unit.getVersion(), unit.getDisplayName(), MigrationState.State.PENDING, null, null, 0, null));
            } else {
                states.add(toState(entry, entry.isSuccess() ? MigrationState.State.APPLIED : MigrationState.State.FAILED));
            }
        }
        entries.values().forEach(entry -> states.add(toState(entry, MigrationState.State.UNKNOWN)));
        states.sort(Comparator.comparing(MigrationState::getVersion));

        return new MigrationStatusReport(this.adapter.getDialect(), List.copyOf(states));
    }

    private void verifyStateIntegrity(final List<LedgerEntry> history) {
        log.info("Verifying integrity of the ledger as compared to registered migrations");

        for (LedgerEntry entry : history) {
            final Optional<MigrationUnit> companion = this.registry.find(entry.getVersion());

            if (companion.isEmpty()) {
                if (entry.isSuccess()) {
                    throw new MigrationConfigurationException(String.format(
                            "the ledger records version [%s] (%s) as applied but no migration unit is registered for it. did you remove or renumber a migration?",
                            entry.getVersion(),
                            entry.getName()));
                }
                log.warn("Ignoring failed ledger entry for unregistered version [{}]", entry.getVersion());
                continue;
            }

            final Integer checksum = companion.get().getChecksum();
            if (entry.isSuccess() && checksum != null && entry.getChecksum() != null && !checksum.equals(entry.getChecksum())) {
                throw new MigrationConfigurationException(String.format(
                        "migration [%s] was modified after it was applied (checksum [%d] recorded, [%d] found). applied migrations must not change",
                        entry.getVersion(),
                        entry.getChecksum(),
                        checksum));
            }
        }

        log.info("Integrity checks passed");
    }

    private boolean isRetryExhausted(final LedgerEntry previous) {
        return previous != null
                && !previous.isSuccess()
                && this.maxAttempts > 0
                && previous.getAttempts() >= this.maxAttempts;
    }

    private MigrationResult finish(final State terminal, final MigrationResult result) {
        this.state = terminal;
        this.listener.onFinish(result);
        return result;
    }

    private static MigrationState toState(final LedgerEntry entry, final MigrationState.State state) {
        return new MigrationState(
                entry.getVersion(),
                entry.getName(),
                state,
                entry.getAppliedAt(),
                entry.getExecutionTimeMs(),
                entry.getAttempts(),
                entry.getErrorMessage());
    }

    private static List<MigrationVersion> versionsOf(final List<MigrationUnit> units) {
        return units.stream().map(MigrationUnit::getVersion).collect(Collectors.toUnmodifiableList());
    }

    private static long elapsedMillis(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String describe(final Throwable error) {
        final String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
