package org.loesak.sqlque.core.result;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.util.List;

/**
 * Summary of one {@code migrate} run.
 */
@Value
public class MigrationResult {

    public enum Outcome {
        /** every pending unit was applied, or there was nothing to do */
        COMPLETED,
        /** a unit failed (or its ledger entry could not be written); later units were not attempted */
        HALTED,
        /** the next unit has exhausted its automatic retries and needs an operator */
        BLOCKED
    }

    @NonNull Outcome outcome;

    @NonNull List<AppliedMigration> applied;

    /** versions that were pending but not attempted in this run, the failing one excluded */
    @NonNull List<MigrationVersion> notAttempted;

    MigrationVersion failedVersion;

    String failureMessage;

    public static MigrationResult completed(final List<AppliedMigration> applied) {
        return new MigrationResult(Outcome.COMPLETED, List.copyOf(applied), List.of(), null, null);
    }

    public static MigrationResult stopped(
            final Outcome outcome,
            final List<AppliedMigration> applied,
            final List<MigrationVersion> notAttempted,
            final MigrationVersion failedVersion,
            final String failureMessage) {
        return new MigrationResult(outcome, List.copyOf(applied), List.copyOf(notAttempted), failedVersion, failureMessage);
    }

    public boolean isSuccessful() {
        return this.outcome == Outcome.COMPLETED;
    }

    public int getAppliedCount() {
        return this.applied.size();
    }

    /**
     * Number of units still pending after this run, including the failing one.
     */
    public int getRemainingCount() {
        return this.notAttempted.size() + (this.failedVersion == null ? 0 : 1);
    }
}
