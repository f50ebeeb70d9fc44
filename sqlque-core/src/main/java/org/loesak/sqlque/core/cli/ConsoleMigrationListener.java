package org.loesak.sqlque.core.cli;

import lombok.RequiredArgsConstructor;
import org.loesak.sqlque.core.MigrationListener;
import org.loesak.sqlque.core.migration.MigrationUnit;
import org.loesak.sqlque.core.result.MigrationResult;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints one line per attempted version and a final pass/fail summary.
 */
@RequiredArgsConstructor
class ConsoleMigrationListener implements MigrationListener {

    private final PrintStream out;

    @Override
    public void onStart(final List<MigrationUnit> pending) {
        this.out.printf("Found %d pending migration(s)%n", pending.size());
    }

    @Override
    public void onApplying(final MigrationUnit unit) {
        this.out.printf("  -> %s  %s%n", unit.getVersion(), unit.getDisplayName());
    }

    @Override
    public void onApplied(final MigrationUnit unit, final long durationMs) {
        this.out.printf("     applied in %d ms%n", durationMs);
    }

    @Override
    public void onFailed(final MigrationUnit unit, final long durationMs, final String message) {
        this.out.printf("     FAILED after %d ms: %s%n", durationMs, message);
    }

    @Override
    public void onFinish(final MigrationResult result) {
        if (result.isSuccessful()) {
            if (result.getAppliedCount() == 0) {
                this.out.println("Database is up to date. No pending migrations");
            } else {
                this.out.printf("SUCCESS: %d migration(s) applied%n", result.getAppliedCount());
            }
            return;
        }

        this.out.printf("%s: %d applied, %d remaining%n", result.getOutcome(), result.getAppliedCount(), result.getRemainingCount());
        this.out.printf("  failing version: %s%n", result.getFailedVersion());
        this.out.printf("  error: %s%n", result.getFailureMessage());
        if (!result.getNotAttempted().isEmpty()) {
            this.out.printf("  not attempted: %s%n", result.getNotAttempted());
        }
    }
}
