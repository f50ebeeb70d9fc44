package org.loesak.sqlque.core.result;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.jdbc.Dialect;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of applied versus pending migrations.
 */
@Value
public class MigrationStatusReport {

    @NonNull Dialect dialect;

    @NonNull List<MigrationState> migrations;

    public List<MigrationVersion> getAppliedVersions() {
        return this.versionsIn(MigrationState.State.APPLIED);
    }

    /**
     * Versions that the next run would attempt, failed ones included.
     */
    public List<MigrationVersion> getPendingVersions() {
        return this.migrations.stream()
                              .filter(migration -> migration.getState() == MigrationState.State.PENDING
                                      || migration.getState() == MigrationState.State.FAILED)
                              .map(MigrationState::getVersion)
                              .collect(Collectors.toUnmodifiableList());
    }

    public List<MigrationVersion> getFailedVersions() {
        return this.versionsIn(MigrationState.State.FAILED);
    }

    public List<MigrationVersion> getUnknownVersions() {
        return this.versionsIn(MigrationState.State.UNKNOWN);
    }

    /**
     * Highest applied version, or {@code null} on an empty ledger.
     */
    public MigrationVersion getCurrentVersion() {
        final List<MigrationVersion> applied = this.getAppliedVersions();
        return applied.isEmpty() ? null : applied.get(applied.size() - 1);
    }

    public boolean isUpToDate() {
        return this.getPendingVersions().isEmpty();
    }

    private List<MigrationVersion> versionsIn(final MigrationState.State state) {
        return this.migrations.stream()
                              .filter(migration -> migration.getState() == state)
                              .map(MigrationState::getVersion)
                              .collect(Collectors.toUnmodifiableList());
    }
}
