package org.loesak.sqlque.core.result;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.time.Instant;

/**
 * Status of one version as seen by the status report.
 */
@Value
public class MigrationState {

    public enum State {
        APPLIED,
        /** attempted and failed, still pending */
        FAILED,
        PENDING,
        /** present in the ledger but no longer registered */
        UNKNOWN
    }

    @NonNull MigrationVersion version;

    @NonNull String name;

    @NonNull State state;

    Instant appliedAt;

    Long executionTimeMs;

    int attempts;

    String errorMessage;
}
