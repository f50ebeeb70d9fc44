package org.loesak.sqlque.core.jdbc.ledger;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.time.Instant;

/**
 * One row of the ledger table. There is at most one entry per version; re-attempting a version
 * overwrites it and bumps {@link #getAttempts()}.
 */
@Value
public class LedgerEntry {

    @NonNull MigrationVersion version;

    @NonNull String name;

    /** {@code null} only for rows written by other tools without a timestamp */
    Instant appliedAt;

    Long executionTimeMs;

    boolean success;

    String errorMessage;

    Integer checksum;

    String installedBy; // user if any

    int attempts;

}
