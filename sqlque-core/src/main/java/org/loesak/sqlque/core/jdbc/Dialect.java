package org.loesak.sqlque.core.jdbc;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The two supported SQL backends. Capability flags only describe what migrations need to branch on;
 * the statements themselves are written per dialect inside each migration.
 */
@Getter
@RequiredArgsConstructor
public enum Dialect {

    POSTGRESQL("PostgreSQL", true, true, true),

    /*
     ALTER TABLE on SQLite can only add or rename columns. Generated columns added through ALTER TABLE
     must be VIRTUAL
     */
    SQLITE("SQLite", false, false, false);

    private final String displayName;
    private final boolean dropColumnSupported;
    private final boolean alterColumnSupported;
    private final boolean storedGeneratedColumnOnAlterSupported;
}
