package org.loesak.sqlque.core.migration;

import org.loesak.sqlque.core.jdbc.DialectAdapter;

/**
 * One versioned, reversible schema change.
 *
 * <p>Implementations branch on {@link DialectAdapter#getDialect()} themselves; there is no
 * translation layer between PostgreSQL and SQLite. {@link #up(DialectAdapter)} is re-invoked
 * after a failed or unrecorded attempt, so it must detect work that already happened and skip it.
 * Any exception thrown is treated as a migration failure by the runner.
 *
 * @see AbstractMigrationUnit
 */
public interface MigrationUnit {

    MigrationVersion getVersion();

    String getDisplayName();

    /**
     * Checksum of the unit's definition, or {@code null} when the unit has none. Applied units whose
     * checksum changed afterwards are rejected.
     */
    default Integer getChecksum() {
        return null;
    }

    void up(DialectAdapter adapter) throws Exception;

    Reversal down(DialectAdapter adapter) throws Exception;
}
