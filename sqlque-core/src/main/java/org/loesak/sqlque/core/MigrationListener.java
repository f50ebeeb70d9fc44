package org.loesak.sqlque.core;

import org.loesak.sqlque.core.migration.MigrationUnit;
import org.loesak.sqlque.core.result.MigrationResult;

import java.util.List;

/**
 * Progress callbacks of a migrate run. All methods default to no-ops.
 */
public interface MigrationListener {

    MigrationListener NONE = new MigrationListener() {};

    default void onStart(final List<MigrationUnit> pending) {
    }

    default void onApplying(final MigrationUnit unit) {
    }

    default void onApplied(final MigrationUnit unit, final long durationMs) {
    }

    default void onFailed(final MigrationUnit unit, final long durationMs, final String message) {
    }

    default void onFinish(final MigrationResult result) {
    }
}
