package org.loesak.sqlque.core.result;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.migration.MigrationVersion;

@Value
public class AppliedMigration {

    @NonNull MigrationVersion version;
    @NonNull String name;
    long durationMs;
}
