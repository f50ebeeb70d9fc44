package org.loesak.sqlque.core.exception;

import lombok.Getter;
import org.loesak.sqlque.core.migration.MigrationVersion;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by the up-to-date check when the database still has pending (or failed) migrations.
 * Applications are expected to refuse to serve traffic when they see this at startup.
 */
@Getter
public class SchemaOutOfDateException extends SqlqueException {

    private final List<MigrationVersion> pendingVersions;

    public SchemaOutOfDateException(final List<MigrationVersion> pendingVersions) {
        super(String.format(
                "database schema is not up to date. [%d] pending migration(s): %s",
                pendingVersions.size(),
                pendingVersions.stream().map(MigrationVersion::toString).collect(Collectors.joining(", ", "[", "]"))));
        this.pendingVersions = List.copyOf(pendingVersions);
    }
}
