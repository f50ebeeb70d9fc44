package org.loesak.sqlque.core.exception;

import lombok.Getter;
import org.loesak.sqlque.core.migration.MigrationVersion;

@Getter
public class MigrationExecutionException extends SqlqueException {

    private final MigrationVersion version;

    public MigrationExecutionException(final MigrationVersion version, final String message, final Throwable cause) {
        super(message, cause);
        this.version = version;
    }
}
