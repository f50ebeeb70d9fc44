package org.loesak.sqlque.core.exception;

/**
 * Raised before any migration runs when the setup itself is wrong: a missing or unsupported
 * connection string, colliding versions, a modified migration that was already applied, and so on.
 */
public class MigrationConfigurationException extends SqlqueException {

    public MigrationConfigurationException(final String message) {
        super(message);
    }

    public MigrationConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
