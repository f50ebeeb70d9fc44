package org.loesak.sqlque.core.exception;

/**
 * Base type for every failure raised by sqlque.
 */
public class SqlqueException extends RuntimeException {

    public SqlqueException(final String message) {
        super(message);
    }

    public SqlqueException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
