package org.loesak.sqlque.core.exception;

public class LedgerException extends SqlqueException {

    public LedgerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
