package org.loesak.sqlque.core.migration;

import lombok.Value;

/**
 * Outcome of a migration's {@code down} operation.
 *
 * <p>A degraded reversal means the active dialect could not fully express the undo (SQLite
 * cannot drop a column, for example). It is reported as a warning, never as a failure.
 */
@Value
public class Reversal {

    private static final Reversal COMPLETE = new Reversal(true, null);

    boolean complete;

    String limitation;

    public static Reversal complete() {
        return COMPLETE;
    }

    public static Reversal degraded(final String limitation) {
        return new Reversal(false, limitation);
    }
}
