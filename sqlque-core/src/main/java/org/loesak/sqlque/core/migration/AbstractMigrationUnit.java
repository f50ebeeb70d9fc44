package org.loesak.sqlque.core.migration;

import lombok.Getter;
import lombok.NonNull;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.jdbc.DialectAdapter;
import org.loesak.sqlque.core.jdbc.SchemaSession;

import java.sql.SQLException;

/**
 * Base class for hand-written migrations. Each {@code up}/{@code down} call gets its own connection
 * and transaction: committed when {@link #apply(SchemaSession)} or {@link #revert(SchemaSession)}
 * returns, rolled back when they throw.
 */
@Getter
public abstract class AbstractMigrationUnit implements MigrationUnit {

    private final MigrationVersion version;
    private final String displayName;

    protected AbstractMigrationUnit(@NonNull final String version, @NonNull final String displayName) {
        if (displayName.isBlank()) {
            throw new MigrationConfigurationException(String.format("migration [%s] must have a display name", version));
        }
        this.version = MigrationVersion.of(version);
        this.displayName = displayName;
    }

    @Override
    public final void up(final DialectAdapter adapter) throws SQLException {
        adapter.inTransaction(session -> {
            this.apply(session);
            return null;
        });
    }

    @Override
    public final Reversal down(final DialectAdapter adapter) throws SQLException {
        return adapter.inTransaction(this::revert);
    }

    protected abstract void apply(SchemaSession session) throws SQLException;

    protected abstract Reversal revert(SchemaSession session) throws SQLException;

    @Override
    public String toString() {
        return String.format("%s (%s)", this.version, this.displayName);
    }
}
