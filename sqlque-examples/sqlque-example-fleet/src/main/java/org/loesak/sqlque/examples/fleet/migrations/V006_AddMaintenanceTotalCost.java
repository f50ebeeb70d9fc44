package org.loesak.sqlque.examples.fleet.migrations;

import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;

/**
 * Derived {@code maintenances.total_cost}. Stored on PostgreSQL; SQLite only allows virtual
 * generated columns to be added to an existing table.
 */
public class V006_AddMaintenanceTotalCost extends AbstractMigrationUnit {

    static final String EXPRESSION = "(COALESCE(labor_cost, 0) + COALESCE(parts_cost, 0))";

    public V006_AddMaintenanceTotalCost() {
        super("006", "Add generated total cost to maintenances");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        if (session.columnExists("maintenances", "total_cost")) {
            return;
        }

        if (session.dialect().isStoredGeneratedColumnOnAlterSupported()) {
            session.execute("ALTER TABLE maintenances ADD COLUMN total_cost NUMERIC(12, 2) GENERATED ALWAYS AS " + EXPRESSION + " STORED");
        } else {
            session.execute("ALTER TABLE maintenances ADD COLUMN total_cost REAL GENERATED ALWAYS AS " + EXPRESSION + " VIRTUAL");
        }
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        if (!session.dialect().isDropColumnSupported()) {
            return Reversal.degraded("generated column [maintenances.total_cost] is kept");
        }

        session.execute("ALTER TABLE maintenances DROP COLUMN IF EXISTS total_cost");
        return Reversal.complete();
    }
}
