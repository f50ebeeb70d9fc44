package org.loesak.sqlque.examples.fleet.migrations;

import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;

/**
 * Vehicles of service companies belong to a customer; fleet vehicles keep a NULL customer.
 */
public class V003_AddCustomerToVehicles extends AbstractMigrationUnit {

    public V003_AddCustomerToVehicles() {
        super("003", "Add customer reference to vehicles");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        if (!session.columnExists("vehicles", "customer_id")) {
            session.execute(session.isPostgres()
                    ? "ALTER TABLE vehicles ADD COLUMN customer_id BIGINT REFERENCES customers(id) ON DELETE SET NULL"
                    : "ALTER TABLE vehicles ADD COLUMN customer_id INTEGER REFERENCES customers(id) ON DELETE SET NULL");
        }
        session.execute("CREATE INDEX IF NOT EXISTS idx_vehicles_customer ON vehicles(customer_id)");
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        session.execute("DROP INDEX IF EXISTS idx_vehicles_customer");

        if (!session.dialect().isDropColumnSupported()) {
            return Reversal.degraded("column [vehicles.customer_id] is kept");
        }

        session.execute("ALTER TABLE vehicles DROP COLUMN IF EXISTS customer_id");
        return Reversal.complete();
    }
}
