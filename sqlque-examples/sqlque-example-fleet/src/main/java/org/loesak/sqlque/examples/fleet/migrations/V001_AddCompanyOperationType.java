package org.loesak.sqlque.examples.fleet.migrations;

import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;

/**
 * Companies either run their own fleet or service vehicles of their customers. Existing companies
 * keep working as fleet operators.
 */
@Slf4j
public class V001_AddCompanyOperationType extends AbstractMigrationUnit {

    public V001_AddCompanyOperationType() {
        super("001", "Add operation type to companies");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        if (session.columnExists("companies", "operation_type")) {
            log.info("Column [companies.operation_type] already exists");
            return;
        }

        if (session.isPostgres()) {
            session.execute("ALTER TABLE companies ADD COLUMN operation_type VARCHAR(10) DEFAULT 'FLEET'");
            session.execute("ALTER TABLE companies ADD CONSTRAINT check_operation_type CHECK (operation_type IN ('FLEET', 'SERVICE'))");
            session.execute("ALTER TABLE companies ALTER COLUMN operation_type SET NOT NULL");
        } else {
            // SQLite takes the CHECK inline since constraints cannot be added later
            session.execute("ALTER TABLE companies ADD COLUMN operation_type TEXT NOT NULL DEFAULT 'FLEET'"
                    + " CHECK (operation_type IN ('FLEET', 'SERVICE'))");
        }
        session.execute("CREATE INDEX IF NOT EXISTS idx_companies_operation_type ON companies(operation_type)");
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        session.execute("DROP INDEX IF EXISTS idx_companies_operation_type");

        if (!session.dialect().isDropColumnSupported()) {
            return Reversal.degraded("column [companies.operation_type] and its CHECK constraint are kept");
        }

        session.execute("ALTER TABLE companies DROP CONSTRAINT IF EXISTS check_operation_type");
        session.execute("ALTER TABLE companies DROP COLUMN IF EXISTS operation_type");
        return Reversal.complete();
    }
}
