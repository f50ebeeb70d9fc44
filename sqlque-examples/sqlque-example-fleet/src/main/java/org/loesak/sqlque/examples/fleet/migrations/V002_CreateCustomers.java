package org.loesak.sqlque.examples.fleet.migrations;

import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;

/**
 * Customers of service companies, with an {@code updated_at} trigger. PostgreSQL needs a trigger
 * function, SQLite a self-updating AFTER UPDATE trigger.
 */
public class V002_CreateCustomers extends AbstractMigrationUnit {

    private static final String POSTGRESQL_TABLE = ""
            + "CREATE TABLE IF NOT EXISTS customers ("
            + " id BIGSERIAL PRIMARY KEY,"
            + " company_id BIGINT NOT NULL,"
            + " name VARCHAR(200) NOT NULL,"
            + " document VARCHAR(20),"
            + " document_type VARCHAR(10) CHECK (document_type IN ('PERSONAL', 'BUSINESS')),"
            + " phone VARCHAR(20),"
            + " email VARCHAR(200),"
            + " status VARCHAR(20) DEFAULT 'ACTIVE' CHECK (status IN ('ACTIVE', 'INACTIVE')),"
            + " created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
            + " CONSTRAINT fk_customers_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE RESTRICT,"
            + " CONSTRAINT unique_document_per_company UNIQUE (company_id, document))";

    private static final String POSTGRESQL_TRIGGER_FUNCTION = ""
            + "CREATE OR REPLACE FUNCTION update_customers_updated_at() RETURNS TRIGGER AS $$\n"
            + "BEGIN\n"
            + "    NEW.updated_at = CURRENT_TIMESTAMP;\n"
            + "    RETURN NEW;\n"
            + "END;\n"
            + "$$ LANGUAGE plpgsql";

    private static final String SQLITE_TABLE = ""
            + "CREATE TABLE IF NOT EXISTS customers ("
            + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
            + " company_id INTEGER NOT NULL,"
            + " name TEXT NOT NULL,"
            + " document TEXT,"
            + " document_type TEXT CHECK (document_type IN ('PERSONAL', 'BUSINESS')),"
            + " phone TEXT,"
            + " email TEXT,"
            + " status TEXT DEFAULT 'ACTIVE' CHECK (status IN ('ACTIVE', 'INACTIVE')),"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " FOREIGN KEY (company_id) REFERENCES companies(id),"
            + " UNIQUE (company_id, document))";

    private static final String SQLITE_TRIGGER = ""
            + "CREATE TRIGGER IF NOT EXISTS trigger_customers_updated_at"
            + " AFTER UPDATE ON customers FOR EACH ROW"
            + " BEGIN"
            + " UPDATE customers SET updated_at = CURRENT_TIMESTAMP WHERE id = NEW.id;"
            + " END";

    public V002_CreateCustomers() {
        super("002", "Create customers table");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        if (session.isPostgres()) {
            session.execute(POSTGRESQL_TABLE);
            session.execute(POSTGRESQL_TRIGGER_FUNCTION);
            session.execute("DROP TRIGGER IF EXISTS trigger_customers_updated_at ON customers");
            session.execute("CREATE TRIGGER trigger_customers_updated_at BEFORE UPDATE ON customers"
                    + " FOR EACH ROW EXECUTE FUNCTION update_customers_updated_at()");
            session.execute("CREATE INDEX IF NOT EXISTS idx_customers_document ON customers(document) WHERE document IS NOT NULL");
        } else {
            session.execute(SQLITE_TABLE);
            session.execute(SQLITE_TRIGGER);
        }

        session.execute("CREATE INDEX IF NOT EXISTS idx_customers_company ON customers(company_id)");
        session.execute("CREATE INDEX IF NOT EXISTS idx_customers_company_status ON customers(company_id, status)");
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        if (session.isPostgres()) {
            session.execute("DROP TABLE IF EXISTS customers CASCADE");
            session.execute("DROP FUNCTION IF EXISTS update_customers_updated_at()");
        } else {
            session.execute("DROP TABLE IF EXISTS customers");
        }
        return Reversal.complete();
    }
}
