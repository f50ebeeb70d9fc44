package org.loesak.sqlque.examples.fleet.migrations;

import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;
import java.util.List;

/**
 * Base tables of the fleet maintenance system. Every later migration builds on these.
 */
public class V000_BootstrapSchema extends AbstractMigrationUnit {

    private static final List<String> POSTGRESQL = List.of(
            "CREATE TABLE IF NOT EXISTS companies ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " name VARCHAR(200) NOT NULL,"
                    + " trade_name VARCHAR(200),"
                    + " tax_id VARCHAR(20) UNIQUE,"
                    + " phone VARCHAR(20),"
                    + " email VARCHAR(200),"
                    + " active BOOLEAN DEFAULT TRUE,"
                    + " created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS users ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " username VARCHAR(100) UNIQUE NOT NULL,"
                    + " email VARCHAR(200),"
                    + " full_name VARCHAR(200),"
                    + " password_hash VARCHAR(255) NOT NULL,"
                    + " company_id BIGINT,"
                    + " active BOOLEAN DEFAULT TRUE,"
                    + " created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " last_login TIMESTAMP WITH TIME ZONE,"
                    + " CONSTRAINT fk_users_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE SET NULL)",
            "CREATE TABLE IF NOT EXISTS audit_log ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " user_id BIGINT,"
                    + " action VARCHAR(200),"
                    + " details TEXT,"
                    + " ip_address VARCHAR(50),"
                    + " logged_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " CONSTRAINT fk_audit_log_user FOREIGN KEY (user_id) REFERENCES users(id) ON DELETE SET NULL)",
            "CREATE TABLE IF NOT EXISTS vehicles ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " company_id BIGINT NOT NULL,"
                    + " kind VARCHAR(50) NOT NULL,"
                    + " make VARCHAR(100) NOT NULL,"
                    + " model VARCHAR(100) NOT NULL,"
                    + " plate VARCHAR(20) NOT NULL,"
                    + " model_year INTEGER,"
                    + " mileage INTEGER DEFAULT 0,"
                    + " next_maintenance DATE,"
                    + " status VARCHAR(50) DEFAULT 'OPERATIONAL',"
                    + " created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " CONSTRAINT fk_vehicles_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " CONSTRAINT unique_plate_per_company UNIQUE (company_id, plate))",
            "CREATE TABLE IF NOT EXISTS suppliers ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " company_id BIGINT NOT NULL,"
                    + " name VARCHAR(200) NOT NULL,"
                    + " contact VARCHAR(200),"
                    + " phone VARCHAR(20),"
                    + " active BOOLEAN DEFAULT TRUE,"
                    + " CONSTRAINT fk_suppliers_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE)",
            "CREATE TABLE IF NOT EXISTS parts ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " company_id BIGINT NOT NULL,"
                    + " name VARCHAR(200) NOT NULL,"
                    + " code VARCHAR(100) NOT NULL,"
                    + " price NUMERIC(12, 2) NOT NULL DEFAULT 0,"
                    + " supplier_id BIGINT,"
                    + " stock_quantity INTEGER DEFAULT 0,"
                    + " minimum_stock INTEGER DEFAULT 5,"
                    + " CONSTRAINT fk_parts_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " CONSTRAINT fk_parts_supplier FOREIGN KEY (supplier_id) REFERENCES suppliers(id) ON DELETE SET NULL,"
                    + " CONSTRAINT unique_code_per_company UNIQUE (company_id, code),"
                    + " CONSTRAINT check_price_positive CHECK (price >= 0),"
                    + " CONSTRAINT check_stock_positive CHECK (stock_quantity >= 0))",
            "CREATE TABLE IF NOT EXISTS maintenances ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " company_id BIGINT NOT NULL,"
                    + " vehicle_id BIGINT NOT NULL,"
                    + " kind VARCHAR(50) NOT NULL,"
                    + " description TEXT,"
                    + " scheduled_on DATE NOT NULL,"
                    + " performed_on DATE,"
                    + " labor_cost NUMERIC(12, 2) DEFAULT 0,"
                    + " parts_cost NUMERIC(12, 2) DEFAULT 0,"
                    + " status VARCHAR(50) DEFAULT 'SCHEDULED',"
                    + " created_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,"
                    + " CONSTRAINT fk_maintenances_company FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " CONSTRAINT fk_maintenances_vehicle FOREIGN KEY (vehicle_id) REFERENCES vehicles(id) ON DELETE CASCADE)",
            "CREATE TABLE IF NOT EXISTS maintenance_parts ("
                    + " id BIGSERIAL PRIMARY KEY,"
                    + " maintenance_id BIGINT NOT NULL,"
                    + " part_id BIGINT NOT NULL,"
                    + " quantity INTEGER NOT NULL DEFAULT 1,"
                    + " unit_price NUMERIC(12, 2) NOT NULL DEFAULT 0,"
                    + " subtotal NUMERIC(12, 2) GENERATED ALWAYS AS (quantity * unit_price) STORED,"
                    + " CONSTRAINT fk_maintenance_parts_maintenance FOREIGN KEY (maintenance_id) REFERENCES maintenances(id) ON DELETE CASCADE,"
                    + " CONSTRAINT fk_maintenance_parts_part FOREIGN KEY (part_id) REFERENCES parts(id) ON DELETE RESTRICT,"
                    + " CONSTRAINT check_quantity_positive CHECK (quantity > 0))",
            "CREATE INDEX IF NOT EXISTS idx_users_company ON users(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_vehicles_company ON vehicles(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_vehicles_status ON vehicles(company_id, status)",
            "CREATE INDEX IF NOT EXISTS idx_parts_company ON parts(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_parts_low_stock ON parts(company_id) WHERE stock_quantity <= minimum_stock",
            "CREATE INDEX IF NOT EXISTS idx_maintenances_vehicle ON maintenances(vehicle_id)",
            "CREATE INDEX IF NOT EXISTS idx_maintenances_scheduled ON maintenances(scheduled_on)",
            "CREATE INDEX IF NOT EXISTS idx_maintenance_parts_maintenance ON maintenance_parts(maintenance_id)",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_user ON audit_log(user_id)");

    private static final List<String> SQLITE = List.of(
            "CREATE TABLE IF NOT EXISTS companies ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " name TEXT NOT NULL,"
                    + " trade_name TEXT,"
                    + " tax_id TEXT UNIQUE,"
                    + " phone TEXT,"
                    + " email TEXT,"
                    + " active INTEGER DEFAULT 1,"
                    + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE TABLE IF NOT EXISTS users ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " username TEXT UNIQUE NOT NULL,"
                    + " email TEXT,"
                    + " full_name TEXT,"
                    + " password_hash TEXT NOT NULL,"
                    + " company_id INTEGER,"
                    + " active INTEGER DEFAULT 1,"
                    + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " last_login TIMESTAMP,"
                    + " FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE SET NULL)",
            "CREATE TABLE IF NOT EXISTS audit_log ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " user_id INTEGER,"
                    + " action TEXT,"
                    + " details TEXT,"
                    + " ip_address TEXT,"
                    + " logged_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " FOREIGN KEY (user_id) REFERENCES users(id) ON DELETE SET NULL)",
            "CREATE TABLE IF NOT EXISTS vehicles ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " company_id INTEGER NOT NULL,"
                    + " kind TEXT NOT NULL,"
                    + " make TEXT NOT NULL,"
                    + " model TEXT NOT NULL,"
                    + " plate TEXT NOT NULL,"
                    + " model_year INTEGER,"
                    + " mileage INTEGER DEFAULT 0,"
                    + " next_maintenance DATE,"
                    + " status TEXT DEFAULT 'OPERATIONAL',"
                    + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " UNIQUE (company_id, plate))",
            "CREATE TABLE IF NOT EXISTS suppliers ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " company_id INTEGER NOT NULL,"
                    + " name TEXT NOT NULL,"
                    + " contact TEXT,"
                    + " phone TEXT,"
                    + " active INTEGER DEFAULT 1,"
                    + " FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE)",
            "CREATE TABLE IF NOT EXISTS parts ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " company_id INTEGER NOT NULL,"
                    + " name TEXT NOT NULL,"
                    + " code TEXT NOT NULL,"
                    + " price REAL NOT NULL DEFAULT 0 CHECK (price >= 0),"
                    + " supplier_id INTEGER,"
                    + " stock_quantity INTEGER DEFAULT 0 CHECK (stock_quantity >= 0),"
                    + " minimum_stock INTEGER DEFAULT 5,"
                    + " FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " FOREIGN KEY (supplier_id) REFERENCES suppliers(id) ON DELETE SET NULL,"
                    + " UNIQUE (company_id, code))",
            "CREATE TABLE IF NOT EXISTS maintenances ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " company_id INTEGER NOT NULL,"
                    + " vehicle_id INTEGER NOT NULL,"
                    + " kind TEXT NOT NULL,"
                    + " description TEXT,"
                    + " scheduled_on DATE NOT NULL,"
                    + " performed_on DATE,"
                    + " labor_cost REAL DEFAULT 0,"
                    + " parts_cost REAL DEFAULT 0,"
                    + " status TEXT DEFAULT 'SCHEDULED',"
                    + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
                    + " FOREIGN KEY (company_id) REFERENCES companies(id) ON DELETE CASCADE,"
                    + " FOREIGN KEY (vehicle_id) REFERENCES vehicles(id) ON DELETE CASCADE)",
            "CREATE TABLE IF NOT EXISTS maintenance_parts ("
                    + " id INTEGER PRIMARY KEY AUTOINCREMENT,"
                    + " maintenance_id INTEGER NOT NULL,"
                    + " part_id INTEGER NOT NULL,"
                    + " quantity INTEGER NOT NULL DEFAULT 1 CHECK (quantity > 0),"
                    + " unit_price REAL NOT NULL DEFAULT 0,"
                    + " subtotal REAL GENERATED ALWAYS AS (quantity * unit_price) STORED,"
                    + " FOREIGN KEY (maintenance_id) REFERENCES maintenances(id) ON DELETE CASCADE,"
                    + " FOREIGN KEY (part_id) REFERENCES parts(id) ON DELETE RESTRICT)",
            "CREATE INDEX IF NOT EXISTS idx_users_company ON users(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_vehicles_company ON vehicles(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_vehicles_status ON vehicles(company_id, status)",
            "CREATE INDEX IF NOT EXISTS idx_parts_company ON parts(company_id)",
            "CREATE INDEX IF NOT EXISTS idx_maintenances_vehicle ON maintenances(vehicle_id)",
            "CREATE INDEX IF NOT EXISTS idx_maintenances_scheduled ON maintenances(scheduled_on)",
            "CREATE INDEX IF NOT EXISTS idx_maintenance_parts_maintenance ON maintenance_parts(maintenance_id)",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_user ON audit_log(user_id)");

    // reverse dependency order
    private static final List<String> TABLES = List.of(
            "maintenance_parts", "maintenances", "parts", "suppliers", "vehicles", "audit_log", "users", "companies");

    public V000_BootstrapSchema() {
        super("000", "Bootstrap base schema");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        for (String statement : session.isPostgres() ? POSTGRESQL : SQLITE) {
            session.execute(statement);
        }
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        for (String table : TABLES) {
            session.execute(session.isPostgres()
                    ? "DROP TABLE IF EXISTS " + table + " CASCADE"
                    : "DROP TABLE IF EXISTS " + table);
        }
        return Reversal.complete();
    }
}
