package org.loesak.sqlque.examples.fleet.migrations;

import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;

import java.sql.SQLException;
import java.util.List;

/**
 * Adds user roles and subscription plan limits.
 *
 * <p>When the role column is introduced the first user of each company (lowest id) becomes its
 * ADMIN; everybody else is an OPERATOR. The promotion only happens together with adding the column
 * so a retried run never demotes or promotes anyone twice.
 */
@Slf4j
public class V004_AddRolesAndPlans extends AbstractMigrationUnit {

    private static final List<PlanColumn> PLAN_COLUMNS = List.of(
            new PlanColumn("plan", "VARCHAR(20)", "TEXT", "'BASIC'"),
            new PlanColumn("customer_limit", "INTEGER", "INTEGER", "50"),
            new PlanColumn("vehicle_limit", "INTEGER", "INTEGER", "50"),
            new PlanColumn("user_limit", "INTEGER", "INTEGER", "3"));

    public V004_AddRolesAndPlans() {
        super("004", "Add user roles and company plans");
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        if (session.columnExists("users", "role")) {
            log.info("Column [users.role] already exists. Skipping admin promotion");
        } else {
            session.execute(session.isPostgres()
                    ? "ALTER TABLE users ADD COLUMN role VARCHAR(20) NOT NULL DEFAULT 'OPERATOR'"
                    : "ALTER TABLE users ADD COLUMN role TEXT NOT NULL DEFAULT 'OPERATOR'");

            final int promoted = session.update(
                    "UPDATE users SET role = 'ADMIN' WHERE id IN ("
                            + " SELECT MIN(id) FROM users WHERE company_id IS NOT NULL GROUP BY company_id)");
            log.info("Promoted [{}] user(s) to ADMIN", promoted);
        }

        for (PlanColumn column : PLAN_COLUMNS) {
            if (!session.columnExists("companies", column.name)) {
                session.execute(String.format("ALTER TABLE companies ADD COLUMN %s %s DEFAULT %s",
                        column.name,
                        session.isPostgres() ? column.postgresType : column.sqliteType,
                        column.defaultValue));
            }
        }
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        if (!session.dialect().isDropColumnSupported()) {
            return Reversal.degraded("columns [users.role] and the company plan columns are kept");
        }

        for (PlanColumn column : PLAN_COLUMNS) {
            session.execute("ALTER TABLE companies DROP COLUMN IF EXISTS " + column.name);
        }
        session.execute("ALTER TABLE users DROP COLUMN IF EXISTS role");
        return Reversal.complete();
    }

    private static final class PlanColumn {
        private final String name;
        private final String postgresType;
        private final String sqliteType;
        private final String defaultValue;

        private PlanColumn(final String name, final String postgresType, final String sqliteType, final String defaultValue) {
            this.name = name;
            this.postgresType = postgresType;
            this.sqliteType = sqliteType;
            this.defaultValue = defaultValue;
        }
    }
}
