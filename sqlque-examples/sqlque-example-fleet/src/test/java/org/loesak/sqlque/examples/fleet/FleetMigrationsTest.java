package org.loesak.sqlque.examples.fleet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.loesak.sqlque.core.Sqlque;
import org.loesak.sqlque.core.SqlqueConfiguration;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationUnit;
import org.loesak.sqlque.core.migration.MigrationVersion;
import org.loesak.sqlque.core.result.MigrationResult;
import org.loesak.sqlque.core.result.RollbackResult;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FleetMigrationsTest {

    @TempDir
    Path tempDir;

    private String databaseUrl;

    @BeforeEach
    void setUp() {
        databaseUrl = "sqlite:///" + tempDir.resolve("fleet.db").toAbsolutePath();
    }

    @Test
    void registry_listsUnitsInVersionOrder() {
        assertThat(FleetMigrations.registry().discover())
                .extracting(unit -> unit.getVersion().toString())
                .containsExactly("000", "001", "002", "003", "004", "005", "006");
    }

    @Test
    void migrate_appliesEveryUnitOnSqlite() throws SQLException {
        Sqlque sqlque = sqlque(FleetMigrations.registry());

        MigrationResult result = sqlque.migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getAppliedCount()).isEqualTo(7);
        assertThat(sqlque.status().isUpToDate()).isTrue();
        assertThat(sqlque.status().getCurrentVersion()).isEqualTo(MigrationVersion.of("006"));

        assertThat(query(sqlque, "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'notifications'")).isEqualTo(1);
        assertThat(query(sqlque, "SELECT COUNT(*) FROM sqlite_master WHERE type = 'trigger' AND name = 'trigger_customers_updated_at'")).isEqualTo(1);
    }

    @Test
    void migrate_secondRunAppliesNothing() {
        sqlque(FleetMigrations.registry()).migrate();

        MigrationResult result = sqlque(FleetMigrations.registry()).migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getAppliedCount()).isZero();
    }

    @Test
    void rolesAndPlans_promotesTheFirstUserOfEachCompany() throws SQLException {
        List<MigrationUnit> beforeRoles = FleetMigrations.all().subList(0, 4);
        Sqlque sqlque = sqlque(new MigrationRegistry(beforeRoles));
        assertThat(sqlque.migrate().isSuccessful()).isTrue();

        execute(sqlque,
                "INSERT INTO companies (id, name) VALUES (1, 'North Fleet'), (2, 'South Service')",
                "INSERT INTO users (id, username, password_hash, company_id) VALUES"
                        + " (10, 'ana', 'x', 1), (11, 'bruno', 'x', 1), (12, 'carla', 'x', 2), (13, 'nobody', 'x', NULL)");

        assertThat(sqlque(FleetMigrations.registry()).migrate().isSuccessful()).isTrue();

        assertThat(queryStrings(sqlque, "SELECT username || ':' || role FROM users ORDER BY id"))
                .containsExactly("ana:ADMIN", "bruno:OPERATOR", "carla:ADMIN", "nobody:OPERATOR");
        assertThat(queryStrings(sqlque, "SELECT plan || ':' || customer_limit || ':' || vehicle_limit || ':' || user_limit FROM companies WHERE id = 1"))
                .containsExactly("BASIC:50:50:3");
    }

    @Test
    void operationType_rejectsValuesOutsideTheCheckConstraint() {
        Sqlque sqlque = sqlque(FleetMigrations.registry());
        sqlque.migrate();

        assertThatThrownBy(() -> execute(sqlque, "INSERT INTO companies (name, operation_type) VALUES ('Acme', 'RENTAL')"))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("CHECK");
    }

    @Test
    void customers_rejectUnknownStatus() throws SQLException {
        Sqlque sqlque = sqlque(FleetMigrations.registry());
        sqlque.migrate();
        execute(sqlque, "INSERT INTO companies (id, name, operation_type) VALUES (1, 'Acme', 'SERVICE')");

        execute(sqlque, "INSERT INTO customers (company_id, name, document, document_type) VALUES (1, 'Dora', '123', 'PERSONAL')");

        assertThatThrownBy(() -> execute(sqlque, "INSERT INTO customers (company_id, name, status) VALUES (1, 'Eli', 'BANNED')"))
                .isInstanceOf(SQLException.class);
        assertThatThrownBy(() -> execute(sqlque, "INSERT INTO customers (company_id, name, document) VALUES (1, 'Dora Again', '123')"))
                .isInstanceOf(SQLException.class);
    }

    @Test
    void totalCost_isDerivedFromLaborAndParts() throws SQLException {
        Sqlque sqlque = sqlque(FleetMigrations.registry());
        sqlque.migrate();

        execute(sqlque,
                "INSERT INTO companies (id, name) VALUES (1, 'Acme')",
                "INSERT INTO vehicles (id, company_id, kind, make, model, plate) VALUES (1, 1, 'TRUCK', 'Volvo', 'FH', 'ABC1234')",
                "INSERT INTO maintenances (company_id, vehicle_id, kind, scheduled_on, labor_cost, parts_cost) VALUES (1, 1, 'PREVENTIVE', '2024-01-10', 100, 50.5)");

        assertThat(queryStrings(sqlque, "SELECT total_cost FROM maintenances")).containsExactly("150.5");
    }

    @Test
    void rollback_walksBackEveryUnitAndReportsWhatSqliteKeeps() throws SQLException {
        Sqlque sqlque = sqlque(FleetMigrations.registry());
        sqlque.migrate();

        List<String> outcomes = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            RollbackResult result = sqlque.rollback();
            outcomes.add(result.getVersion() + ":" + result.getOutcome());
        }

        assertThat(outcomes).containsExactly(
                "006:ROLLED_BACK_DEGRADED",
                "005:ROLLED_BACK",
                "004:ROLLED_BACK_DEGRADED",
                "003:ROLLED_BACK_DEGRADED",
                "002:ROLLED_BACK",
                "001:ROLLED_BACK_DEGRADED",
                "000:ROLLED_BACK");
        assertThat(sqlque.rollback().getOutcome()).isEqualTo(RollbackResult.Outcome.NOTHING_TO_ROLL_BACK);
        assertThat(query(sqlque, "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = 'companies'")).isZero();
        assertThat(sqlque.status().getPendingVersions()).hasSize(7);
    }

    @Test
    void rollback_thenMigrate_reappliesTheUnit() {
        Sqlque sqlque = sqlque(FleetMigrations.registry());
        sqlque.migrate();

        assertThat(sqlque.rollback().getVersion()).isEqualTo(MigrationVersion.of("006"));
        MigrationResult result = sqlque.migrate();

        // the column survived the degraded reversal, so the unit skips adding it again
        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getAppliedCount()).isEqualTo(1);
    }

    private Sqlque sqlque(MigrationRegistry registry) {
        return new Sqlque(SqlqueConfiguration.of(databaseUrl), registry);
    }

    private static void execute(Sqlque sqlque, String... statements) throws SQLException {
        try (Connection connection = sqlque.getDialectAdapter().getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
    }

    private static long query(Sqlque sqlque, String sql) throws SQLException {
        try (Connection connection = sqlque.getDialectAdapter().getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    private static List<String> queryStrings(Sqlque sqlque, String sql) throws SQLException {
        List<String> values = new ArrayList<>();
        try (Connection connection = sqlque.getDialectAdapter().getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            while (resultSet.next()) {
                values.add(resultSet.getString(1));
            }
        }
        return values;
    }
}
