package org.loesak.sqlque.core;

import org.junit.jupiter.api.Test;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.exception.SchemaOutOfDateException;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationVersion;
import org.loesak.sqlque.core.result.MigrationResult;

import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlqueTest extends AbstractSqliteTest {

    @Test
    void migrate_appliesRegisteredUnitsAgainstTheConfiguredDatabase() throws SQLException {
        Sqlque sqlque = new Sqlque(SqlqueConfiguration.of(databaseUrl), MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.creatingTable("002", "vehicles")));

        MigrationResult result = sqlque.migrate();

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.getAppliedCount()).isEqualTo(2);
        assertThat(sqlque.getState()).isEqualTo(MigrationExecutor.State.COMPLETED);
        assertThat(tableExists("vehicles")).isTrue();
    }

    @Test
    void ensureUpToDate_listsPendingVersions() {
        Sqlque sqlque = new Sqlque(SqlqueConfiguration.of(databaseUrl), MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies"),
                ScriptedMigrationUnit.creatingTable("002", "vehicles")));

        assertThatThrownBy(sqlque::ensureUpToDate)
                .isInstanceOfSatisfying(SchemaOutOfDateException.class, e -> assertThat(e.getPendingVersions())
                        .containsExactly(MigrationVersion.of("001"), MigrationVersion.of("002")))
                .hasMessageContaining("[2] pending migration(s)");
    }

    @Test
    void getVerifiedConnection_succeedsOnceMigrated() throws SQLException {
        Sqlque sqlque = new Sqlque(SqlqueConfiguration.of(databaseUrl), MigrationRegistry.of(
                ScriptedMigrationUnit.creatingTable("001", "companies")));
        sqlque.migrate();

        try (Connection connection = sqlque.getVerifiedConnection()) {
            assertThat(connection.isValid(1)).isTrue();
        }
    }

    @Test
    void repair_rejectsMalformedVersions() {
        Sqlque sqlque = new Sqlque(SqlqueConfiguration.of(databaseUrl), MigrationRegistry.of());

        assertThatThrownBy(() -> sqlque.repair("v1"))
                .isInstanceOf(MigrationConfigurationException.class);
    }

    @Test
    void constructor_failsFastWithoutDatabaseUrl() {
        assertThatThrownBy(() -> new Sqlque(SqlqueConfiguration.of(null), MigrationRegistry.of()))
                .isInstanceOf(MigrationConfigurationException.class)
                .hasMessageContaining("DATABASE_URL");
    }
}
