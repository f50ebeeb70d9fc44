package org.loesak.sqlque.examples.fleet;

import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationUnit;
import org.loesak.sqlque.core.yaml.YamlMigrationLoader;
import org.loesak.sqlque.examples.fleet.migrations.V000_BootstrapSchema;
import org.loesak.sqlque.examples.fleet.migrations.V001_AddCompanyOperationType;
import org.loesak.sqlque.examples.fleet.migrations.V002_CreateCustomers;
import org.loesak.sqlque.examples.fleet.migrations.V003_AddCustomerToVehicles;
import org.loesak.sqlque.examples.fleet.migrations.V004_AddRolesAndPlans;
import org.loesak.sqlque.examples.fleet.migrations.V006_AddMaintenanceTotalCost;

import java.util.List;

/**
 * Every migration of the fleet schema. New units are added here; nothing is discovered by scanning.
 */
public final class FleetMigrations {

    static final String NOTIFICATIONS_RESOURCE = "db/migration/V005__CreateNotifications.yml";

    private FleetMigrations() {
    }

    public static List<MigrationUnit> all() {
        return List.of(
                new V000_BootstrapSchema(),
                new V001_AddCompanyOperationType(),
                new V002_CreateCustomers(),
                new V003_AddCustomerToVehicles(),
                new V004_AddRolesAndPlans(),
                new YamlMigrationLoader(FleetMigrations.class.getClassLoader()).load(NOTIFICATIONS_RESOURCE),
                new V006_AddMaintenanceTotalCost());
    }

    public static MigrationRegistry registry() {
        return new MigrationRegistry(all());
    }
}
