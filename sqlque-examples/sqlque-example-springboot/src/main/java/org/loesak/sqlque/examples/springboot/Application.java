package org.loesak.sqlque.examples.springboot;

import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.examples.fleet.FleetMigrations;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class Application {

    public static void main(String... args) {
        SpringApplication.run(Application.class, args);
    }

    @Bean
    public MigrationRegistry fleetMigrationRegistry() {
        return FleetMigrations.registry();
    }
}
