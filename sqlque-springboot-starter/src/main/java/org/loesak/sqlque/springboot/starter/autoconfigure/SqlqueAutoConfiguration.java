package org.loesak.sqlque.springboot.starter.autoconfigure;

import org.loesak.sqlque.core.Sqlque;
import org.loesak.sqlque.core.SqlqueConfiguration;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.migration.MigrationUnit;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Configuration
@ConditionalOnProperty(prefix = "sqlque", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SqlqueConfigurationProperties.class)
public class SqlqueAutoConfiguration {

    static final String DATASOURCE_URL_PROPERTY = "spring.datasource.url";

    private final SqlqueConfigurationProperties sqlqueProperties;
    private final Environment environment;

    public SqlqueAutoConfiguration(
            final SqlqueConfigurationProperties sqlqueProperties,
            final Environment environment) {
        this.sqlqueProperties = sqlqueProperties;
        this.environment = environment;
    }

    /**
     * Registry of every {@link MigrationUnit} bean in the context. Applications with a fixed list
     * declare their own registry bean instead.
     */
    @Bean
    @ConditionalOnMissingBean
    public MigrationRegistry sqlqueMigrationRegistry(final ObjectProvider<MigrationUnit> migrationUnits) {
        List<MigrationUnit> units = migrationUnits.orderedStream().collect(Collectors.toList());
        return new MigrationRegistry(units);
    }

    @Bean
    @ConditionalOnMissingBean
    public Sqlque sqlque(final MigrationRegistry registry) {
        SqlqueConfiguration configuration = new SqlqueConfiguration(
                this.getDatabaseUrl(),
                this.sqlqueProperties.getTableName(),
                this.sqlqueProperties.getInstalledBy(),
                this.sqlqueProperties.getMaxAttempts());
        return new Sqlque(configuration, registry);
    }

    @Bean
    public SqlqueInitializer sqlqueInitializer(final Sqlque sqlque) {
        return new SqlqueInitializer(sqlque, this.sqlqueProperties.isMigrateOnStartup());
    }

    private String getDatabaseUrl() {
        String url = this.getProperty(
                this.sqlqueProperties::getDatabaseUrl,
                () -> this.getProperty(
                        () -> this.environment.getProperty(SqlqueConfiguration.DATABASE_URL_VARIABLE),
                        () -> this.environment.getProperty(DATASOURCE_URL_PROPERTY)));

        if (!StringUtils.hasText(url)) {
            throw new MigrationConfigurationException("could not determine the database to migrate. set sqlque.database-url, DATABASE_URL or spring.datasource.url");
        }
        return url;
    }

    private <T> T getProperty(Supplier<T> property, Supplier<T> defaultValue) {
        T value = property.get();
        return (value != null) ? value : defaultValue.get();
    }

}
