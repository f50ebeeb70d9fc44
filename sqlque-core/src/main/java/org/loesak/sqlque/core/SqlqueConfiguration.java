package org.loesak.sqlque.core;

import lombok.NonNull;
import lombok.Value;
import lombok.With;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.jdbc.ledger.LedgerOperations;

import java.util.Map;

@Value
@With
public class SqlqueConfiguration {

    public static final String DATABASE_URL_VARIABLE = "DATABASE_URL";
    public static final String TABLE_NAME_VARIABLE = "SQLQUE_TABLE";
    public static final String INSTALLED_BY_VARIABLE = "SQLQUE_INSTALLED_BY";
    public static final String MAX_ATTEMPTS_VARIABLE = "SQLQUE_MAX_ATTEMPTS";

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /**
     * Connection string whose scheme selects the dialect.
     */
    String databaseUrl;

    /**
     * Name of the ledger table.
     */
    @NonNull String tableName;

    /**
     * Recorded with each ledger entry, if any.
     */
    String installedBy;

    /**
     * Automatic attempts allowed for a failing version before the runner refuses to retry it. 0 means unlimited.
     */
    int maxAttempts;

    public SqlqueConfiguration(final String databaseUrl, @NonNull final String tableName, final String installedBy, final int maxAttempts) {
        if (maxAttempts < 0) {
            throw new MigrationConfigurationException(String.format("max attempts must not be negative but was [%d]", maxAttempts));
        }
        this.databaseUrl = databaseUrl;
        this.tableName = tableName;
        this.installedBy = installedBy;
        this.maxAttempts = maxAttempts;
    }

    public static SqlqueConfiguration of(final String databaseUrl) {
        return new SqlqueConfiguration(databaseUrl, LedgerOperations.DEFAULT_TABLE_NAME, null, DEFAULT_MAX_ATTEMPTS);
    }

    public static SqlqueConfiguration fromEnvironment(@NonNull final Map<String, String> environment) {
        final String maxAttempts = environment.get(MAX_ATTEMPTS_VARIABLE);
        final String tableName = environment.get(TABLE_NAME_VARIABLE);

        try {
            return new SqlqueConfiguration(
                    environment.get(DATABASE_URL_VARIABLE),
                    isBlank(tableName) ? LedgerOperations.DEFAULT_TABLE_NAME : tableName.trim(),
                    environment.get(INSTALLED_BY_VARIABLE),
                    isBlank(maxAttempts) ? DEFAULT_MAX_ATTEMPTS : Integer.parseInt(maxAttempts.trim()));
        } catch (NumberFormatException e) {
            throw new MigrationConfigurationException(String.format("[%s] must be a number but was [%s]", MAX_ATTEMPTS_VARIABLE, maxAttempts), e);
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
