package org.loesak.sqlque.springboot.starter.autoconfigure;

import org.loesak.sqlque.core.Sqlque;
import org.loesak.sqlque.core.exception.MigrationExecutionException;
import org.loesak.sqlque.core.result.MigrationResult;
import org.springframework.beans.factory.InitializingBean;

public class SqlqueInitializer implements InitializingBean {

    private final Sqlque sqlque;
    private final boolean migrateOnStartup;

    public SqlqueInitializer(Sqlque sqlque, boolean migrateOnStartup) {
        this.sqlque = sqlque;
        this.migrateOnStartup = migrateOnStartup;
    }

    @Override
    public void afterPropertiesSet() throws Exception {
        if (!this.migrateOnStartup) {
            this.sqlque.ensureUpToDate();
            return;
        }

        MigrationResult result = this.sqlque.migrate();
        if (!result.isSuccessful()) {
            throw new MigrationExecutionException(
                    result.getFailedVersion(),
                    String.format("database migration %s at version [%s]: %s",
                            result.getOutcome().name().toLowerCase(),
                            result.getFailedVersion(),
                            result.getFailureMessage()),
                    null);
        }
    }
}
