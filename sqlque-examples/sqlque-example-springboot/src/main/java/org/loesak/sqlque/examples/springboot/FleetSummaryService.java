package org.loesak.sqlque.examples.springboot;

import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.Sqlque;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Business queries run only through {@link Sqlque#getVerifiedConnection()}, so they never see a
 * schema older than the registered migrations.
 */
@Slf4j
@Service
public class FleetSummaryService {

    private final Sqlque sqlque;

    public FleetSummaryService(final Sqlque sqlque) {
        this.sqlque = sqlque;
    }

    public long countVehicles() throws SQLException {
        try (Connection connection = this.sqlque.getVerifiedConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM vehicles")) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logSummary() throws SQLException {
        log.info("Fleet schema at version [{}] with [{}] vehicle(s)",
                this.sqlque.status().getCurrentVersion(),
                this.countVehicles());
    }
}
