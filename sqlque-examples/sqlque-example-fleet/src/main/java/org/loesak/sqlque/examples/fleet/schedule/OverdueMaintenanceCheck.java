package org.loesak.sqlque.examples.fleet.schedule;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Counts scheduled maintenances whose date has passed.
 */
@Slf4j
public class OverdueMaintenanceCheck implements ScheduledCheck {

    // SQLite stores dates as ISO text and CURRENT_DATE is ISO text there too
    private static final String QUERY = "SELECT COUNT(*) FROM maintenances WHERE status = 'SCHEDULED' AND scheduled_on < CURRENT_DATE";

    @Override
    public String getName() {
        return "overdue maintenances";
    }

    @Override
    public String run(final Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(QUERY)) {
            resultSet.next();
            final long overdue = resultSet.getLong(1);
            if (overdue > 0) {
                log.warn("Found [{}] overdue maintenance(s)", overdue);
            }
            return overdue + " overdue";
        }
    }
}
