package org.loesak.sqlque.examples.fleet.schedule;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A periodic business check run against a database whose schema has been verified.
 */
public interface ScheduledCheck {

    String getName();

    /**
     * @return a short summary for the log
     */
    String run(Connection connection) throws SQLException;
}
