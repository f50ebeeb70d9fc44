package org.loesak.sqlque.examples.fleet.schedule;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

@Slf4j
public class LowStockCheck implements ScheduledCheck {

    @Override
    public String getName() {
        return "low stock parts";
    }

    @Override
    public String run(final Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM parts WHERE stock_quantity <= minimum_stock")) {
            resultSet.next();
            final long low = resultSet.getLong(1);
            if (low > 0) {
                log.warn("Found [{}] part(s) at or below minimum stock", low);
            }
            return low + " low";
        }
    }
}
