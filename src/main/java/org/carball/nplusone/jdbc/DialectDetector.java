package org.carball.nplusone.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Resolves the {@link Dialect} of a data source from its JDBC metadata.
 */
@Slf4j
public final class DialectDetector {

    private DialectDetector() {
        // Utility class - prevent instantiation
    }

    public static Dialect detect(DataSource dataSource) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            String productName = connection.getMetaData().getDatabaseProductName();
            Dialect dialect = Dialect.fromProductName(productName);
            log.debug("Detected dialect {} for database product '{}'", dialect, productName);
            return dialect;
        }
    }
}
