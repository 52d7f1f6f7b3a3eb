package org.carball.nplusone.model;

import java.util.Locale;

/**
 * Database engine a query was issued against. Selects the fingerprint strategy.
 */
public enum Dialect {
    POSTGRESQL,
    MYSQL,
    MARIADB,
    SQLITE,
    H2,
    OTHER;

    /**
     * Maps a JDBC {@code DatabaseMetaData#getDatabaseProductName()} value to a dialect.
     * Unknown or missing product names map to {@link #OTHER}.
     */
    public static Dialect fromProductName(String productName) {
        if (productName == null || productName.isBlank()) {
            return OTHER;
        }

        String name = productName.trim().toLowerCase(Locale.ROOT);
        if (name.contains("postgres")) {
            return POSTGRESQL;
        } else if (name.contains("mariadb")) {
            return MARIADB;
        } else if (name.contains("mysql")) {
            return MYSQL;
        } else if (name.contains("sqlite")) {
            return SQLITE;
        } else if (name.equals("h2")) {
            return H2;
        }
        return OTHER;
    }

    /**
     * Parses a configuration value such as {@code "postgresql"} or {@code "MySQL"}.
     */
    public static Dialect fromName(String name) {
        for (Dialect dialect : values()) {
            if (dialect.name().equalsIgnoreCase(name.trim())) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown dialect: " + name);
    }
}
