package com.embedcache.store;

import java.util.Locale;

public enum SqlDialect {
    POSTGRESQL("BYTEA") {
        @Override
        String insertIfAbsent(String table) {
            return "INSERT INTO " + quote(table) + " (k, v) VALUES (?, ?) ON CONFLICT (k) DO NOTHING";
        }
    },
    SQLITE("BLOB") {
        @Override
        String insertIfAbsent(String table) {
            return "INSERT OR IGNORE INTO " + quote(table) + " (k, v) VALUES (?, ?)";
        }
    };

    private final String binaryType;

    SqlDialect(String binaryType) {
        this.binaryType = binaryType;
    }

    abstract String insertIfAbsent(String table);

    String createTable(String table) {
        return "CREATE TABLE IF NOT EXISTS " + quote(table)
                + " (k VARCHAR(64) PRIMARY KEY, v " + binaryType + " NOT NULL)";
    }

    String selectIn(String table, int keyCount) {
        StringBuilder sql = new StringBuilder("SELECT k, v FROM ")
                .append(quote(table))
                .append(" WHERE k IN (");
        for (int i = 0; i < keyCount; i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        return sql.append(')').toString();
    }

    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        String normalized = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:sqlite:")) {
            return SQLITE;
        }
        throw new IllegalArgumentException("Unsupported JDBC url: " + jdbcUrl);
    }

    // Namespace names are validated identifiers, quoting only guards reserved words.
    private static String quote(String table) {
        return '"' + table + '"';
    }
}
