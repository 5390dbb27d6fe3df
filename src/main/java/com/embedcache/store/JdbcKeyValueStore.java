package com.embedcache.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * JDBC-backed store keeping one table per namespace, {@code (k VARCHAR(64) PRIMARY KEY, v BLOB)}.
 *
 * <p>Lookups are split into {@code IN (...)} queries of at most {@code pageSize} keys and inserts
 * are sent as JDBC batches of the same size inside one transaction.
 */
public class JdbcKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcKeyValueStore.class);
    public static final int DEFAULT_PAGE_SIZE = 1000;

    private final HikariDataSource dataSource;
    private final SqlDialect dialect;
    private final int pageSize;
    private final Set<String> provisioned = ConcurrentHashMap.newKeySet();

    public JdbcKeyValueStore(HikariConfig hikariConfig) {
        this(hikariConfig, DEFAULT_PAGE_SIZE);
    }

    public JdbcKeyValueStore(HikariConfig hikariConfig, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.dialect = SqlDialect.fromJdbcUrl(hikariConfig.getJdbcUrl());
        if (dialect == SqlDialect.SQLITE) {
            hikariConfig.setMaximumPoolSize(1);
        }
        this.pageSize = pageSize;
        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Failed to open store at " + hikariConfig.getJdbcUrl(), e);
        }
        log.info("Opened {} key-value store pageSize={}", dialect, pageSize);
    }

    @Override
    public void ensureNamespace(Namespace namespace) {
        if (provisioned.contains(namespace.name())) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            stmt.execute(dialect.createTable(namespace.name()));
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to provision namespace " + namespace, e);
        }
        if (provisioned.add(namespace.name())) {
            log.info("Provisioned namespace {}", namespace);
        }
    }

    @Override
    public Map<String, byte[]> batchGet(Namespace namespace, List<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        Map<String, byte[]> found = new HashMap<>();
        try (Connection conn = dataSource.getConnection()) {
            for (int from = 0; from < distinct.size(); from += pageSize) {
                List<String> page = distinct.subList(from, Math.min(from + pageSize, distinct.size()));
                try (PreparedStatement stmt = conn.prepareStatement(dialect.selectIn(namespace.name(), page.size()))) {
                    for (int i = 0; i < page.size(); i++) {
                        stmt.setString(i + 1, page.get(i));
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            found.put(rs.getString(1), rs.getBytes(2));
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Batch lookup failed in namespace " + namespace, e);
        }
        return found;
    }

    @Override
    public void batchPutIfAbsent(Namespace namespace, Map<String, byte[]> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement stmt = conn.prepareStatement(dialect.insertIfAbsent(namespace.name()))) {
                int pending = 0;
                for (Map.Entry<String, byte[]> entry : insertOrder(entries).entrySet()) {
                    stmt.setString(1, entry.getKey());
                    stmt.setBytes(2, entry.getValue());
                    stmt.addBatch();
                    if (++pending == pageSize) {
                        stmt.executeBatch();
                        pending = 0;
                    }
                }
                if (pending > 0) {
                    stmt.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Batch insert failed in namespace " + namespace, e);
        }
    }

    /**
     * Rows go out sorted by key so concurrent writers take unique-index locks in the same order and
     * cannot deadlock on PostgreSQL.
     */
    static SortedMap<String, byte[]> insertOrder(Map<String, byte[]> entries) {
        return new TreeMap<>(entries);
    }

    @Override
    public void close() {
        dataSource.close();
    }

    private static void rollback(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }
}
