package com.embedcache.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.embedcache.runtime.AppConfig;
import com.zaxxer.hikari.HikariConfig;

public final class KeyValueStores {
    public static final String MEMORY = "memory";

    private KeyValueStores() {
    }

    public static KeyValueStore open(AppConfig.StoreConfig config) {
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("store.url is required");
        }
        if (MEMORY.equals(url.trim().toLowerCase(Locale.ROOT))) {
            return new InMemoryKeyValueStore();
        }
        if (SqlDialect.fromJdbcUrl(url) == SqlDialect.SQLITE) {
            createSqliteParentDirectories(url);
        }
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(url);
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            hikariConfig.setUsername(config.getUsername());
        }
        if (config.getPassword() != null && !config.getPassword().isBlank()) {
            hikariConfig.setPassword(config.getPassword());
        }
        hikariConfig.setMaximumPoolSize(config.getMaximumPoolSize());
        hikariConfig.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikariConfig.setPoolName("embed-cache-store");
        return new JdbcKeyValueStore(hikariConfig, config.getPageSize());
    }

    private static void createSqliteParentDirectories(String url) {
        String location = url.substring("jdbc:sqlite:".length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path parent = Path.of(location).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to create store directory " + parent, e);
        }
    }
}
