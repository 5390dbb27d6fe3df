package com.embedcache.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Map;

import org.junit.jupiter.api.Test;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLocalSqliteCacheAndLocalModel() {
        AppConfig config = new AppConfig();

        assertEquals("jdbc:sqlite:.embedcache/cache.db", config.getStore().getUrl());
        assertEquals(1000, config.getStore().getPageSize());
        assertEquals("local", config.getEmbedding().getBackend());
        assertEquals(384, config.getEmbedding().getDimension());
        assertFalse(config.getEmbedding().isNormalize());
        assertNull(config.getEmbedding().getTruncateDim());
    }

    @Test
    void shouldReplaceNullSectionsWithDefaults() {
        AppConfig config = new AppConfig();
        config.setStore(null);
        config.setEmbedding(null);

        assertEquals(4, config.getStore().getMaximumPoolSize());
        assertEquals(30000, config.getEmbedding().getTimeoutMs());
    }

    @Test
    void shouldApplyEnvironmentOverrides() {
        AppConfig config = new AppConfig().applyEnvironment(Map.of(
                AppConfig.ENV_STORE_URL, "jdbc:postgresql://db:5432/postgres",
                AppConfig.ENV_STORE_USER, "cache",
                AppConfig.ENV_STORE_PASSWORD, "pw",
                AppConfig.ENV_EMBEDDING_URL, "https://embed.example/v1",
                AppConfig.ENV_EMBEDDING_API_KEY, "key"));

        assertEquals("jdbc:postgresql://db:5432/postgres", config.getStore().getUrl());
        assertEquals("cache", config.getStore().getUsername());
        assertEquals("pw", config.getStore().getPassword());
        assertEquals("https://embed.example/v1", config.getEmbedding().getEndpoint());
        assertEquals("key", config.getEmbedding().getApiKey());
    }

    @Test
    void shouldIgnoreBlankEnvironmentValues() {
        AppConfig config = new AppConfig().applyEnvironment(Map.of(AppConfig.ENV_STORE_URL, " "));

        assertEquals("jdbc:sqlite:.embedcache/cache.db", config.getStore().getUrl());
    }
}
