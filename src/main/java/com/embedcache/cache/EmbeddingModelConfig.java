package com.embedcache.cache;

import com.embedcache.embedding.EmbeddingBackend;
import com.embedcache.runtime.AppConfig;

/**
 * Model identity used to select a cache namespace. {@code truncateDim} is null when vectors keep
 * their native width.
 */
public record EmbeddingModelConfig(EmbeddingBackend backend, String modelId, Integer truncateDim) {
    public EmbeddingModelConfig {
        if (backend == null) {
            throw new IllegalArgumentException("backend is required");
        }
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId is required");
        }
        if (truncateDim != null && truncateDim <= 0) {
            throw new IllegalArgumentException("truncateDim must be positive: " + truncateDim);
        }
    }

    public static EmbeddingModelConfig from(AppConfig.EmbeddingConfig config) {
        return new EmbeddingModelConfig(
                EmbeddingBackend.parse(config.getBackend()),
                config.getModel(),
                config.getTruncateDim());
    }
}
