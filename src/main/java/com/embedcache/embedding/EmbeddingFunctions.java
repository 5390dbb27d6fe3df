package com.embedcache.embedding;

import java.time.Duration;

import com.embedcache.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingFunctions {
    private EmbeddingFunctions() {
    }

    /** Only the {@code http} backend gets an OkHttp client; local backends open no connections. */
    public static EmbeddingFunction create(AppConfig.EmbeddingConfig config) {
        EmbeddingBackend backend = EmbeddingBackend.parse(config.getBackend());
        return switch (backend) {
            case HASHING -> new HashingEmbeddingFunction(config.getDimension());
            case LOCAL -> new LocalModelEmbeddingFunction(config.getDimension());
            case HTTP -> new HttpEmbeddingFunction(
                    httpClient(config), config.getEndpoint(), config.getApiKey(), config.getDimension());
        };
    }

    static OkHttpClient httpClient(AppConfig.EmbeddingConfig config) {
        return new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
    }
}
