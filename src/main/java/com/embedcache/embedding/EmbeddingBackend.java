package com.embedcache.embedding;

import java.util.Locale;

public enum EmbeddingBackend {
    HASHING,
    LOCAL,
    HTTP;

    public static EmbeddingBackend parse(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EmbeddingBackend backend : values()) {
            if (backend.name().equals(normalized)) {
                return backend;
            }
        }
        throw new IllegalArgumentException("Unknown embedding backend: " + value);
    }
}
