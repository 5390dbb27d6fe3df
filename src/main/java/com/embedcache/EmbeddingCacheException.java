package com.embedcache;

/**
 * Base type for failures surfaced by an {@code embed} call. Callers own retry policy.
 */
public abstract class EmbeddingCacheException extends RuntimeException {
    protected EmbeddingCacheException(String message) {
        super(message);
    }

    protected EmbeddingCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
