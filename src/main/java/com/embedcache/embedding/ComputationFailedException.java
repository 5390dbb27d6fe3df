package com.embedcache.embedding;

import com.embedcache.EmbeddingCacheException;

public class ComputationFailedException extends EmbeddingCacheException {
    public ComputationFailedException(String message) {
        super(message);
    }

    public ComputationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
