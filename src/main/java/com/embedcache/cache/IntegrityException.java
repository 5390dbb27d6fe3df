package com.embedcache.cache;

import com.embedcache.EmbeddingCacheException;

public class IntegrityException extends EmbeddingCacheException {
    public IntegrityException(String message) {
        super(message);
    }
}
