package com.embedcache.store;

import com.embedcache.EmbeddingCacheException;

public class StoreUnavailableException extends EmbeddingCacheException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
