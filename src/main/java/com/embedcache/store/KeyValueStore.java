package com.embedcache.store;

import java.util.List;
import java.util.Map;

/**
 * Durable, namespace-partitioned mapping from string keys to byte values.
 *
 * <p>Entries are write-once: {@link #batchPutIfAbsent} never overwrites, which keeps concurrent
 * writers racing on the same key safe without locking. Every failure is reported as a
 * {@link StoreUnavailableException}; a batch call either applies completely or not at all.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Provisions storage for the namespace if it does not exist yet. Idempotent.
     */
    void ensureNamespace(Namespace namespace);

    /**
     * Returns the subset of {@code keys} present in the namespace. Absent keys are omitted and
     * duplicates are allowed. An empty key list returns an empty map without touching storage.
     */
    Map<String, byte[]> batchGet(Namespace namespace, List<String> keys);

    /**
     * Inserts every entry whose key is not already stored. Existing keys are skipped silently.
     * An empty map is a no-op.
     */
    void batchPutIfAbsent(Namespace namespace, Map<String, byte[]> entries);

    @Override
    void close();
}
