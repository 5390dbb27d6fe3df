package com.embedcache.store;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentMap<String, ConcurrentMap<String, byte[]>> partitions = new ConcurrentHashMap<>();

    @Override
    public void ensureNamespace(Namespace namespace) {
        partitions.computeIfAbsent(namespace.name(), unused -> new ConcurrentHashMap<>());
    }

    @Override
    public Map<String, byte[]> batchGet(Namespace namespace, List<String> keys) {
        if (keys.isEmpty()) {
            return Map.of();
        }
        Map<String, byte[]> partition = partition(namespace);
        Map<String, byte[]> found = new HashMap<>();
        for (String key : keys) {
            byte[] value = partition.get(key);
            if (value != null) {
                found.put(key, value.clone());
            }
        }
        return found;
    }

    @Override
    public void batchPutIfAbsent(Namespace namespace, Map<String, byte[]> entries) {
        if (entries.isEmpty()) {
            return;
        }
        ConcurrentMap<String, byte[]> partition = partition(namespace);
        entries.forEach((key, value) -> partition.putIfAbsent(key, value.clone()));
    }

    public int size(Namespace namespace) {
        Map<String, byte[]> partition = partitions.get(namespace.name());
        return partition == null ? 0 : partition.size();
    }

    @Override
    public void close() {
        partitions.clear();
    }

    private ConcurrentMap<String, byte[]> partition(Namespace namespace) {
        ConcurrentMap<String, byte[]> partition = partitions.get(namespace.name());
        if (partition == null) {
            throw new StoreUnavailableException("Namespace not provisioned: " + namespace);
        }
        return partition;
    }
}
