package com.embedcache.cache;

/**
 * Cumulative counters for one engine instance.
 *
 * @param calls       non-empty {@code embed} calls
 * @param sentences   sentences requested, duplicates included
 * @param hits        distinct sentences served from the store
 * @param misses      distinct sentences sent to the embedding function
 * @param computeRuns embedding function invocations
 */
public record CacheStatistics(long calls, long sentences, long hits, long misses, long computeRuns) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
