package com.calor.verification.cache;

/**
 * Point-in-time snapshot of cache counters.
 */
public record CacheStatistics(long hits, long misses, long writes, long errors, long evictions) {

    public long totalLookups() {
        return hits + misses;
    }

    /** Hit rate as a percentage of lookups, 0 when nothing was looked up. */
    public double hitRate() {
        long total = totalLookups();
        return total > 0 ? (double) hits / total * 100 : 0;
    }
}
