package org.dxworks.markframe.engine;

/**
 * Line cache counters as reported by {@link LivePreviewEngine#cacheStats()}.
 */
public record LineCacheStats(long size, long maxSize, long hitCount, long missCount) {

    public double hitRate() {
        long requests = hitCount + missCount;
        return requests == 0 ? 1.0 : (double) hitCount / requests;
    }
}
