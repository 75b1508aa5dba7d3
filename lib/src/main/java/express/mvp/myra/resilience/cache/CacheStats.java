package express.mvp.myra.resilience.cache;

import java.time.Duration;

/**
 * Immutable snapshot of cache state and access counters.
 *
 * <p>The first three components describe the store itself. The counters accumulate from creation
 * or the last {@link CacheStore#resetMetrics()}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CacheStats stats = cache.stats();
 * System.out.printf("%d/%d entries, hit rate %.1f%%%n",
 *     stats.size(), stats.capacity(), stats.hitRate() * 100);
 * }</pre>
 *
 * <p>{@code size} counts expired entries that have not been touched since they expired.
 *
 * @param size number of stored entries, including not-yet-removed expired ones
 * @param capacity maximum number of entries
 * @param defaultTtl time-to-live applied when none is given
 * @param hits reads that returned a live value
 * @param misses reads that found nothing or an expired entry
 * @param evictions entries removed to make room
 * @param expirations expired entries removed on read
 * @see CacheStore
 */
public record CacheStats(
        int size,
        int capacity,
        Duration defaultTtl,
        long hits,
        long misses,
        long evictions,
        long expirations) {

    /**
     * Returns the hit rate as a ratio between 0.0 and 1.0.
     *
     * @return hit rate (0.0 if nothing was read)
     */
    public double hitRate() {
        long reads = hits + misses;
        return reads == 0 ? 0.0 : (double) hits / reads;
    }

    /**
     * Returns the fill ratio between 0.0 and 1.0.
     *
     * @return size divided by capacity (0.0 for a zero-capacity store)
     */
    public double utilization() {
        return capacity == 0 ? 0.0 : (double) size / capacity;
    }

    @Override
    public String toString() {
        return String.format(
                "CacheStats[size=%d/%d, defaultTtl=%dms, hits=%d, misses=%d, evictions=%d, expirations=%d, hitRate=%.1f%%]",
                size,
                capacity,
                defaultTtl.toMillis(),
                hits,
                misses,
                evictions,
                expirations,
                hitRate() * 100);
    }
}
