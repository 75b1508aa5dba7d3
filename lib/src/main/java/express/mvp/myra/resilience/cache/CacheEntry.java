package express.mvp.myra.resilience.cache;

import java.time.Instant;

/**
 * A stored value and the instant it stops being visible.
 *
 * @param key the cache key
 * @param value the cached value (never null)
 * @param expiresAt first instant at which the entry is expired
 * @param <V> the value type
 */
record CacheEntry<V>(String key, V value, Instant expiresAt) {

    /**
     * Checks if the entry is still live at the given instant.
     *
     * @param now the read time
     * @return true if {@code now} is strictly before {@link #expiresAt()}
     */
    boolean isLiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
