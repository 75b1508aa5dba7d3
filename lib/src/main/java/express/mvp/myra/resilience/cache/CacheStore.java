package express.mvp.myra.resilience.cache;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bounded in-memory key/value store with per-entry expiry.
 *
 * <p>Entries are kept in insertion order. When a new key would push the store past its capacity,
 * the oldest-inserted entry is evicted first. Reads do not change that order, so eviction is FIFO
 * rather than LRU. Overwriting a key moves it to the newest position.
 *
 * <h2>Expiry</h2>
 *
 * <p>Each entry carries an expiry instant computed from its TTL at insertion. There is no
 * background sweep: an expired entry is only removed when {@link #get(String)} or
 * {@link #has(String)} touches it. Until then it still counts toward {@link #size()}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CacheStore<Object> cache = new CacheStore<>(1000, Duration.ofMinutes(5));
 *
 * String key = Fingerprint.of("getThreadInfo", Map.of("threadId", threadId));
 * Object info = cache.getOrCompute(key, () -> api.fetchThreadInfo(threadId));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. A single lock guards the entry map; no method blocks on
 * anything else while holding it. {@link #getOrCompute(String, Supplier)} runs the supplier
 * outside the lock.
 *
 * @param <V> the value type
 * @see CacheStats
 * @see Fingerprint
 */
public class CacheStore<V> {

    /** Capacity used when none is configured. */
    public static final int DEFAULT_CAPACITY = 1000;

    /** Time-to-live used when none is configured. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final int capacity;
    private final Duration defaultTtl;
    private final Clock clock;

    /** Insertion-ordered entries. Guarded by {@link #lock}. */
    private final LinkedHashMap<String, CacheEntry<V>> entries = new LinkedHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    /** Creates a store with {@link #DEFAULT_CAPACITY} and {@link #DEFAULT_TTL}. */
    public CacheStore() {
        this(DEFAULT_CAPACITY, DEFAULT_TTL);
    }

    /**
     * Creates a store using the system clock.
     *
     * @param capacity maximum number of entries (0 retains nothing)
     * @param defaultTtl time-to-live applied when none is given
     * @throws IllegalArgumentException if capacity is negative
     */
    public CacheStore(int capacity, Duration defaultTtl) {
        this(capacity, defaultTtl, Clock.systemUTC());
    }

    /**
     * Creates a store reading time from the given clock.
     *
     * @param capacity maximum number of entries (0 retains nothing)
     * @param defaultTtl time-to-live applied when none is given
     * @param clock source of the current instant
     * @throws IllegalArgumentException if capacity is negative
     */
    public CacheStore(int capacity, Duration defaultTtl, Clock clock) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores a value with the default TTL.
     *
     * @param key the key
     * @param value the value (must not be null)
     */
    public void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * Stores a value with an explicit TTL.
     *
     * <p>A zero or negative TTL stores an entry that is already expired.
     *
     * @param key the key
     * @param value the value (must not be null)
     * @param ttl the time-to-live, or null for the default
     */
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Instant expiresAt = expiryFrom(clock.instant(), ttl == null ? defaultTtl : ttl);

        lock.lock();
        try {
            // Overwrite takes the newest position
            entries.remove(key);

            if (capacity == 0) {
                return;
            }
            if (entries.size() >= capacity) {
                evictOldest();
            }
            entries.put(key, new CacheEntry<>(key, value, expiresAt));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the live value for a key.
     *
     * <p>An expired entry is removed as a side effect.
     *
     * @param key the key
     * @return the value, or {@code null} if absent or expired
     */
    public V get(String key) {
        CacheEntry<V> entry = liveEntry(key);
        if (entry == null) {
            misses.increment();
            return null;
        }
        hits.increment();
        return entry.value();
    }

    /**
     * Checks for a live value without returning it.
     *
     * <p>Same expiry semantics as {@link #get(String)}, including removal of an expired entry.
     * Does not update hit or miss counters.
     *
     * @param key the key
     * @return true if a live value is stored
     */
    public boolean has(String key) {
        return liveEntry(key) != null;
    }

    /**
     * Returns the live value for a key, computing and storing it on a miss.
     *
     * <p>The supplier runs outside the lock, so two concurrent misses on the same key may both
     * compute; the later {@code set} wins.
     *
     * @param key the key
     * @param loader computes the value on a miss (must not return null)
     * @return the cached or freshly computed value
     */
    public V getOrCompute(String key, Supplier<? extends V> loader) {
        return getOrCompute(key, loader, null);
    }

    /**
     * Returns the live value for a key, computing and storing it with the given TTL on a miss.
     *
     * @param key the key
     * @param loader computes the value on a miss (must not return null)
     * @param ttl the time-to-live for a computed value, or null for the default
     * @return the cached or freshly computed value
     */
    public V getOrCompute(String key, Supplier<? extends V> loader, Duration ttl) {
        Objects.requireNonNull(loader, "loader");
        V cached = get(key);
        if (cached != null) {
            return cached;
        }
        V computed = Objects.requireNonNull(loader.get(), "loader returned null");
        set(key, computed, ttl);
        return computed;
    }

    /**
     * Removes an entry. Absent keys are ignored.
     *
     * @param key the key
     * @return true if an entry was removed
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /** Removes all entries. Counters are kept. */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of stored entries.
     *
     * <p>Expired entries that no read has touched yet are included.
     *
     * @return the entry count
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the maximum number of entries.
     *
     * @return the capacity
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Returns the TTL applied when none is given.
     *
     * @return the default TTL
     */
    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Returns a snapshot of the store's state and counters.
     *
     * @return current stats
     */
    public CacheStats stats() {
        return new CacheStats(
                size(),
                capacity,
                defaultTtl,
                hits.sum(),
                misses.sum(),
                evictions.sum(),
                expirations.sum());
    }

    /** Resets hit, miss, eviction and expiration counters to zero. */
    public void resetMetrics() {
        hits.reset();
        misses.reset();
        evictions.reset();
        expirations.reset();
    }

    /** Looks up an entry, dropping it if expired. */
    private CacheEntry<V> liveEntry(String key) {
        if (key == null) {
            return null;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isLiveAt(now)) {
                entries.remove(key);
                expirations.increment();
                return null;
            }
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /** Evicts the oldest-inserted entry. Caller holds the lock. */
    private void evictOldest() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            it.next();
            it.remove();
            evictions.increment();
        }
    }

    private static Instant expiryFrom(Instant now, Duration ttl) {
        try {
            return now.plus(ttl);
        } catch (DateTimeException | ArithmeticException overflow) {
            return ttl.isNegative() ? Instant.MIN : Instant.MAX;
        }
    }

    @Override
    public String toString() {
        return "CacheStore[size=" + size() + ", capacity=" + capacity + ", defaultTtl=" + defaultTtl + "]";
    }
}
