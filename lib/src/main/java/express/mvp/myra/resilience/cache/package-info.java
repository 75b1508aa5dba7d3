/**
 * Bounded, time-aware in-memory cache for memoizing idempotent client operations.
 *
 * <p>{@link express.mvp.myra.resilience.cache.CacheStore} evicts by insertion order and expires
 * entries lazily on read. {@link express.mvp.myra.resilience.cache.Fingerprint} derives cache keys
 * from an operation and its inputs.
 */
package express.mvp.myra.resilience.cache;
