package tollgate.core.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Local in-memory cache interface with TTL support.
 *
 * <p>Entries disappear after their TTL or when the capacity bound evicts
 * them. A miss is never an error; callers fall back to the source of truth.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Invalidates (removes) a specific cache entry.
     *
     * @param key the cache key to invalidate
     */
    void invalidate(K key);

    /**
     * Invalidates every entry whose key matches the predicate.
     *
     * @param keyFilter selects the keys to remove
     */
    void invalidateIf(Predicate<K> keyFilter);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the estimated number of entries in the cache.
     *
     * @return estimated entry count
     */
    long estimatedSize();
}
