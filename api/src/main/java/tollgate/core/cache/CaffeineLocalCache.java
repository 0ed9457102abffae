package tollgate.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache implementation with TTL support and jitter.
 *
 * <p>Entries are evicted after the configured TTL or, once the cache is full,
 * by Caffeine's size-based policy.
 *
 * <p><b>TTL Jitter:</b> each entry's TTL may be varied by a jitter factor so
 * that entries written together do not all expire together.
 *
 * <p>The ticker decides what "now" means for expiry. Production code passes a
 * ticker derived from the injected clock, which lets tests move time forward.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;
    private final long baseTtlNanos;
    private final double jitterFactor;

    /**
     * Create a new Caffeine-backed cache without jitter on the system ticker.
     *
     * @param ttl     the time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, 0.0, Ticker.systemTicker());
    }

    /**
     * Create a new Caffeine-backed cache.
     *
     * @param ttl          the base time-to-live for cache entries
     * @param maxSize      the maximum number of entries in the cache
     * @param jitterFactor the jitter factor (0.0 to 0.5). A value of 0.1 means ±10% jitter.
     *                     Set to 0 to disable jitter.
     * @param ticker       time source used for expiry
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor, Ticker ticker) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got: " + ttl);
        }
        this.baseTtlNanos = ttl.toNanos();
        this.jitterFactor = jitterFactor;

        if (jitterFactor == 0.0) {
            this.cache = Caffeine.newBuilder()
                    .expireAfterWrite(ttl)
                    .maximumSize(maxSize)
                    .ticker(ticker)
                    .build();
        } else {
            this.cache = Caffeine.newBuilder()
                    .expireAfter(new JitteredExpiry())
                    .maximumSize(maxSize)
                    .ticker(ticker)
                    .build();
        }
    }

    private class JitteredExpiry implements Expiry<K, V> {
        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return applyJitter(baseTtlNanos);
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long applyJitter(long baseTtl) {
            // multiply by a random value in [1-jitterFactor, 1+jitterFactor]
            final var jitter = ThreadLocalRandom.current().nextDouble() * 2 * jitterFactor;
            final var jitterMultiplier = 1.0 - jitterFactor + jitter;
            return (long) (baseTtl * jitterMultiplier);
        }
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateIf(Predicate<K> keyFilter) {
        cache.asMap().keySet().removeIf(keyFilter);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
