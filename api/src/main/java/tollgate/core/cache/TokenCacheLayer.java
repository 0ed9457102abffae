package tollgate.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.jboss.logging.Logger;

import tollgate.core.config.GatewayConfig;
import tollgate.core.model.token.StoredToken;
import tollgate.core.model.token.TenantContext;
import tollgate.core.port.out.ValidationMetrics;

/**
 * The three caches in front of the token store.
 *
 * <ul>
 *   <li>validation cache: {@code hash:scopeKey} to a token snapshot</li>
 *   <li>permission cache: {@code hash:sortedScopes} to a scope decision</li>
 *   <li>tenant cache: tenant id to tenant metadata</li>
 * </ul>
 *
 * <p>Token-keyed entries must never outlive a revoke or an extension of the
 * token. Every writer captures {@link #generation(String)} before it reads the
 * store; {@link #invalidateToken(String)} bumps the generation under the same
 * per-hash lock as the put, so a put racing an invalidation is dropped.
 *
 * <p>Generations expire once no token-keyed entry written before the bump can
 * still be live and no store read started before it can still be pending.
 */
@ApplicationScoped
public class TokenCacheLayer {

    private static final Logger LOG = Logger.getLogger(TokenCacheLayer.class);

    static final String VALIDATION = "validation";
    static final String PERMISSION = "permission";
    static final String TENANT = "tenant";

    private static final int LOCK_STRIPES = 64;

    private final Clock clock;
    private final ValidationMetrics metrics;
    private final LocalCache<String, StoredToken> validationCache;
    private final LocalCache<String, Boolean> permissionCache;
    private final LocalCache<String, TenantContext> tenantCache;
    private final Cache<String, Long> generations;
    private final Object[] locks = new Object[LOCK_STRIPES];
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Inject
    public TokenCacheLayer(GatewayConfig config, Clock clock, ValidationMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
        var cache = config.cache();
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.validationCache = new CaffeineLocalCache<>(
                cache.validationTtl(), cache.validationCapacity(), cache.jitterFactor(), ticker);
        this.permissionCache = new CaffeineLocalCache<>(
                cache.permissionTtl(), cache.permissionCapacity(), cache.jitterFactor(), ticker);
        this.tenantCache =
                new CaffeineLocalCache<>(cache.tenantTtl(), cache.tenantCapacity(), cache.jitterFactor(), ticker);
        this.generations = Caffeine.newBuilder()
                .expireAfterWrite(generationRetention(config))
                .ticker(ticker)
                .build();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        LOG.infof(
                "Initialized token caches (validation: %s/%d, permission: %s/%d, tenant: %s/%d)",
                cache.validationTtl(),
                cache.validationCapacity(),
                cache.permissionTtl(),
                cache.permissionCapacity(),
                cache.tenantTtl(),
                cache.tenantCapacity());
    }

    /**
     * Current invalidation generation of a token hash. Capture before reading the store.
     */
    public long generation(String tokenHash) {
        var generation = generations.getIfPresent(tokenHash);
        return generation == null ? 0L : generation;
    }

    /**
     * Look up a token snapshot for a hash and scope key.
     *
     * <p>A snapshot that has already expired counts as a miss, so the store
     * gets the chance to return an extended version.
     *
     * @param tokenHash the token hash
     * @param scopeKey  the normalized required scopes
     * @return the cached snapshot, if present and not expired
     */
    public Optional<StoredToken> getValidation(String tokenHash, String scopeKey) {
        var cached = validationCache.get(key(tokenHash, scopeKey))
                .filter(token -> !token.isExpired(clock.instant()));
        if (cached.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        metrics.recordCacheAccess(VALIDATION, cached.isPresent());
        return cached;
    }

    /**
     * Cache a token snapshot unless the token was invalidated since {@code generation}.
     *
     * @return true if the entry was written
     */
    public boolean putValidation(String tokenHash, String scopeKey, long generation, StoredToken token) {
        synchronized (lockFor(tokenHash)) {
            if (generation(tokenHash) != generation) {
                LOG.debugf("Dropped stale validation cache write for %s", shortHash(tokenHash));
                return false;
            }
            validationCache.put(key(tokenHash, scopeKey), token);
            return true;
        }
    }

    public Optional<Boolean> getPermission(String tokenHash, String scopeKey) {
        var cached = permissionCache.get(key(tokenHash, scopeKey));
        metrics.recordCacheAccess(PERMISSION, cached.isPresent());
        return cached;
    }

    public boolean putPermission(String tokenHash, String scopeKey, long generation, boolean granted) {
        synchronized (lockFor(tokenHash)) {
            if (generation(tokenHash) != generation) {
                return false;
            }
            permissionCache.put(key(tokenHash, scopeKey), granted);
            return true;
        }
    }

    public Optional<TenantContext> getTenant(String tenantId) {
        var cached = tenantCache.get(tenantId);
        metrics.recordCacheAccess(TENANT, cached.isPresent());
        return cached;
    }

    public void putTenant(TenantContext tenant) {
        tenantCache.put(tenant.tenantId(), tenant);
    }

    /**
     * Remove every validation and permission entry of a token.
     *
     * <p>Called on revoke and on every expiry change.
     *
     * @param tokenHash the token hash
     */
    public void invalidateToken(String tokenHash) {
        var prefix = tokenHash + ":";
        synchronized (lockFor(tokenHash)) {
            generations.asMap().merge(tokenHash, 1L, Long::sum);
            validationCache.invalidateIf(k -> k.startsWith(prefix));
            permissionCache.invalidateIf(k -> k.startsWith(prefix));
        }
        LOG.debugf("Invalidated cache entries for %s", shortHash(tokenHash));
    }

    public void invalidateAll() {
        validationCache.invalidateAll();
        permissionCache.invalidateAll();
        tenantCache.invalidateAll();
    }

    /**
     * Fraction of validation-cache probes that hit, or 0 before the first probe.
     */
    public double hitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public long hitCount() {
        return hits.get();
    }

    private static Duration generationRetention(GatewayConfig config) {
        var cache = config.cache();
        var longestTtl = cache.validationTtl().compareTo(cache.permissionTtl()) >= 0
                ? cache.validationTtl()
                : cache.permissionTtl();
        // jittered entries may live up to (1 + factor) times their TTL
        var retention = Duration.ofMillis((long) (longestTtl.toMillis() * (1.0 + cache.jitterFactor())));
        var timeout = Duration.ofMillis(config.timeoutMs());
        return retention.compareTo(timeout) >= 0 ? retention : timeout;
    }

    private Object lockFor(String tokenHash) {
        return locks[Math.floorMod(tokenHash.hashCode(), LOCK_STRIPES)];
    }

    private static String key(String tokenHash, String scopeKey) {
        return tokenHash + ":" + scopeKey;
    }

    /**
     * Truncated hash for log output.
     */
    private static String shortHash(String tokenHash) {
        return tokenHash == null || tokenHash.length() <= 8 ? tokenHash : tokenHash.substring(0, 8);
    }
}
