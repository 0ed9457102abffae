package tollgate.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the token validation gateway.
 *
 * <p>Configuration prefix: {@code tollgate}
 *
 * <p>Loaded once at startup and injected by reference into every component.
 * The mapping is read-only; components never keep their own mutable copy.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TOLLGATE_FAIL_SAFE_MODE} - serve the legacy decision (default true)</li>
 *   <li>{@code TOLLGATE_PARALLEL_VALIDATION_ENABLED} - run both paths (default true)</li>
 *   <li>{@code TOLLGATE_TIMEOUT_MS} - overall validation timeout</li>
 *   <li>{@code TOLLGATE_STORE_HASH_SALT} - server-side salt for token hashing</li>
 * </ul>
 */
@ConfigMapping(prefix = "tollgate")
public interface GatewayConfig {

    /**
     * Serve the legacy decision regardless of what the enhanced path decides.
     *
     * @return true if fail-safe mode is on (default: true)
     */
    @WithDefault("true")
    boolean failSafeMode();

    /**
     * Overall timeout for a single validation path, in milliseconds.
     *
     * <p>The shadow path is cancelled once this elapses.
     *
     * @return timeout in milliseconds (default: 5000)
     */
    @WithDefault("5000")
    long timeoutMs();

    /**
     * Budget for the served path, in milliseconds.
     *
     * <p>When the served path has not decided within this budget the request
     * fails with a validation timeout.
     *
     * @return budget in milliseconds (default: 200)
     */
    @WithDefault("200")
    long middlewareBudgetMs();

    ParallelValidationConfig parallelValidation();

    CacheConfig cache();

    RateLimitConfig rateLimit();

    ExtensionConfig extension();

    RiskConfig risk();

    AuditConfig audit();

    StoreConfig store();

    /**
     * Shadow-mode settings.
     */
    interface ParallelValidationConfig {

        /**
         * Run the legacy and enhanced paths side by side.
         *
         * @return true if both paths run (default: true)
         */
        @WithDefault("true")
        boolean enabled();
    }

    /**
     * Sizing of the three validation caches.
     */
    interface CacheConfig {

        /**
         * TTL of the validation-result cache, keyed by token hash and scope.
         *
         * @return TTL (default: 300 seconds)
         */
        @WithDefault("PT300S")
        Duration validationTtl();

        @WithDefault("1000")
        long validationCapacity();

        /**
         * TTL of the tenant metadata cache, keyed by tenant id.
         *
         * @return TTL (default: 600 seconds)
         */
        @WithDefault("PT600S")
        Duration tenantTtl();

        @WithDefault("100")
        long tenantCapacity();

        /**
         * TTL of the permission cache, keyed by token hash and scope set.
         *
         * @return TTL (default: 180 seconds)
         */
        @WithDefault("PT180S")
        Duration permissionTtl();

        @WithDefault("500")
        long permissionCapacity();

        /**
         * TTL jitter factor applied to all three caches.
         *
         * @return jitter factor between 0.0 and 0.5 (default: 0)
         */
        @WithDefault("0.0")
        double jitterFactor();
    }

    /**
     * Rolling-window rate limits per security level.
     */
    interface RateLimitConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Length of the rolling window.
         *
         * @return window duration (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration window();

        @WithDefault("1000")
        int standardPerHour();

        @WithDefault("5000")
        int mediumPerHour();

        @WithDefault("10000")
        int highPerHour();
    }

    /**
     * Automatic token extension.
     */
    interface ExtensionConfig {

        @WithDefault("true")
        boolean enabled();

        /**
         * Tokens with less remaining lifetime than this are extended on use.
         *
         * @return threshold (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration threshold();

        /**
         * How far the expiry is pushed forward per extension.
         *
         * @return increment (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration increment();

        /**
         * Extensions allowed over the lifetime of one token.
         *
         * @return maximum extension count (default: 5)
         */
        @WithDefault("5")
        int maxCount();

        /**
         * How long after expiry a token may still be extended.
         *
         * @return grace period (default: none)
         */
        @WithDefault("PT0S")
        Duration gracePeriod();
    }

    /**
     * Risk score thresholds.
     */
    interface RiskConfig {

        /**
         * Scores at or above this emit a high-risk audit event.
         */
        @WithDefault("0.7")
        double elevatedThreshold();

        /**
         * Scores at or above this flag the result as requiring step-up.
         */
        @WithDefault("0.9")
        double stepUpThreshold();
    }

    /**
     * Audit queue sizing and backpressure.
     */
    interface AuditConfig {

        @WithDefault("10000")
        int queueCapacity();

        /**
         * Maximum wait to enqueue an ordinary event before it is dropped.
         */
        @WithDefault("PT0.005S")
        Duration enqueueTimeout();

        /**
         * Maximum wait to enqueue a critical event before it is written inline.
         */
        @WithDefault("PT0.1S")
        Duration criticalEnqueueTimeout();

        @WithDefault("256")
        int batchSize();
    }

    /**
     * Token store settings.
     */
    interface StoreConfig {

        /**
         * Server-side salt mixed into every token hash.
         *
         * @return the salt
         */
        String hashSalt();

        /**
         * Maximum TTL accepted at issue time.
         *
         * @return the maximum TTL, or empty for no limit
         */
        Optional<Duration> maxTtl();

        RetryConfig retry();
    }

    /**
     * Bounded retry of transient store failures.
     */
    interface RetryConfig {

        @WithDefault("3")
        int maxAttempts();

        @WithDefault("PT0.01S")
        Duration initialBackoff();

        @WithDefault("PT0.1S")
        Duration maxBackoff();
    }
}
