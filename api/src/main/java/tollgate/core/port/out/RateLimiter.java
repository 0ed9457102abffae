package tollgate.core.port.out;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.RateLimitDecision;

/**
 * Port interface for per-token rate limiting over a rolling window.
 *
 * <p>All operations are non-blocking and return reactive types.
 */
public interface RateLimiter {

    /**
     * Check if a request is allowed and count it if so.
     *
     * <p>Check and count happen atomically: of N+1 concurrent requests against
     * a budget of N, exactly one is rejected.
     *
     * @param key   the bucket key, usually the token id
     * @param limit requests allowed per window
     * @return a decision indicating whether the request is allowed
     */
    Uni<RateLimitDecision> checkAndConsume(String key, long limit);

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
