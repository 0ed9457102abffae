package tollgate.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check, indicating whether a request is allowed and
 * how much of the rolling window is left.
 *
 * @param allowed           whether the request is allowed
 * @param remaining         requests remaining in the current window
 * @param limit             the total limit for the window
 * @param windowSeconds     the window duration in seconds
 * @param resetAt           when the oldest counted request leaves the window
 * @param retryAfterSeconds seconds until the client can retry (only meaningful when not allowed)
 * @param requestCount      requests counted in the current window
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long limit,
        long windowSeconds,
        Instant resetAt,
        long retryAfterSeconds,
        int requestCount) {

    /**
     * Create an "allowed" decision with unlimited budget.
     *
     * <p>Used when rate limiting is disabled.
     *
     * @return an allowed decision
     */
    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, Instant.MAX, 0, 0);
    }

    public static RateLimitDecision allow(
            long remaining, long limit, long windowSeconds, Instant resetAt, int requestCount) {
        return new RateLimitDecision(true, remaining, limit, windowSeconds, resetAt, 0, requestCount);
    }

    public static RateLimitDecision rejected(
            long limit, long windowSeconds, Instant resetAt, long retryAfterSeconds, int requestCount) {
        return new RateLimitDecision(false, 0, limit, windowSeconds, resetAt, retryAfterSeconds, requestCount);
    }
}
