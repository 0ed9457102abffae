package tollgate.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tollgate.core.config.GatewayConfig;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.port.out.RateLimiter;

/**
 * In-memory sliding-log rate limiter.
 *
 * <p>Each key keeps the timestamps of the requests counted inside the rolling
 * window. A request is allowed while fewer than {@code limit} timestamps
 * remain after pruning.
 *
 * <p>Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 */
@ApplicationScoped
public class InMemoryRateLimiter implements RateLimiter {

    private final ConcurrentMap<String, Deque<Instant>> logs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration window;
    private final boolean enabled;

    @Inject
    public InMemoryRateLimiter(GatewayConfig config, Clock clock) {
        this(config.rateLimit().window(), config.rateLimit().enabled(), clock);
    }

    public InMemoryRateLimiter(Duration window, boolean enabled, Clock clock) {
        this.window = window;
        this.enabled = enabled;
        this.clock = clock;
    }

    @Override
    public Uni<RateLimitDecision> checkAndConsume(String key, long limit) {
        if (!enabled) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }
        return Uni.createFrom().item(() -> computeDecision(key, limit, clock.instant()));
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the current number of tracked keys.
     */
    public int getBucketCount() {
        return logs.size();
    }

    private RateLimitDecision computeDecision(String key, long limit, Instant now) {
        final var result = new RateLimitDecision[1];

        // compute locks the bin, so check and record are atomic per key
        logs.compute(key, (k, log) -> {
            var current = log != null ? log : new ArrayDeque<Instant>();
            synchronized (current) {
                prune(current, now);
                if (current.size() >= limit) {
                    var resetAt = current.peekFirst().plus(window);
                    long retryAfter = Math.max(1, Duration.between(now, resetAt).toSeconds());
                    result[0] = RateLimitDecision.rejected(
                            limit, window.toSeconds(), resetAt, retryAfter, current.size());
                } else {
                    current.addLast(now);
                    result[0] = statusOf(current, limit, now);
                }
            }
            return current;
        });

        return result[0];
    }

    private RateLimitDecision statusOf(Deque<Instant> log, long limit, Instant now) {
        var oldest = log.peekFirst();
        var resetAt = oldest != null ? oldest.plus(window) : now.plus(window);
        long remaining = Math.max(0, limit - log.size());
        return RateLimitDecision.allow(remaining, limit, window.toSeconds(), resetAt, log.size());
    }

    private void prune(Deque<Instant> log, Instant now) {
        var cutoff = now.minus(window);
        while (!log.isEmpty() && !log.peekFirst().isAfter(cutoff)) {
            log.pollFirst();
        }
    }
}
