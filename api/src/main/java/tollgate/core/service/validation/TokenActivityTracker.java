package tollgate.core.service.validation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import tollgate.core.model.risk.HistoricalSignals;

/**
 * Bounded memory of how each token has been used, keyed by token hash.
 *
 * <p>Feeds the historical part of the risk score: client IPs and user agents
 * seen for the token, and failures in the last {@link #FAILURE_WINDOW}.
 */
@ApplicationScoped
public class TokenActivityTracker {

    static final Duration FAILURE_WINDOW = Duration.ofMinutes(15);
    static final int MAX_REMEMBERED = 16;

    private static final long MAX_TRACKED_TOKENS = 10_000;
    private static final Duration IDLE_EXPIRY = Duration.ofHours(24);

    private final Clock clock;
    private final Cache<String, Activity> activities;

    @Inject
    public TokenActivityTracker(Clock clock) {
        this.clock = clock;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.activities = Caffeine.newBuilder()
                .maximumSize(MAX_TRACKED_TOKENS)
                .expireAfterAccess(IDLE_EXPIRY)
                .ticker(ticker)
                .build();
    }

    /**
     * What is known about earlier use of a token, relative to the current request.
     */
    public HistoricalSignals signals(String tokenHash, String clientIp, String userAgent) {
        var activity = activities.getIfPresent(tokenHash);
        if (activity == null) {
            return HistoricalSignals.none();
        }
        return activity.signals(clientIp, userAgent, clock.instant());
    }

    public void recordSuccess(String tokenHash, String clientIp, String userAgent) {
        activities.get(tokenHash, k -> new Activity()).recordSuccess(clientIp, userAgent);
    }

    public void recordFailure(String tokenHash) {
        activities.get(tokenHash, k -> new Activity()).recordFailure(clock.instant());
    }

    private static final class Activity {
        private final Set<String> clientIps = new LinkedHashSet<>();
        private final Set<String> userAgents = new LinkedHashSet<>();
        private final Deque<Instant> failures = new ArrayDeque<>();
        private boolean used;

        synchronized HistoricalSignals signals(String clientIp, String userAgent, Instant now) {
            pruneFailures(now);
            return new HistoricalSignals(
                    failures.size(),
                    clientIp != null && clientIps.contains(clientIp),
                    userAgent != null && userAgents.contains(userAgent),
                    !used);
        }

        synchronized void recordSuccess(String clientIp, String userAgent) {
            used = true;
            remember(clientIps, clientIp);
            remember(userAgents, userAgent);
        }

        synchronized void recordFailure(Instant now) {
            pruneFailures(now);
            failures.addLast(now);
            if (failures.size() > MAX_REMEMBERED) {
                failures.pollFirst();
            }
        }

        private void pruneFailures(Instant now) {
            var cutoff = now.minus(FAILURE_WINDOW);
            while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
                failures.pollFirst();
            }
        }

        private static void remember(Set<String> seen, String value) {
            if (value == null || value.isBlank()) {
                return;
            }
            if (seen.size() >= MAX_REMEMBERED && !seen.contains(value)) {
                var oldest = seen.iterator().next();
                seen.remove(oldest);
            }
            seen.add(value);
        }
    }
}
