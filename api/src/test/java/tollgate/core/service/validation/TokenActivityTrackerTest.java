package tollgate.core.service.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.mock.GatewayFixture;
import tollgate.mock.MutableClock;

@DisplayName("TokenActivityTracker")
class TokenActivityTrackerTest {

    private final MutableClock clock = new MutableClock(GatewayFixture.T0);
    private final TokenActivityTracker tracker = new TokenActivityTracker(clock);

    @Test
    @DisplayName("should report first use for an unseen token")
    void shouldReportFirstUse() {
        var signals = tracker.signals("hash", "203.0.113.7", "ua");

        assertTrue(signals.firstUse());
        assertEquals(0, signals.recentFailures());
    }

    @Test
    @DisplayName("should remember client details of successful requests")
    void shouldRememberClientDetails() {
        tracker.recordSuccess("hash", "203.0.113.7", "ua");

        var same = tracker.signals("hash", "203.0.113.7", "ua");
        var other = tracker.signals("hash", "198.51.100.1", "other");

        assertFalse(same.firstUse());
        assertTrue(same.knownClientIp());
        assertTrue(same.knownUserAgent());
        assertFalse(other.knownClientIp());
        assertFalse(other.knownUserAgent());
    }

    @Test
    @DisplayName("should count failures inside the window only")
    void shouldCountRecentFailures() {
        tracker.recordFailure("hash");
        tracker.recordFailure("hash");
        assertEquals(2, tracker.signals("hash", null, null).recentFailures());

        clock.advance(TokenActivityTracker.FAILURE_WINDOW.plus(Duration.ofSeconds(1)));

        assertEquals(0, tracker.signals("hash", null, null).recentFailures());
    }

    @Test
    @DisplayName("should keep a bounded number of failures")
    void shouldBoundFailures() {
        for (int i = 0; i < 40; i++) {
            tracker.recordFailure("hash");
        }

        assertEquals(TokenActivityTracker.MAX_REMEMBERED, tracker.signals("hash", null, null).recentFailures());
    }
}
