package tollgate.core.model.risk;

/**
 * What the gateway remembers about earlier use of a token.
 *
 * @param recentFailures   failed validations of this token in the recent past
 * @param knownClientIp    whether the current client IP was seen before for this token
 * @param knownUserAgent   whether the current user agent was seen before for this token
 * @param firstUse         whether this is the first recorded use of the token
 */
public record HistoricalSignals(int recentFailures, boolean knownClientIp, boolean knownUserAgent, boolean firstUse) {

    public HistoricalSignals {
        if (recentFailures < 0) {
            throw new IllegalArgumentException("Failure count must be non-negative");
        }
    }

    /**
     * Signals for a token with no recorded history.
     */
    public static HistoricalSignals none() {
        return new HistoricalSignals(0, false, false, true);
    }
}
