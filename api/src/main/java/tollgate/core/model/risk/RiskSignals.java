package tollgate.core.model.risk;

/**
 * Inputs to the risk score of a single request.
 *
 * @param clientIp    the client IP as reported by the edge (may be null)
 * @param userAgent   the client user agent (may be null)
 * @param requestRate requests counted for the token in the current window
 * @param rateLimit   the token's limit for the window
 * @param history     what is known about earlier use of the token
 */
public record RiskSignals(
        String clientIp, String userAgent, long requestRate, long rateLimit, HistoricalSignals history) {

    public RiskSignals {
        if (history == null) {
            history = HistoricalSignals.none();
        }
    }
}
