package tollgate.core.service.validation;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import tollgate.core.model.risk.HistoricalSignals;
import tollgate.core.model.risk.RiskSignals;

/**
 * Heuristic risk score of a request, in [0, 1].
 *
 * <p>Pure and deterministic: the same signals always give the same score.
 * The score only informs auditing and step-up; it never rejects a token.
 */
@ApplicationScoped
public class RiskScorer {

    static final double MISSING_USER_AGENT = 0.3;
    static final double AUTOMATION_USER_AGENT = 0.2;
    static final double CROSS_TENANT_PROBE = 0.5;
    static final double MISSING_CLIENT_IP = 0.2;
    static final double MALFORMED_CLIENT_IP = 0.3;
    static final double HIGH_REQUEST_RATE = 0.3;
    static final double ELEVATED_REQUEST_RATE = 0.1;
    static final double UNKNOWN_CLIENT_IP = 0.1;
    static final double UNKNOWN_USER_AGENT = 0.1;
    static final double PER_RECENT_FAILURE = 0.1;
    static final double MAX_FAILURE_WEIGHT = 0.3;

    private static final List<String> AUTOMATION_MARKERS =
            List.of("curl", "wget", "python-requests", "go-http-client", "bot", "crawler", "spider", "scanner");

    private static final Pattern IPV4 =
            Pattern.compile("^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:]{2,39}$");

    /**
     * Score a request.
     *
     * @param signals the request signals
     * @return score in [0, 1]
     */
    public double score(RiskSignals signals) {
        double score = 0.0;
        score += userAgentRisk(signals.userAgent());
        score += clientIpRisk(signals.clientIp());
        score += rateRisk(signals.requestRate(), signals.rateLimit());
        score += historyRisk(signals.history());
        return Math.min(1.0, Math.max(0.0, score));
    }

    private double userAgentRisk(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return MISSING_USER_AGENT;
        }
        var ua = userAgent.toLowerCase(Locale.ROOT);
        double risk = 0.0;
        if (AUTOMATION_MARKERS.stream().anyMatch(ua::contains)) {
            risk += AUTOMATION_USER_AGENT;
        }
        if (ua.contains("cross-tenant")) {
            risk += CROSS_TENANT_PROBE;
        }
        return risk;
    }

    private double clientIpRisk(String clientIp) {
        if (clientIp == null || clientIp.isBlank()) {
            return MISSING_CLIENT_IP;
        }
        return isWellFormedIp(clientIp.trim()) ? 0.0 : MALFORMED_CLIENT_IP;
    }

    private double rateRisk(long requestRate, long rateLimit) {
        if (rateLimit <= 0 || rateLimit == Long.MAX_VALUE) {
            return 0.0;
        }
        double ratio = (double) requestRate / rateLimit;
        if (ratio > 0.9) {
            return HIGH_REQUEST_RATE;
        }
        if (ratio > 0.5) {
            return ELEVATED_REQUEST_RATE;
        }
        return 0.0;
    }

    private double historyRisk(HistoricalSignals history) {
        double risk = Math.min(MAX_FAILURE_WEIGHT, history.recentFailures() * PER_RECENT_FAILURE);
        if (history.firstUse()) {
            return risk;
        }
        if (!history.knownClientIp()) {
            risk += UNKNOWN_CLIENT_IP;
        }
        if (!history.knownUserAgent()) {
            risk += UNKNOWN_USER_AGENT;
        }
        return risk;
    }

    static boolean isWellFormedIp(String ip) {
        if (IPV4.matcher(ip).matches()) {
            return true;
        }
        return ip.indexOf(':') >= 0 && IPV6.matcher(ip).matches();
    }
}
