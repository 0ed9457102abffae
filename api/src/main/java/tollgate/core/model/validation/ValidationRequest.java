package tollgate.core.model.validation;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single inbound validation request.
 *
 * @param token          the raw token value as presented
 * @param requiredScopes scopes the call needs (all of them)
 * @param tenantHint     the tenant the call claims to act within
 * @param clientIp       client address, may be null
 * @param userAgent      client user agent, may be null
 * @param endpoint       the target endpoint, used for auditing
 */
public record ValidationRequest(
        String token,
        Set<String> requiredScopes,
        String tenantHint,
        String clientIp,
        String userAgent,
        String endpoint) {

    public ValidationRequest {
        requiredScopes = requiredScopes == null ? Set.of() : Set.copyOf(requiredScopes);
        if (endpoint == null) {
            endpoint = "";
        }
    }

    /**
     * Creates a request from a raw scope expression.
     *
     * <p>Several scopes may be given separated by whitespace or commas.
     *
     * @return the request
     */
    public static ValidationRequest of(
            String token, String requiredScope, String tenantHint, String clientIp, String userAgent, String endpoint) {
        return new ValidationRequest(token, parseScopes(requiredScope), tenantHint, clientIp, userAgent, endpoint);
    }

    static Set<String> parseScopes(String requiredScope) {
        if (requiredScope == null || requiredScope.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(requiredScope.split("[\\s,]+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns the required scopes in a stable, sorted form for cache keys and logs.
     */
    public String scopeKey() {
        return requiredScopes.stream().sorted().collect(Collectors.joining(" "));
    }
}
