package tollgate.core.port.in;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.token.SecurityLevel;
import tollgate.core.model.token.TokenIssueResult;

/**
 * Use case interface for token lifecycle management.
 */
public interface TokenManagement {

    /**
     * Issue a new token bound to one tenant.
     *
     * @param tenantId      the tenant the token is bound to
     * @param scopes        scopes granted to the token
     * @param ttl           lifetime of the token
     * @param securityLevel security level selecting the rate-limit tier (null for STANDARD)
     * @return Uni with the issue result including the plaintext (shown once)
     * @throws IllegalArgumentException if the tenant, scopes or TTL are invalid
     */
    Uni<TokenIssueResult> issue(String tenantId, Set<String> scopes, Duration ttl, SecurityLevel securityLevel);

    /**
     * Push the expiry of a token forward by the configured increment.
     *
     * @param tokenId the token identifier
     * @return Uni with true if extended, false if unknown, revoked or at the extension limit
     */
    Uni<Boolean> extend(String tokenId);

    /**
     * Revoke a token immediately.
     *
     * @param tokenId the token identifier
     * @return Uni with true if revoked, false if unknown or already revoked
     */
    Uni<Boolean> revoke(String tokenId);
}
