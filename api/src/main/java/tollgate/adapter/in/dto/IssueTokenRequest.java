package tollgate.adapter.in.dto;

import java.util.Set;

import tollgate.core.model.token.SecurityLevel;

/**
 * DTO for token issue requests.
 *
 * @param tenantId      tenant the token is bound to (required)
 * @param scopes        scopes to grant (at least one)
 * @param ttlSeconds    lifetime in seconds (required, positive)
 * @param securityLevel optional security level, STANDARD when absent
 */
public record IssueTokenRequest(String tenantId, Set<String> scopes, Long ttlSeconds, SecurityLevel securityLevel) {}
