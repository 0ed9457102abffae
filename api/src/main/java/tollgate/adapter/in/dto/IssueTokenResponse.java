package tollgate.adapter.in.dto;

import java.time.Instant;

/**
 * DTO returned once when a token is issued. The token value is never shown again.
 */
public record IssueTokenResponse(String token, String tokenId, Instant expiresAt) {}
