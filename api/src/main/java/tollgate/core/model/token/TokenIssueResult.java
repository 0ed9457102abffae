package tollgate.core.model.token;

import java.time.Instant;

/**
 * Result of issuing a new token.
 *
 * <p>This is the only time the plaintext token is available. After issue,
 * only the hash is stored and the value cannot be retrieved.
 *
 * @param tokenValue the actual token (only returned once!)
 * @param tokenId    the short identifier for this token
 * @param expiresAt  when the token expires
 * @param metadata   the stored token metadata (with hash, not plaintext)
 */
public record TokenIssueResult(String tokenValue, String tokenId, Instant expiresAt, StoredToken metadata) {

    public TokenIssueResult {
        if (tokenValue == null || tokenValue.isBlank()) {
            throw new IllegalArgumentException("Token value cannot be null or blank");
        }
        if (tokenId == null || tokenId.isBlank()) {
            throw new IllegalArgumentException("Token ID cannot be null or blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata cannot be null");
        }
    }
}
