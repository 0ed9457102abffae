package tollgate.core.model.token;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Stored metadata of an issued token.
 *
 * <p>The token value itself is never stored; only its salted hash is persisted
 * for lookup. Instances are immutable. Expiry only moves through
 * {@link #extendTo(Instant)} and revocation through {@link #revoke(Instant)}.
 *
 * @param id               short identifier for display, extension and revocation
 * @param tokenHash        salted hash of the token value (never store plaintext)
 * @param tenantId         the single tenant this token is bound to
 * @param scopes           scopes granted at issue time
 * @param issuedAt         when the token was issued
 * @param expiresAt        when the token expires
 * @param securityLevel    security level, selects the rate-limit tier
 * @param rateLimitPerHour requests allowed per rolling hour
 * @param extensionCount   how many times the expiry has been pushed forward
 * @param revoked          whether the token has been revoked
 * @param revokedAt        when the token was revoked (null if not revoked)
 */
public record StoredToken(
        String id,
        String tokenHash,
        String tenantId,
        Set<String> scopes,
        Instant issuedAt,
        Instant expiresAt,
        SecurityLevel securityLevel,
        int rateLimitPerHour,
        int extensionCount,
        boolean revoked,
        Instant revokedAt) {

    public StoredToken {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Token ID cannot be null or blank");
        }
        if (tokenHash == null || tokenHash.isBlank()) {
            throw new IllegalArgumentException("Token hash cannot be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or blank");
        }
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Token issue and expiry times are required");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        if (securityLevel == null) {
            securityLevel = SecurityLevel.STANDARD;
        }
        if (extensionCount < 0) {
            throw new IllegalArgumentException("Extension count must be non-negative");
        }
    }

    /**
     * Checks if the token has expired at the given instant.
     *
     * @param now the instant to check against
     * @return true if {@code now} is at or after the expiry
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Returns the lifetime left at the given instant (negative once expired).
     */
    public Duration remainingTtl(Instant now) {
        return Duration.between(now, expiresAt);
    }

    /**
     * Checks if the token grants every one of the required scopes.
     *
     * @param requiredScopes the scopes a request needs
     * @return true if all are granted
     */
    public boolean grantsAll(Set<String> requiredScopes) {
        return scopes.containsAll(requiredScopes);
    }

    /**
     * Creates a copy with a later expiry and an incremented extension count.
     *
     * <p>Tenant and scopes are carried over unchanged.
     *
     * @param newExpiry the new expiry
     * @return the extended token
     */
    public StoredToken extendTo(Instant newExpiry) {
        return new StoredToken(
                id,
                tokenHash,
                tenantId,
                scopes,
                issuedAt,
                newExpiry,
                securityLevel,
                rateLimitPerHour,
                extensionCount + 1,
                revoked,
                revokedAt);
    }

    /**
     * Creates a revoked copy of this token.
     *
     * @param at when the revocation happened
     * @return a new token with revoked=true
     */
    public StoredToken revoke(Instant at) {
        return new StoredToken(
                id,
                tokenHash,
                tenantId,
                scopes,
                issuedAt,
                expiresAt,
                securityLevel,
                rateLimitPerHour,
                extensionCount,
                true,
                at);
    }

    public static Builder builder(String id, String tokenHash) {
        return new Builder(id, tokenHash);
    }

    public static class Builder {
        private final String id;
        private final String tokenHash;
        private String tenantId;
        private Set<String> scopes = Set.of();
        private Instant issuedAt;
        private Instant expiresAt;
        private SecurityLevel securityLevel = SecurityLevel.STANDARD;
        private int rateLimitPerHour;
        private int extensionCount;

        private Builder(String id, String tokenHash) {
            this.id = id;
            this.tokenHash = tokenHash;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder scopes(Set<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder securityLevel(SecurityLevel securityLevel) {
            this.securityLevel = securityLevel;
            return this;
        }

        public Builder rateLimitPerHour(int rateLimitPerHour) {
            this.rateLimitPerHour = rateLimitPerHour;
            return this;
        }

        public Builder extensionCount(int extensionCount) {
            this.extensionCount = extensionCount;
            return this;
        }

        public StoredToken build() {
            return new StoredToken(
                    id,
                    tokenHash,
                    tenantId,
                    scopes,
                    issuedAt,
                    expiresAt,
                    securityLevel,
                    rateLimitPerHour,
                    extensionCount,
                    false,
                    null);
        }
    }
}
