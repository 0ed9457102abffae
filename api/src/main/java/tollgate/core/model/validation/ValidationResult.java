package tollgate.core.model.validation;

import java.time.Instant;
import java.util.Set;

import tollgate.core.model.token.TenantContext;

/**
 * Outcome of validating one request on one path.
 *
 * <p>A valid result always carries the tenant the token is bound to. A failed
 * result never carries a tenant, so a caller cannot learn anything about the
 * tenant behind a token it presented against the wrong one.
 *
 * @param valid              whether the token was accepted
 * @param tenant             the token's bound tenant (null when not valid)
 * @param grantedScopes      scopes carried by the token (empty when not valid)
 * @param rateLimitRemaining requests left in the current window
 * @param riskScore          heuristic score in [0, 1]
 * @param failureReason      why the token was rejected (null when valid)
 * @param tokenId            identifier of the matched token, if any
 * @param expiresAt          expiry of the matched token, if any
 * @param path               the path that produced this result
 * @param stepUpRequired     whether the risk score asks for step-up authentication
 */
public record ValidationResult(
        boolean valid,
        TenantContext tenant,
        Set<String> grantedScopes,
        long rateLimitRemaining,
        double riskScore,
        FailureReason failureReason,
        String tokenId,
        Instant expiresAt,
        ValidationPath path,
        boolean stepUpRequired) {

    public ValidationResult {
        if (path == null) {
            throw new IllegalArgumentException("Validation path is required");
        }
        if (valid && tenant == null) {
            throw new IllegalArgumentException("A valid result must carry its tenant");
        }
        if (valid == (failureReason != null)) {
            throw new IllegalArgumentException("Exactly one of valid or failureReason must be set");
        }
        grantedScopes = grantedScopes == null ? Set.of() : Set.copyOf(grantedScopes);
        if (riskScore < 0.0 || riskScore > 1.0) {
            throw new IllegalArgumentException("Risk score must be within [0, 1], got: " + riskScore);
        }
    }

    public static ValidationResult valid(
            ValidationPath path,
            String tokenId,
            TenantContext tenant,
            Set<String> grantedScopes,
            Instant expiresAt,
            long rateLimitRemaining,
            double riskScore,
            boolean stepUpRequired) {
        return new ValidationResult(
                true, tenant, grantedScopes, rateLimitRemaining, riskScore, null, tokenId, expiresAt, path,
                stepUpRequired);
    }

    public static ValidationResult failure(ValidationPath path, FailureReason reason) {
        return failure(path, reason, null);
    }

    public static ValidationResult failure(ValidationPath path, FailureReason reason, String tokenId) {
        if (reason == null) {
            throw new IllegalArgumentException("Failure reason is required");
        }
        return new ValidationResult(false, null, Set.of(), 0, 0.0, reason, tokenId, null, path, false);
    }

    /**
     * Returns a copy carrying a new expiry, after the token behind it was extended.
     */
    public ValidationResult withExpiresAt(Instant newExpiry) {
        return new ValidationResult(
                valid, tenant, grantedScopes, rateLimitRemaining, riskScore, failureReason, tokenId, newExpiry, path,
                stepUpRequired);
    }

    /**
     * Returns whether this result is a cross-tenant rejection.
     */
    public boolean isCrossTenant() {
        return failureReason == FailureReason.CROSS_TENANT_ATTEMPT;
    }

    /**
     * Short outcome label for audit and metrics ("valid" or the failure reason).
     */
    public String outcome() {
        return valid ? "valid" : failureReason.name().toLowerCase();
    }
}
