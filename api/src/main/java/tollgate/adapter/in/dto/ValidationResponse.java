package tollgate.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import tollgate.core.model.validation.ValidationResult;

/**
 * DTO for an accepted token.
 */
public record ValidationResponse(
        boolean valid,
        String tenantId,
        Set<String> scopes,
        long rateLimitRemaining,
        double riskScore,
        boolean stepUpRequired,
        Instant expiresAt) {

    public static ValidationResponse from(ValidationResult result) {
        return new ValidationResponse(
                true,
                result.tenant().tenantId(),
                result.grantedScopes(),
                result.rateLimitRemaining(),
                result.riskScore(),
                result.stepUpRequired(),
                result.expiresAt());
    }
}
