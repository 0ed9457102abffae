package tollgate.core.port.in;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.validation.ShadowValidation;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;

/**
 * Use case for adjudicating a presented token.
 */
public interface TokenValidationUseCase {

    /**
     * Validate a token for a tenant and scope.
     *
     * <p>Decision outcomes never fail the returned {@link Uni}; they are
     * reported through {@link ValidationResult#failureReason()}.
     *
     * @param request the token and request context
     * @return Uni with the served result
     */
    Uni<ValidationResult> validate(ValidationRequest request);

    /**
     * Validate a token and expose the pending comparison of both paths.
     *
     * @param request the token and request context
     * @return Uni with the served result and its shadow comparison
     */
    Uni<ShadowValidation> validateWithComparison(ValidationRequest request);
}
