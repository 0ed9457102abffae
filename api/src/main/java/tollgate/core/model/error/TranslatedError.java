package tollgate.core.model.error;

/**
 * A failure reason rendered safe for the caller.
 *
 * <p>Carries no token, tenant or internal identifier.
 *
 * @param message    user-facing message
 * @param hint       what the caller can do about it
 * @param code       stable error code
 * @param httpStatus status code for HTTP responses
 */
public record TranslatedError(String message, String hint, String code, int httpStatus) {}
