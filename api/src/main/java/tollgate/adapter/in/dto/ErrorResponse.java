package tollgate.adapter.in.dto;

import tollgate.core.model.error.TranslatedError;

/**
 * DTO for every error the API returns.
 *
 * @param message user-facing message
 * @param hint    what the caller can do about it (may be null)
 * @param code    stable error code
 */
public record ErrorResponse(String message, String hint, String code) {

    public static ErrorResponse from(TranslatedError error) {
        return new ErrorResponse(error.message(), error.hint(), error.code());
    }

    public static ErrorResponse badRequest(String message) {
        return new ErrorResponse(message, null, "BAD_REQUEST_001");
    }

    public static ErrorResponse notFound(String message) {
        return new ErrorResponse(message, null, "NOT_FOUND_001");
    }
}
