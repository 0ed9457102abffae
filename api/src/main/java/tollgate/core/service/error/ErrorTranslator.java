package tollgate.core.service.error;

import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import tollgate.core.model.error.TranslatedError;
import tollgate.core.model.validation.FailureReason;

/**
 * Maps internal failure reasons to messages that are safe to show a caller.
 *
 * <p>The mapping is fixed. Translated errors never name a tenant, token or
 * store detail; a cross-tenant attempt deliberately reads like a missing
 * resource.
 */
@ApplicationScoped
public class ErrorTranslator {

    private static final Map<FailureReason, TranslatedError> TRANSLATIONS = new EnumMap<>(FailureReason.class);

    static {
        TRANSLATIONS.put(
                FailureReason.CROSS_TENANT_ATTEMPT,
                new TranslatedError("Resource not found", "Try searching again", "ACCESS_DENIED_001", 404));
        TRANSLATIONS.put(
                FailureReason.EXPIRED_TOKEN,
                new TranslatedError("Please log in again", "Refresh your session", "AUTH_EXPIRED_001", 401));
        TRANSLATIONS.put(
                FailureReason.INSUFFICIENT_SCOPE,
                new TranslatedError("Access not available", "Contact your administrator", "PERM_DENIED_001", 403));
        TRANSLATIONS.put(
                FailureReason.VALIDATION_TIMEOUT,
                new TranslatedError("Service temporarily unavailable", "Try again shortly", "TIMEOUT_001", 503));
        TRANSLATIONS.put(
                FailureReason.INVALID_TOKEN,
                new TranslatedError(
                        "Please log in again", "Your session may have been corrupted", "AUTH_FORMAT_001", 401));
        TRANSLATIONS.put(
                FailureReason.RATE_LIMIT_EXCEEDED,
                new TranslatedError(
                        "Too many requests", "Please wait a moment before trying again", "RATE_LIMIT_001", 429));
        TRANSLATIONS.put(
                FailureReason.STORE_UNAVAILABLE,
                new TranslatedError(
                        "Service temporarily unavailable", "Please try again in a few minutes", "DB_CONN_001", 503));
    }

    /**
     * Translate a failure reason.
     *
     * @param reason the internal reason
     * @return the caller-facing error
     */
    public TranslatedError translate(FailureReason reason) {
        var translated = TRANSLATIONS.get(reason);
        if (translated == null) {
            throw new IllegalArgumentException("No translation for " + reason);
        }
        return translated;
    }
}
