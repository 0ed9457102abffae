package tollgate.core.model.token;

/**
 * Security level assigned to a token at issue time.
 *
 * <p>The level selects the token's rate-limit tier.
 */
public enum SecurityLevel {
    STANDARD,
    MEDIUM,
    HIGH
}
