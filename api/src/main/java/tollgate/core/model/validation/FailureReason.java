package tollgate.core.model.validation;

/**
 * Why a validation did not produce a valid result.
 *
 * <p>The outcomes are mutually exclusive; a failed result carries exactly one.
 */
public enum FailureReason {
    /** Token unknown, revoked, or malformed. */
    INVALID_TOKEN(false),
    /** Token past its expiry and not eligible for extension. */
    EXPIRED_TOKEN(false),
    /** Token presented against a tenant other than the one it is bound to. */
    CROSS_TENANT_ATTEMPT(true),
    /** Token lacks one or more of the required scopes. */
    INSUFFICIENT_SCOPE(false),
    /** Token exceeded its rolling-window request budget. */
    RATE_LIMIT_EXCEEDED(false),
    /** The served path did not decide within its budget. */
    VALIDATION_TIMEOUT(false),
    /** The token store could not be reached. */
    STORE_UNAVAILABLE(false);

    private final boolean securityCritical;

    FailureReason(boolean securityCritical) {
        this.securityCritical = securityCritical;
    }

    /**
     * Returns whether this outcome must always be audited at critical severity.
     */
    public boolean isSecurityCritical() {
        return securityCritical;
    }
}
