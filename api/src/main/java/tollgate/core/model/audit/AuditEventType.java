package tollgate.core.model.audit;

/**
 * Kinds of audit records written by the gateway.
 */
public enum AuditEventType {
    /** Outcome of one validation path. */
    DECISION(AuditSeverity.INFO),

    /** A token was presented against a tenant it is not bound to. */
    CROSS_TENANT(AuditSeverity.CRITICAL),

    /** The legacy and enhanced paths disagreed on validity. */
    DISCREPANCY(AuditSeverity.CRITICAL),

    /** A validation path did not decide in time. */
    TIMEOUT(AuditSeverity.WARNING),

    EXTENDED(AuditSeverity.INFO),

    ISSUED(AuditSeverity.INFO),

    REVOKED(AuditSeverity.INFO),

    /** The risk score crossed the elevated threshold. */
    HIGH_RISK(AuditSeverity.WARNING);

    private final AuditSeverity defaultSeverity;

    AuditEventType(AuditSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public AuditSeverity defaultSeverity() {
        return defaultSeverity;
    }
}
