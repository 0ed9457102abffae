package tollgate.core.model.audit;

/**
 * Severity of an audit event.
 *
 * <p>Critical events are never dropped under backpressure.
 */
public enum AuditSeverity {
    INFO,
    WARNING,
    CRITICAL
}
