package tollgate.core.model.audit;

import java.time.Duration;
import java.time.Instant;

import tollgate.core.model.validation.ValidationPath;

/**
 * Immutable record of a single audited occurrence.
 *
 * <p>Events never carry a token value. The token is identified by its id when
 * known, or by a truncated hash prefix otherwise.
 *
 * @param type      what happened
 * @param severity  how serious it is
 * @param timestamp when it happened
 * @param tokenRef  token id or truncated hash (may be null)
 * @param tenantId  tenant involved (may be null)
 * @param endpoint  endpoint the request targeted (may be null)
 * @param outcome   short outcome label, e.g. {@code valid} or {@code expired_token}
 * @param latency   how long the decision took (zero when not applicable)
 * @param path      which validation path produced it (may be null)
 * @param detail    free-form detail (may be null)
 */
public record AuditEvent(
        AuditEventType type,
        AuditSeverity severity,
        Instant timestamp,
        String tokenRef,
        String tenantId,
        String endpoint,
        String outcome,
        Duration latency,
        ValidationPath path,
        String detail) {

    public AuditEvent {
        if (type == null) {
            throw new IllegalArgumentException("Event type is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp is required");
        }
        if (severity == null) {
            severity = type.defaultSeverity();
        }
        if (latency == null) {
            latency = Duration.ZERO;
        }
    }

    public boolean isCritical() {
        return severity == AuditSeverity.CRITICAL;
    }

    public static Builder builder(AuditEventType type, Instant timestamp) {
        return new Builder(type, timestamp);
    }

    public static class Builder {
        private final AuditEventType type;
        private final Instant timestamp;
        private AuditSeverity severity;
        private String tokenRef;
        private String tenantId;
        private String endpoint;
        private String outcome;
        private Duration latency;
        private ValidationPath path;
        private String detail;

        private Builder(AuditEventType type, Instant timestamp) {
            this.type = type;
            this.timestamp = timestamp;
        }

        public Builder severity(AuditSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder tokenRef(String tokenRef) {
            this.tokenRef = tokenRef;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder latency(Duration latency) {
            this.latency = latency;
            return this;
        }

        public Builder path(ValidationPath path) {
            this.path = path;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(
                    type, severity, timestamp, tokenRef, tenantId, endpoint, outcome, latency, path, detail);
        }
    }
}
