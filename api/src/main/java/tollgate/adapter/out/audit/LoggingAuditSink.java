package tollgate.adapter.out.audit;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import tollgate.core.model.audit.AuditEvent;
import tollgate.core.port.out.AuditSink;

/**
 * Audit sink that writes events using JBoss Logging.
 *
 * <p>Events go to the {@code tollgate.audit} category so they can be routed
 * to their own handler. Log levels are based on event severity:
 * <ul>
 *   <li>INFO severity → INFO level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
@ApplicationScoped
public class LoggingAuditSink implements AuditSink {

    private static final Logger LOG = Logger.getLogger("tollgate.audit");

    @Override
    public void write(List<AuditEvent> events) {
        for (var event : events) {
            var message = format(event);
            switch (event.severity()) {
                case CRITICAL:
                    LOG.error(message);
                    break;
                case WARNING:
                    LOG.warn(message);
                    break;
                default:
                    LOG.info(message);
            }
        }
    }

    static String format(AuditEvent event) {
        var sb = new StringBuilder(event.type().name())
                .append(": ts=")
                .append(event.timestamp())
                .append(" token=")
                .append(orDash(event.tokenRef()))
                .append(" tenant=")
                .append(orDash(event.tenantId()))
                .append(" endpoint=")
                .append(orDash(event.endpoint()))
                .append(" outcome=")
                .append(orDash(event.outcome()))
                .append(" latencyMs=")
                .append(event.latency().toMillis());
        if (event.path() != null) {
            sb.append(" path=").append(event.path().tag());
        }
        if (event.detail() != null) {
            sb.append(" detail=").append(event.detail());
        }
        return sb.toString();
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
