package tollgate.core.port.out;

import java.util.List;

import tollgate.core.model.audit.AuditEvent;

/**
 * Destination for audit events.
 *
 * <p>Called from the audit flush thread with batches, and from request
 * threads for single critical events when the queue is full. Implementations
 * must be thread-safe.
 */
public interface AuditSink {

    /**
     * Write a batch of events in order.
     *
     * @param events the events to write
     */
    void write(List<AuditEvent> events);

    /**
     * Write a single event.
     *
     * @param event the event to write
     */
    default void write(AuditEvent event) {
        write(List.of(event));
    }
}
