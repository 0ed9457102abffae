package tollgate.adapter.out.audit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.audit.AuditEvent;
import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.validation.ValidationPath;
import tollgate.mock.GatewayFixture;

@DisplayName("LoggingAuditSink")
class LoggingAuditSinkTest {

    @Test
    @DisplayName("should format every field of a decision")
    void shouldFormatDecision() {
        var event = AuditEvent.builder(AuditEventType.DECISION, GatewayFixture.T0)
                .tokenRef("0123456789abcdef")
                .tenantId("acme")
                .endpoint("/api/reports")
                .outcome("valid")
                .latency(Duration.ofMillis(12))
                .path(ValidationPath.ENHANCED)
                .build();

        assertEquals(
                "DECISION: ts=2026-03-01T09:00:00Z token=0123456789abcdef tenant=acme endpoint=/api/reports"
                        + " outcome=valid latencyMs=12 path=enhanced",
                LoggingAuditSink.format(event));
    }

    @Test
    @DisplayName("should show missing fields as a dash")
    void shouldDashMissingFields() {
        var event = AuditEvent.builder(AuditEventType.TIMEOUT, GatewayFixture.T0)
                .detail("budget=200ms")
                .build();

        var line = LoggingAuditSink.format(event);

        assertTrue(line.startsWith("TIMEOUT: ts=2026-03-01T09:00:00Z token=- tenant=- endpoint=- outcome=-"));
        assertTrue(line.endsWith("detail=budget=200ms"));
    }

    @Test
    @DisplayName("should write events of every severity")
    void shouldWriteAllSeverities() {
        var sink = new LoggingAuditSink();
        var events = List.of(
                AuditEvent.builder(AuditEventType.DECISION, GatewayFixture.T0).build(),
                AuditEvent.builder(AuditEventType.TIMEOUT, GatewayFixture.T0).build(),
                AuditEvent.builder(AuditEventType.CROSS_TENANT, GatewayFixture.T0).build());

        assertDoesNotThrow(() -> sink.write(events));
    }
}
