package tollgate.adapter.out.telemetry;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import tollgate.core.model.validation.ValidationPath;
import tollgate.core.port.out.ValidationMetrics;

/**
 * Records validation metrics using Micrometer.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code tollgate.validation.decisions} - decisions by path and outcome</li>
 *   <li>{@code tollgate.validation.latency} - decision latency by path</li>
 *   <li>{@code tollgate.validation.discrepancies} - legacy/enhanced disagreements</li>
 *   <li>{@code tollgate.validation.timeouts} - paths that did not decide in time</li>
 *   <li>{@code tollgate.cache.requests} - cache probes by cache and result</li>
 *   <li>{@code tollgate.token.extensions} - automatic and explicit extensions</li>
 *   <li>{@code tollgate.audit.dropped} - audit events dropped under backpressure</li>
 *   <li>{@code tollgate.audit.sink.failures} - failed sink writes</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerValidationMetrics implements ValidationMetrics {

    private final MeterRegistry registry;

    @Inject
    public MicrometerValidationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordDecision(ValidationPath path, String outcome, Duration latency) {
        Counter.builder("tollgate.validation.decisions")
                .description("Validation decisions by path and outcome")
                .tag("path", path.tag())
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("tollgate.validation.latency")
                .description("Time for a validation path to decide")
                .tag("path", path.tag())
                .register(registry)
                .record(latency);
    }

    @Override
    public void recordDiscrepancy(boolean legacyValid, boolean enhancedValid) {
        Counter.builder("tollgate.validation.discrepancies")
                .description("Requests where the legacy and enhanced paths disagreed")
                .tag("legacy", String.valueOf(legacyValid))
                .tag("enhanced", String.valueOf(enhancedValid))
                .register(registry)
                .increment();
    }

    @Override
    public void recordTimeout(ValidationPath path) {
        Counter.builder("tollgate.validation.timeouts")
                .description("Validation paths that did not decide in time")
                .tag("path", path.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheAccess(String cache, boolean hit) {
        Counter.builder("tollgate.cache.requests")
                .description("Cache probes")
                .tag("cache", cache)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordExtension() {
        Counter.builder("tollgate.token.extensions")
                .description("Token expiry extensions")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuditDropped() {
        Counter.builder("tollgate.audit.dropped")
                .description("Audit events dropped because the queue was full")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuditSinkFailure() {
        Counter.builder("tollgate.audit.sink.failures")
                .description("Audit sink write failures")
                .register(registry)
                .increment();
    }
}
