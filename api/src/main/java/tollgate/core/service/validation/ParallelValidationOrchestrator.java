package tollgate.core.service.validation;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import tollgate.core.config.GatewayConfig;
import tollgate.core.model.audit.AuditEvent;
import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.model.validation.ShadowComparison;
import tollgate.core.model.validation.ShadowValidation;
import tollgate.core.model.validation.ValidationPath;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;
import tollgate.core.port.in.TokenValidationUseCase;
import tollgate.core.port.out.RateLimiter;
import tollgate.core.port.out.ValidationMetrics;
import tollgate.core.service.audit.AuditLogger;

/**
 * Runs the legacy and enhanced validation paths side by side and serves one
 * of them.
 *
 * <p>The served path is legacy in fail-safe mode and enhanced otherwise. It
 * must decide within the middleware budget or the request fails with
 * {@code VALIDATION_TIMEOUT}. A valid served token close to expiry is
 * extended inside that budget and served with its new expiry. The other path
 * (the shadow) runs concurrently on the worker pool, bounded by the overall
 * timeout, and never delays or changes the response.
 *
 * <p>Each path that decides is audited as a {@code DECISION}; a path that
 * times out is only audited as a {@code TIMEOUT} and takes no part in the
 * comparison. When both paths decide and disagree on validity, a critical
 * {@code DISCREPANCY} is audited and counted. A request in which either path
 * saw a cross-tenant attempt produces exactly one {@code CROSS_TENANT} event.
 *
 * <p>This class holds no tenant authority: it only picks which of the
 * already-computed results is served.
 */
@ApplicationScoped
public class ParallelValidationOrchestrator implements TokenValidationUseCase {

    private static final Logger LOG = Logger.getLogger(ParallelValidationOrchestrator.class);

    private final LegacyTokenValidator legacyValidator;
    private final TokenValidator enhancedValidator;
    private final RateLimiter rateLimiter;
    private final ExtensionManager extensionManager;
    private final AuditLogger audit;
    private final ValidationMetrics metrics;
    private final GatewayConfig config;
    private final Clock clock;
    private final AtomicLong discrepancies = new AtomicLong();

    @Inject
    public ParallelValidationOrchestrator(
            LegacyTokenValidator legacyValidator,
            TokenValidator enhancedValidator,
            RateLimiter rateLimiter,
            ExtensionManager extensionManager,
            AuditLogger audit,
            ValidationMetrics metrics,
            GatewayConfig config,
            Clock clock) {
        this.legacyValidator = legacyValidator;
        this.enhancedValidator = enhancedValidator;
        this.rateLimiter = rateLimiter;
        this.extensionManager = extensionManager;
        this.audit = audit;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Uni<ValidationResult> validate(ValidationRequest request) {
        return validateWithComparison(request).map(ShadowValidation::served);
    }

    @Override
    public Uni<ShadowValidation> validateWithComparison(ValidationRequest request) {
        return Uni.createFrom().deferred(() -> {
            var servedPath = config.failSafeMode() ? ValidationPath.LEGACY : ValidationPath.ENHANCED;
            var shadowPath = servedPath == ValidationPath.LEGACY ? ValidationPath.ENHANCED : ValidationPath.LEGACY;
            var context = new RequestContext(request, RateLimitTicket.forRequest(rateLimiter));

            CompletableFuture<PathOutcome> shadow;
            if (config.parallelValidation().enabled()) {
                shadow = run(shadowPath, context, Duration.ofMillis(config.timeoutMs()), false)
                        .subscribeAsCompletionStage();
            } else {
                shadow = CompletableFuture.completedFuture(PathOutcome.skipped(shadowPath));
            }

            return run(servedPath, context, Duration.ofMillis(config.middlewareBudgetMs()), true)
                    .map(served -> {
                        CompletionStage<ShadowComparison> comparison =
                                shadow.thenApply(shadowOutcome -> compare(context, served, shadowOutcome));
                        return new ShadowValidation(served.servedResult(), comparison);
                    });
        });
    }

    /**
     * Number of requests in which the two paths disagreed on validity.
     */
    public long discrepancyCount() {
        return discrepancies.get();
    }

    private Uni<PathOutcome> run(ValidationPath path, RequestContext context, Duration timeout, boolean extend) {
        long start = System.nanoTime();
        Uni<ValidationResult> validation = path == ValidationPath.LEGACY
                ? legacyValidator.validate(context.request(), context.ticket())
                : enhancedValidator.validate(context.request(), context.ticket());
        if (extend) {
            validation = validation.flatMap(this::extendIfValid);
        }

        return validation
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .map(result -> PathOutcome.decided(path, result, elapsedSince(start)))
                .ifNoItem()
                .after(timeout)
                .recoverWithItem(() -> PathOutcome.timedOut(path, elapsedSince(start)))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.errorf(e, "Unexpected failure on %s validation path", path.tag());
                    return PathOutcome.decided(
                            path, ValidationResult.failure(path, FailureReason.STORE_UNAVAILABLE), elapsedSince(start));
                })
                .invoke(outcome -> recordOutcome(context, outcome));
    }

    private void recordOutcome(RequestContext context, PathOutcome outcome) {
        var request = context.request();
        if (outcome.timedOut()) {
            metrics.recordTimeout(outcome.path());
            LOG.debugf("%s validation timed out after %d ms", outcome.path().tag(), outcome.latency().toMillis());
            audit.record(AuditEvent.builder(AuditEventType.TIMEOUT, clock.instant())
                    .endpoint(request.endpoint())
                    .outcome("validation_timeout")
                    .latency(outcome.latency())
                    .path(outcome.path())
                    .build());
            return;
        }

        var result = outcome.result();
        metrics.recordDecision(outcome.path(), result.outcome(), outcome.latency());
        audit.record(AuditEvent.builder(AuditEventType.DECISION, clock.instant())
                .tokenRef(result.tokenId())
                .tenantId(result.valid() ? result.tenant().tenantId() : null)
                .endpoint(request.endpoint())
                .outcome(result.outcome())
                .latency(outcome.latency())
                .path(outcome.path())
                .detail(result.valid() ? null : "tenantHint=" + request.tenantHint())
                .build());

        if (result.isCrossTenant() && context.crossTenantRecorded().compareAndSet(false, true)) {
            LOG.warnf("Cross-tenant attempt with token %s on %s", result.tokenId(), request.endpoint());
            audit.record(AuditEvent.builder(AuditEventType.CROSS_TENANT, clock.instant())
                    .tokenRef(result.tokenId())
                    .tenantId(request.tenantHint())
                    .endpoint(request.endpoint())
                    .outcome(result.outcome())
                    .latency(outcome.latency())
                    .path(outcome.path())
                    .detail("clientIp=" + request.clientIp() + " userAgent=" + request.userAgent())
                    .build());
        }
    }

    private Uni<ValidationResult> extendIfValid(ValidationResult result) {
        if (!result.valid()) {
            return Uni.createFrom().item(result);
        }
        return extensionManager
                .extendIfEligible(result.tokenId())
                .map(extended -> extended.map(token -> result.withExpiresAt(token.expiresAt()))
                        .orElse(result))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Token extension failed for %s: %s", result.tokenId(), e.getMessage());
                    return result;
                });
    }

    private ShadowComparison compare(RequestContext context, PathOutcome served, PathOutcome shadow) {
        var legacy = served.path() == ValidationPath.LEGACY ? served : shadow;
        var enhanced = served.path() == ValidationPath.ENHANCED ? served : shadow;
        var comparison = new ShadowComparison(legacy.conclusive(), enhanced.conclusive());

        if (comparison.discrepancy()) {
            var legacyResult = comparison.legacy().get();
            var enhancedResult = comparison.enhanced().get();
            long total = discrepancies.incrementAndGet();
            metrics.recordDiscrepancy(legacyResult.valid(), enhancedResult.valid());
            LOG.warnf(
                    "Validation discrepancy on %s: legacy=%s enhanced=%s (total: %d)",
                    context.request().endpoint(), legacyResult.outcome(), enhancedResult.outcome(), total);
            audit.record(AuditEvent.builder(AuditEventType.DISCREPANCY, clock.instant())
                    .tokenRef(legacyResult.tokenId() != null ? legacyResult.tokenId() : enhancedResult.tokenId())
                    .tenantId(context.request().tenantHint())
                    .endpoint(context.request().endpoint())
                    .outcome(served.path() == ValidationPath.LEGACY ? legacyResult.outcome() : enhancedResult.outcome())
                    .detail("legacy=" + legacyResult.outcome() + " enhanced=" + enhancedResult.outcome())
                    .build());
        }
        return comparison;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private record RequestContext(ValidationRequest request, RateLimitTicket ticket, AtomicBoolean crossTenantRecorded) {

        RequestContext(ValidationRequest request, RateLimitTicket ticket) {
            this(request, ticket, new AtomicBoolean(false));
        }
    }

    /**
     * What one path produced: a decision, a timeout, or nothing because it did not run.
     */
    private record PathOutcome(ValidationPath path, ValidationResult result, Duration latency, boolean timedOut) {

        static PathOutcome decided(ValidationPath path, ValidationResult result, Duration latency) {
            return new PathOutcome(path, result, latency, false);
        }

        static PathOutcome timedOut(ValidationPath path, Duration latency) {
            return new PathOutcome(path, null, latency, true);
        }

        static PathOutcome skipped(ValidationPath path) {
            return new PathOutcome(path, null, Duration.ZERO, false);
        }

        Optional<ValidationResult> conclusive() {
            return Optional.ofNullable(result);
        }

        ValidationResult servedResult() {
            return result != null ? result : ValidationResult.failure(path, FailureReason.VALIDATION_TIMEOUT);
        }
    }
}
