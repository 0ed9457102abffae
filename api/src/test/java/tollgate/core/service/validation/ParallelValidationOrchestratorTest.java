package tollgate.core.service.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.audit.AuditSeverity;
import tollgate.core.model.token.StoredToken;
import tollgate.core.model.token.TenantContext;
import tollgate.core.model.token.TokenIssueResult;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.model.validation.ShadowComparison;
import tollgate.core.model.validation.ShadowValidation;
import tollgate.core.model.validation.ValidationPath;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;
import tollgate.mock.GatewayFixture;
import tollgate.mock.TestGatewayConfig;

@DisplayName("ParallelValidationOrchestrator")
class ParallelValidationOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TestGatewayConfig config;
    private GatewayFixture fixture;
    private TokenIssueResult token;

    @BeforeEach
    void setUp() {
        config = new TestGatewayConfig();
        config.middlewareBudgetMs = 2000;
        fixture = new GatewayFixture(config);
        token = fixture.issue("acme", Set.of("read"), Duration.ofHours(24));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ShadowValidation validate(ParallelValidationOrchestrator orchestrator, ValidationRequest request) {
        return orchestrator.validateWithComparison(request).await().atMost(TIMEOUT);
    }

    private ShadowValidation validate(String scope, String tenantHint) {
        return validate(fixture.orchestrator, GatewayFixture.request(token.tokenValue(), scope, tenantHint));
    }

    private static ShadowComparison comparison(ShadowValidation validation) throws Exception {
        return validation.comparison().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private double counter(String name, String... tags) {
        var search = fixture.registry.find(name).tags(tags).counter();
        return search == null ? 0.0 : search.count();
    }

    @Nested
    @DisplayName("Served path")
    class ServedPath {

        @Test
        @DisplayName("should serve the legacy decision in fail-safe mode")
        void shouldServeLegacyInFailSafeMode() throws Exception {
            var validation = validate("read", "acme");

            assertTrue(validation.served().valid());
            assertEquals(ValidationPath.LEGACY, validation.served().path());
            assertTrue(comparison(validation).conclusive());
        }

        @Test
        @DisplayName("should serve the enhanced decision when fail-safe mode is off")
        void shouldServeEnhancedWhenFailSafeOff() throws Exception {
            config.failSafeMode = false;

            var validation = validate("read", "acme");

            assertEquals(ValidationPath.ENHANCED, validation.served().path());
            assertTrue(comparison(validation).conclusive());
        }

        @Test
        @DisplayName("should run only the served path when parallel validation is off")
        void shouldSkipShadowWhenParallelOff() throws Exception {
            config.parallelValidation.enabled = false;

            var validation = validate("read", "acme");
            var comparison = comparison(validation);
            fixture.close();

            assertTrue(validation.served().valid());
            assertFalse(comparison.conclusive());
            assertTrue(comparison.enhanced().isEmpty());
            assertEquals(1, fixture.sink.events(AuditEventType.DECISION).size());
        }
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @Test
        @DisplayName("should audit a decision for each path")
        void shouldAuditBothDecisions() throws Exception {
            comparison(validate("read", "acme"));
            fixture.close();

            var decisions = fixture.sink.events(AuditEventType.DECISION);
            assertEquals(2, decisions.size());
            assertTrue(decisions.stream().anyMatch(e -> e.path() == ValidationPath.LEGACY));
            assertTrue(decisions.stream().anyMatch(e -> e.path() == ValidationPath.ENHANCED));
            assertEquals(1.0, counter("tollgate.validation.decisions", "path", "legacy", "outcome", "valid"));
            assertEquals(1.0, counter("tollgate.validation.decisions", "path", "enhanced", "outcome", "valid"));
        }

        @Test
        @DisplayName("should record a discrepancy when the paths disagree")
        void shouldRecordDiscrepancy() throws Exception {
            config.extension.gracePeriod = Duration.ofHours(1);
            fixture.clock.advance(Duration.ofHours(24).plusMinutes(10));

            var validation = validate("read", "acme");
            var comparison = comparison(validation);
            fixture.close();

            assertEquals(FailureReason.EXPIRED_TOKEN, validation.served().failureReason());
            assertTrue(comparison.discrepancy());
            assertEquals(1, fixture.orchestrator.discrepancyCount());
            assertEquals(1.0, counter("tollgate.validation.discrepancies", "legacy", "false", "enhanced", "true"));
            var events = fixture.sink.events(AuditEventType.DISCREPANCY);
            assertEquals(1, events.size());
            assertEquals(AuditSeverity.CRITICAL, events.get(0).severity());
        }

        @Test
        @DisplayName("should count each request once against the rate limit")
        void shouldCountRequestOnce() throws Exception {
            config.rateLimit.standardPerHour = 2;
            try (var limited = new GatewayFixture(config)) {
                var issued = limited.issue("acme", Set.of("read"), Duration.ofHours(24));
                var request = GatewayFixture.request(issued.tokenValue(), "read", "acme");

                var first = validate(limited.orchestrator, request);
                var second = validate(limited.orchestrator, request);
                var third = validate(limited.orchestrator, request);

                assertTrue(first.served().valid());
                assertTrue(second.served().valid());
                assertEquals(FailureReason.RATE_LIMIT_EXCEEDED, third.served().failureReason());
                assertFalse(comparison(first).discrepancy());
                assertFalse(comparison(second).discrepancy());
                assertFalse(comparison(third).discrepancy());
            }
        }
    }

    @Nested
    @DisplayName("Cross-tenant attempts")
    class CrossTenant {

        @Test
        @DisplayName("should emit exactly one cross-tenant event per request")
        void shouldEmitOneCrossTenantEvent() throws Exception {
            var validation = validate("read", "globex");
            var comparison = comparison(validation);
            fixture.close();

            assertTrue(comparison.legacy().orElseThrow().isCrossTenant());
            assertTrue(comparison.enhanced().orElseThrow().isCrossTenant());
            assertFalse(comparison.discrepancy());
            var events = fixture.sink.events(AuditEventType.CROSS_TENANT);
            assertEquals(1, events.size());
            assertEquals(AuditSeverity.CRITICAL, events.get(0).severity());
            assertEquals("globex", events.get(0).tenantId());
            assertEquals(token.tokenId(), events.get(0).tokenRef());
        }

        @Test
        @DisplayName("should never serve a tenant on a cross-tenant rejection")
        void shouldNotServeTenant() {
            config.failSafeMode = false;

            var served = validate("read", "globex").served();

            assertFalse(served.valid());
            assertEquals(null, served.tenant());
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        private final ValidationResult decided = ValidationResult.valid(
                ValidationPath.ENHANCED,
                "0123456789abcdef",
                TenantContext.of("acme"),
                Set.of("read"),
                GatewayFixture.T0.plus(Duration.ofHours(1)),
                10,
                0.0,
                false);

        private ParallelValidationOrchestrator orchestrator(Uni<ValidationResult> legacy, Uni<ValidationResult> enhanced) {
            var legacyValidator = mock(LegacyTokenValidator.class);
            var enhancedValidator = mock(TokenValidator.class);
            when(legacyValidator.validate(any(), any())).thenReturn(legacy);
            when(enhancedValidator.validate(any(), any())).thenReturn(enhanced);
            return new ParallelValidationOrchestrator(
                    legacyValidator,
                    enhancedValidator,
                    fixture.rateLimiter,
                    fixture.extensionManager,
                    fixture.audit,
                    fixture.metrics,
                    config,
                    fixture.clock);
        }

        @Test
        @DisplayName("should fail the request when the served path misses its budget")
        void shouldFailOnServedTimeout() throws Exception {
            config.middlewareBudgetMs = 50;
            var orchestrator = orchestrator(Uni.createFrom().nothing(), Uni.createFrom().item(decided));

            var validation = validate(orchestrator, GatewayFixture.request(token.tokenValue(), "read", "acme"));
            var comparison = comparison(validation);
            fixture.close();

            assertFalse(validation.served().valid());
            assertEquals(FailureReason.VALIDATION_TIMEOUT, validation.served().failureReason());
            assertFalse(comparison.conclusive());
            assertFalse(comparison.discrepancy());
            assertEquals(1, fixture.sink.events(AuditEventType.TIMEOUT).size());
            assertEquals(1.0, counter("tollgate.validation.timeouts", "path", "legacy"));
        }

        @Test
        @DisplayName("should leave a timed-out shadow out of the comparison")
        void shouldIgnoreShadowTimeout() throws Exception {
            config.timeoutMs = 50;
            var legacyResult = ValidationResult.failure(ValidationPath.LEGACY, FailureReason.EXPIRED_TOKEN);
            var orchestrator = orchestrator(Uni.createFrom().item(legacyResult), Uni.createFrom().nothing());

            var validation = validate(orchestrator, GatewayFixture.request(token.tokenValue(), "read", "acme"));
            var comparison = comparison(validation);
            fixture.close();

            assertEquals(FailureReason.EXPIRED_TOKEN, validation.served().failureReason());
            assertTrue(comparison.legacy().isPresent());
            assertTrue(comparison.enhanced().isEmpty());
            assertFalse(comparison.discrepancy());
            assertEquals(0, orchestrator.discrepancyCount());
            assertEquals(1.0, counter("tollgate.validation.timeouts", "path", "enhanced"));
        }
    }

    @Nested
    @DisplayName("Token lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should extend a token used shortly before expiry")
        void shouldExtendNearExpiry() throws Exception {
            fixture.clock.advance(Duration.ofHours(23).plusMinutes(50));

            var validation = validate("read", "acme");
            comparison(validation);
            fixture.close();

            assertTrue(validation.served().valid());
            assertEquals(1, fixture.sink.events(AuditEventType.EXTENDED).size());
            var stored = fixture.store.lookupById(token.tokenId()).await().atMost(TIMEOUT).orElseThrow();
            assertEquals(token.expiresAt().plus(Duration.ofHours(24)), stored.expiresAt());
            assertEquals(stored.expiresAt(), validation.served().expiresAt());
        }

        @Test
        @DisplayName("should serve the stored expiry when the token is not near expiry")
        void shouldServeUnchangedExpiry() {
            var validation = validate("read", "acme");

            assertEquals(token.expiresAt(), validation.served().expiresAt());
            assertEquals(0, fixture.sink.events(AuditEventType.EXTENDED).size());
        }

        @Test
        @DisplayName("should count the extension against the served budget")
        void shouldTimeOutSlowExtension() {
            var slowExtension = mock(ExtensionManager.class);
            when(slowExtension.extendIfEligible(any()))
                    .thenReturn(Uni.createFrom().item(Optional.<StoredToken>empty())
                            .onItem()
                            .delayIt()
                            .by(Duration.ofSeconds(2)));
            config.middlewareBudgetMs = 100;
            var orchestrator = fixture.orchestrator(slowExtension);

            var validation = validate(orchestrator, GatewayFixture.request(token.tokenValue(), "read", "acme"));

            assertEquals(FailureReason.VALIDATION_TIMEOUT, validation.served().failureReason());
        }

        @Test
        @DisplayName("should reject an unextended token after expiry")
        void shouldRejectAfterExpiry() throws Exception {
            fixture.clock.advance(Duration.ofHours(25));

            var validation = validate("read", "acme");

            assertEquals(FailureReason.EXPIRED_TOKEN, validation.served().failureReason());
            assertFalse(comparison(validation).discrepancy());
        }

        @Test
        @DisplayName("should reject another tenant whatever the expiry state")
        void shouldRejectOtherTenantAlways() {
            assertEquals(FailureReason.CROSS_TENANT_ATTEMPT, validate("read", "globex").served().failureReason());

            fixture.clock.advance(Duration.ofHours(25));

            assertEquals(FailureReason.CROSS_TENANT_ATTEMPT, validate("read", "globex").served().failureReason());
        }
    }
}
