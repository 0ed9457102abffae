package tollgate.core.service.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.token.TokenIssueResult;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.model.validation.ValidationPath;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;
import tollgate.core.port.out.TokenRepository;
import tollgate.mock.GatewayFixture;
import tollgate.mock.TestGatewayConfig;
import tollgate.spi.TokenStoreException;

@DisplayName("TokenValidator")
class TokenValidatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private TestGatewayConfig config;
    private GatewayFixture fixture;
    private TokenIssueResult token;

    @BeforeEach
    void setUp() {
        config = new TestGatewayConfig();
        config.rateLimit.standardPerHour = 3;
        config.risk.elevatedThreshold = 0.6;
        config.risk.stepUpThreshold = 0.85;
        fixture = new GatewayFixture(config);
        token = fixture.issue("acme", Set.of("read", "write"), Duration.ofHours(24));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ValidationResult validate(ValidationRequest request) {
        return fixture.enhanced.validate(request).await().atMost(TIMEOUT);
    }

    private ValidationResult validate(String scope, String tenantHint) {
        return validate(GatewayFixture.request(token.tokenValue(), scope, tenantHint));
    }

    @Nested
    @DisplayName("Accepted tokens")
    class Accepted {

        @Test
        @DisplayName("should return tenant, scopes and remaining budget")
        void shouldReturnTenantAndScopes() {
            var result = validate("read", "acme");

            assertTrue(result.valid());
            assertEquals(ValidationPath.ENHANCED, result.path());
            assertEquals("acme", result.tenant().tenantId());
            assertEquals(Set.of("read", "write"), result.grantedScopes());
            assertEquals(2, result.rateLimitRemaining());
            assertEquals(token.expiresAt(), result.expiresAt());
            assertEquals(token.tokenId(), result.tokenId());
        }

        @Test
        @DisplayName("should accept a request that needs no scope")
        void shouldAcceptWithoutScope() {
            assertTrue(validate(null, "acme").valid());
        }

        @Test
        @DisplayName("should decide the same from cache as from the store")
        void shouldDecideSameFromCache() {
            var fromStore = validate("read", "acme");
            long hitsBefore = fixture.cache.hitCount();

            var fromCache = validate("read", "acme");

            assertTrue(fixture.cache.hitCount() > hitsBefore);
            assertEquals(fromStore.valid(), fromCache.valid());
            assertEquals(fromStore.tenant(), fromCache.tenant());
            assertEquals(fromStore.grantedScopes(), fromCache.grantedScopes());
            assertEquals(fromStore.expiresAt(), fromCache.expiresAt());
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class Rejected {

        @Test
        @DisplayName("should reject a token presented against another tenant")
        void shouldRejectCrossTenant() {
            var result = validate("read", "globex");

            assertFalse(result.valid());
            assertEquals(FailureReason.CROSS_TENANT_ATTEMPT, result.failureReason());
            assertNull(result.tenant());
            assertTrue(result.grantedScopes().isEmpty());
        }

        @Test
        @DisplayName("should treat a missing tenant hint as a cross-tenant attempt")
        void shouldRejectMissingTenantHint() {
            assertEquals(FailureReason.CROSS_TENANT_ATTEMPT, validate("read", null).failureReason());
        }

        @Test
        @DisplayName("should report cross-tenant before expiry")
        void shouldCheckTenantBeforeExpiry() {
            fixture.clock.advance(Duration.ofHours(25));

            assertEquals(FailureReason.CROSS_TENANT_ATTEMPT, validate("read", "globex").failureReason());
            assertEquals(FailureReason.EXPIRED_TOKEN, validate("read", "acme").failureReason());
        }

        @Test
        @DisplayName("should reject a scope the token was not granted")
        void shouldRejectMissingScope() {
            assertEquals(FailureReason.INSUFFICIENT_SCOPE, validate("read admin", "acme").failureReason());
        }

        @Test
        @DisplayName("should reject an unknown or malformed token as invalid")
        void shouldRejectUnknownToken() {
            var unknown = validate(GatewayFixture.request(fixture.hasher.generateValue(), "read", "acme"));
            var malformed = validate(GatewayFixture.request("Bearer abc", "read", "acme"));

            assertEquals(FailureReason.INVALID_TOKEN, unknown.failureReason());
            assertEquals(FailureReason.INVALID_TOKEN, malformed.failureReason());
        }

        @Test
        @DisplayName("should reject a token revoked after it was cached")
        void shouldRejectRevokedAfterCaching() {
            assertTrue(validate("read", "acme").valid());

            fixture.store.revoke(token.tokenId()).await().atMost(TIMEOUT);

            assertEquals(FailureReason.INVALID_TOKEN, validate("read", "acme").failureReason());
        }

        @Test
        @DisplayName("should reject the request after the limit is used up")
        void shouldEnforceRateLimit() {
            for (int i = 0; i < 3; i++) {
                assertTrue(validate("read", "acme").valid(), "request " + (i + 1));
            }

            assertEquals(FailureReason.RATE_LIMIT_EXCEEDED, validate("read", "acme").failureReason());
        }

        @Test
        @DisplayName("should not count rejected requests against the limit")
        void shouldNotCountRejectedRequests() {
            for (int i = 0; i < 5; i++) {
                validate("admin", "acme");
            }

            assertTrue(validate("read", "acme").valid());
        }
    }

    @Nested
    @DisplayName("Token store failures")
    class StoreFailures {

        @Test
        @DisplayName("should not consult the store for a malformed token")
        void shouldNotConsultStoreForMalformedToken() {
            var repository = mock(TokenRepository.class);
            try (var isolated = new GatewayFixture(new TestGatewayConfig(), repository)) {
                var result = isolated.enhanced
                        .validate(GatewayFixture.request("not-a-token", "read", "acme"))
                        .await()
                        .atMost(TIMEOUT);

                assertEquals(FailureReason.INVALID_TOKEN, result.failureReason());
                verifyNoInteractions(repository);
            }
        }

        @Test
        @DisplayName("should fail closed when the store stays unavailable")
        void shouldFailClosed() {
            var repository = mock(TokenRepository.class);
            when(repository.findByHash(anyString()))
                    .thenReturn(Uni.createFrom().failure(new TokenStoreException("down")));
            try (var isolated = new GatewayFixture(new TestGatewayConfig(), repository)) {
                var result = isolated.enhanced
                        .validate(GatewayFixture.request(isolated.hasher.generateValue(), "read", "acme"))
                        .await()
                        .atMost(TIMEOUT);

                assertFalse(result.valid());
                assertEquals(FailureReason.STORE_UNAVAILABLE, result.failureReason());
            }
        }
    }

    @Nested
    @DisplayName("Risk")
    class Risk {

        @Test
        @DisplayName("should score an ordinary first request as zero")
        void shouldScoreOrdinaryRequest() {
            var result = validate("read", "acme");

            assertEquals(0.0, result.riskScore(), 1e-9);
            assertFalse(result.stepUpRequired());
        }

        @Test
        @DisplayName("should audit an elevated score without asking for step-up")
        void shouldAuditElevatedRisk() {
            var request = ValidationRequest.of(
                    token.tokenValue(), "read", "acme", "203.0.113.7", "curl cross-tenant probe", "/api/reports");

            var result = validate(request);
            fixture.close();

            assertTrue(result.valid());
            assertFalse(result.stepUpRequired());
            var events = fixture.sink.events(AuditEventType.HIGH_RISK);
            assertEquals(1, events.size());
            assertEquals("elevated", events.get(0).outcome());
            assertEquals(token.tokenId(), events.get(0).tokenRef());
        }

        @Test
        @DisplayName("should ask for step-up above the step-up threshold")
        void shouldAskForStepUp() {
            var request = ValidationRequest.of(
                    token.tokenValue(), "read", "acme", null, "curl cross-tenant probe", "/api/reports");

            var result = validate(request);
            fixture.close();

            assertTrue(result.valid());
            assertTrue(result.stepUpRequired());
            assertEquals("step_up_required", fixture.sink.events(AuditEventType.HIGH_RISK).get(0).outcome());
        }
    }

    @Test
    @DisplayName("should accept an expired token inside the grace period")
    void shouldAcceptWithinGracePeriod() {
        config.extension.gracePeriod = Duration.ofHours(1);
        fixture.clock.advance(Duration.ofHours(24).plusMinutes(30));

        assertTrue(validate("read", "acme").valid());

        fixture.clock.advance(Duration.ofHours(1));
        assertEquals(FailureReason.EXPIRED_TOKEN, validate("read", "acme").failureReason());
    }
}
