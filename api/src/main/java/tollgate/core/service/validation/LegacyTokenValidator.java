package tollgate.core.service.validation;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.model.token.StoredToken;
import tollgate.core.model.token.TenantContext;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.model.validation.ValidationPath;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;
import tollgate.core.port.out.RateLimiter;
import tollgate.core.service.token.StoreUnavailableException;
import tollgate.core.service.token.TokenHasher;
import tollgate.core.service.token.TokenStoreService;

/**
 * The legacy validation path: a direct store lookup followed by tenant,
 * expiry, scope and rate-limit checks.
 *
 * <p>No caches, no risk scoring and no extension.
 */
@ApplicationScoped
public class LegacyTokenValidator {

    private static final Logger LOG = Logger.getLogger(LegacyTokenValidator.class);

    private static final ValidationPath PATH = ValidationPath.LEGACY;

    private final TokenHasher hasher;
    private final TokenStoreService store;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    @Inject
    public LegacyTokenValidator(TokenHasher hasher, TokenStoreService store, RateLimiter rateLimiter, Clock clock) {
        this.hasher = hasher;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    public Uni<ValidationResult> validate(ValidationRequest request) {
        return validate(request, RateLimitTicket.forRequest(rateLimiter));
    }

    public Uni<ValidationResult> validate(ValidationRequest request, RateLimitTicket ticket) {
        if (!hasher.isWellFormed(request.token())) {
            return Uni.createFrom().item(ValidationResult.failure(PATH, FailureReason.INVALID_TOKEN));
        }
        return store.lookup(hasher.hash(request.token()))
                .flatMap(found -> found.filter(t -> !t.revoked())
                        .map(t -> decide(request, ticket, t))
                        .orElseGet(() -> invalid()))
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(e -> {
                    LOG.warnf("Legacy validation could not reach the token store: %s", e.getMessage());
                    return ValidationResult.failure(PATH, FailureReason.STORE_UNAVAILABLE);
                });
    }

    private static Uni<ValidationResult> invalid() {
        return Uni.createFrom().item(ValidationResult.failure(PATH, FailureReason.INVALID_TOKEN));
    }

    private Uni<ValidationResult> decide(ValidationRequest request, RateLimitTicket ticket, StoredToken token) {
        if (!token.tenantId().equals(request.tenantHint())) {
            return rejected(token, FailureReason.CROSS_TENANT_ATTEMPT);
        }
        if (token.isExpired(clock.instant())) {
            return rejected(token, FailureReason.EXPIRED_TOKEN);
        }
        if (!token.grantsAll(request.requiredScopes())) {
            return rejected(token, FailureReason.INSUFFICIENT_SCOPE);
        }
        return ticket.consume(token.id(), token.rateLimitPerHour()).map(decision -> decision.allowed()
                ? ValidationResult.valid(
                        PATH,
                        token.id(),
                        TenantContext.of(token.tenantId()),
                        token.scopes(),
                        token.expiresAt(),
                        decision.remaining(),
                        0.0,
                        false)
                : ValidationResult.failure(PATH, FailureReason.RATE_LIMIT_EXCEEDED, token.id()));
    }

    private static Uni<ValidationResult> rejected(StoredToken token, FailureReason reason) {
        return Uni.createFrom().item(ValidationResult.failure(PATH, reason, token.id()));
    }
}
