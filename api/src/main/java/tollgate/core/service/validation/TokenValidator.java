package tollgate.core.service.validation;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.cache.TokenCacheLayer;
import tollgate.core.config.GatewayConfig;
import tollgate.core.model.audit.AuditEvent;
import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.model.risk.RiskSignals;
import tollgate.core.model.token.StoredToken;
import tollgate.core.model.token.TenantContext;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.model.validation.ValidationPath;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.model.validation.ValidationResult;
import tollgate.core.port.out.RateLimiter;
import tollgate.core.port.out.TenantDirectory;
import tollgate.core.service.audit.AuditLogger;
import tollgate.core.service.token.StoreUnavailableException;
import tollgate.core.service.token.TokenHasher;
import tollgate.core.service.token.TokenStoreService;

/**
 * The enhanced validation path.
 *
 * <p>Checks run in a fixed order, and the first failing check decides:
 * <ol>
 *   <li>format, then existence and revocation ({@code INVALID_TOKEN})</li>
 *   <li>tenant binding ({@code CROSS_TENANT_ATTEMPT})</li>
 *   <li>expiry, unless within the extension grace period ({@code EXPIRED_TOKEN})</li>
 *   <li>scope ({@code INSUFFICIENT_SCOPE})</li>
 *   <li>rate limit, consuming one request ({@code RATE_LIMIT_EXCEEDED})</li>
 * </ol>
 * Tenant binding is checked before expiry so a token presented against a
 * foreign tenant is always reported as a cross-tenant attempt.
 *
 * <p>Token lookups go through the validation cache. The permission and tenant
 * caches back the scope check and the tenant metadata of a valid result.
 */
@ApplicationScoped
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    private static final ValidationPath PATH = ValidationPath.ENHANCED;

    private final TokenHasher hasher;
    private final TokenStoreService store;
    private final TokenCacheLayer cache;
    private final TenantDirectory tenantDirectory;
    private final RateLimiter rateLimiter;
    private final RiskScorer riskScorer;
    private final TokenActivityTracker activity;
    private final ExtensionManager extensionManager;
    private final AuditLogger audit;
    private final GatewayConfig.RiskConfig riskConfig;
    private final Clock clock;

    @Inject
    public TokenValidator(
            TokenHasher hasher,
            TokenStoreService store,
            TokenCacheLayer cache,
            TenantDirectory tenantDirectory,
            RateLimiter rateLimiter,
            RiskScorer riskScorer,
            TokenActivityTracker activity,
            ExtensionManager extensionManager,
            AuditLogger audit,
            GatewayConfig config,
            Clock clock) {
        this.hasher = hasher;
        this.store = store;
        this.cache = cache;
        this.tenantDirectory = tenantDirectory;
        this.rateLimiter = rateLimiter;
        this.riskScorer = riskScorer;
        this.activity = activity;
        this.extensionManager = extensionManager;
        this.audit = audit;
        this.riskConfig = config.risk();
        this.clock = clock;
    }

    /**
     * Validate a request on the enhanced path.
     *
     * @param request the token and request context
     * @return Uni with the result; never fails for decision outcomes
     */
    public Uni<ValidationResult> validate(ValidationRequest request) {
        return validate(request, RateLimitTicket.forRequest(rateLimiter));
    }

    /**
     * Validate a request, counting it through a ticket shared with the other path.
     */
    public Uni<ValidationResult> validate(ValidationRequest request, RateLimitTicket ticket) {
        if (!hasher.isWellFormed(request.token())) {
            return Uni.createFrom().item(ValidationResult.failure(PATH, FailureReason.INVALID_TOKEN));
        }
        var tokenHash = hasher.hash(request.token());
        var scopeKey = request.scopeKey();

        return findToken(tokenHash, scopeKey)
                .flatMap(found -> found.isPresent()
                        ? decide(request, ticket, tokenHash, scopeKey, found.get())
                        : Uni.createFrom().item(ValidationResult.failure(PATH, FailureReason.INVALID_TOKEN)))
                .onFailure(StoreUnavailableException.class)
                .recoverWithItem(e -> {
                    LOG.warnf("Enhanced validation could not reach the token store: %s", e.getMessage());
                    return ValidationResult.failure(PATH, FailureReason.STORE_UNAVAILABLE);
                });
    }

    private Uni<Optional<StoredToken>> findToken(String tokenHash, String scopeKey) {
        var cached = cache.getValidation(tokenHash, scopeKey);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }
        long generation = cache.generation(tokenHash);
        return store.lookup(tokenHash).invoke(found -> found.filter(t -> !t.revoked())
                .ifPresent(t -> cache.putValidation(tokenHash, scopeKey, generation, t)));
    }

    private Uni<ValidationResult> decide(
            ValidationRequest request, RateLimitTicket ticket, String tokenHash, String scopeKey, StoredToken token) {
        var now = clock.instant();

        if (token.revoked()) {
            return failed(tokenHash, token, FailureReason.INVALID_TOKEN);
        }
        if (!token.tenantId().equals(request.tenantHint())) {
            LOG.debugf("Token %s presented against foreign tenant", token.id());
            return failed(tokenHash, token, FailureReason.CROSS_TENANT_ATTEMPT);
        }
        if (token.isExpired(now) && !extensionManager.isGraceEligible(token, now)) {
            return failed(tokenHash, token, FailureReason.EXPIRED_TOKEN);
        }
        if (!hasScopes(tokenHash, scopeKey, token, request)) {
            return failed(tokenHash, token, FailureReason.INSUFFICIENT_SCOPE);
        }

        return ticket.consume(token.id(), token.rateLimitPerHour()).flatMap(decision -> {
            if (!decision.allowed()) {
                LOG.debugf("Token %s exceeded %d requests per window", token.id(), decision.limit());
                return failed(tokenHash, token, FailureReason.RATE_LIMIT_EXCEEDED);
            }
            return resolveTenant(token.tenantId()).map(tenant -> accept(request, tokenHash, token, tenant, decision));
        });
    }

    private boolean hasScopes(String tokenHash, String scopeKey, StoredToken token, ValidationRequest request) {
        var cached = cache.getPermission(tokenHash, scopeKey);
        if (cached.isPresent()) {
            return cached.get();
        }
        long generation = cache.generation(tokenHash);
        boolean granted = token.grantsAll(request.requiredScopes());
        cache.putPermission(tokenHash, scopeKey, generation, granted);
        return granted;
    }

    private Uni<TenantContext> resolveTenant(String tenantId) {
        var cached = cache.getTenant(tenantId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }
        return tenantDirectory.findTenant(tenantId).map(found -> {
            // the result's tenant must be the token's own tenant, whatever the directory says
            var tenant = found.filter(t -> t.belongsTo(tenantId)).orElseGet(() -> TenantContext.of(tenantId));
            cache.putTenant(tenant);
            return tenant;
        });
    }

    private ValidationResult accept(
            ValidationRequest request,
            String tokenHash,
            StoredToken token,
            TenantContext tenant,
            RateLimitDecision decision) {
        var history = activity.signals(tokenHash, request.clientIp(), request.userAgent());
        double risk = riskScorer.score(new RiskSignals(
                request.clientIp(), request.userAgent(), decision.requestCount(), decision.limit(), history));
        activity.recordSuccess(tokenHash, request.clientIp(), request.userAgent());

        boolean stepUp = risk >= riskConfig.stepUpThreshold();
        if (risk >= riskConfig.elevatedThreshold()) {
            audit.record(AuditEvent.builder(AuditEventType.HIGH_RISK, clock.instant())
                    .tokenRef(token.id())
                    .tenantId(token.tenantId())
                    .endpoint(request.endpoint())
                    .outcome(stepUp ? "step_up_required" : "elevated")
                    .path(PATH)
                    .detail(String.format("risk=%.2f", risk))
                    .build());
        }

        return ValidationResult.valid(
                PATH, token.id(), tenant, token.scopes(), token.expiresAt(), decision.remaining(), risk, stepUp);
    }

    private Uni<ValidationResult> failed(String tokenHash, StoredToken token, FailureReason reason) {
        activity.recordFailure(tokenHash);
        return Uni.createFrom().item(ValidationResult.failure(PATH, reason, token.id()));
    }
}
