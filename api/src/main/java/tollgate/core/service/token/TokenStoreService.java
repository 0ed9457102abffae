package tollgate.core.service.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.cache.TokenCacheLayer;
import tollgate.core.config.GatewayConfig;
import tollgate.core.model.token.SecurityLevel;
import tollgate.core.model.token.StoredToken;
import tollgate.core.model.token.TenantContext;
import tollgate.core.model.token.TokenIssueResult;
import tollgate.core.port.out.TenantDirectory;
import tollgate.core.port.out.TokenRepository;
import tollgate.spi.TokenStoreException;

/**
 * Durable keyed access to token metadata.
 *
 * <p>Tokens are stored as salted hashes; the plaintext is only returned once
 * at issue. Every change to a stored token (revoke, expiry update) removes the
 * token's entries from the caches before the returned {@link Uni} completes.
 *
 * <p>Transient repository failures are retried with exponential backoff and
 * then surface as {@link StoreUnavailableException}.
 */
@ApplicationScoped
public class TokenStoreService {

    private static final Logger LOG = Logger.getLogger(TokenStoreService.class);

    private final TokenRepository repository;
    private final TenantDirectory tenantDirectory;
    private final TokenCacheLayer cache;
    private final TokenHasher hasher;
    private final GatewayConfig config;
    private final Clock clock;

    @Inject
    public TokenStoreService(
            TokenRepository repository,
            TenantDirectory tenantDirectory,
            TokenCacheLayer cache,
            TokenHasher hasher,
            GatewayConfig config,
            Clock clock) {
        this.repository = repository;
        this.tenantDirectory = tenantDirectory;
        this.cache = cache;
        this.hasher = hasher;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Issue a new token.
     *
     * @throws IllegalArgumentException if tenant, scopes or TTL are invalid
     */
    public Uni<TokenIssueResult> issue(String tenantId, Set<String> scopes, Duration ttl, SecurityLevel level) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or blank");
        }
        if (scopes == null || scopes.isEmpty()) {
            throw new IllegalArgumentException("At least one scope is required");
        }
        if (scopes.stream().anyMatch(s -> s == null || s.isBlank())) {
            throw new IllegalArgumentException("Scopes cannot be blank");
        }
        validateTtl(ttl);

        var securityLevel = level != null ? level : SecurityLevel.STANDARD;
        var tokenValue = hasher.generateValue();
        var tokenId = hasher.generateId();
        var now = clock.instant();

        var token = StoredToken.builder(tokenId, hasher.hash(tokenValue))
                .tenantId(tenantId)
                .scopes(scopes)
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .securityLevel(securityLevel)
                .rateLimitPerHour(rateLimitFor(securityLevel))
                .build();

        var tenant = TenantContext.of(tenantId);
        return withRetry(repository.save(token), "save")
                .call(() -> tenantDirectory.register(tenant))
                .invoke(() -> {
                    cache.putTenant(tenant);
                    LOG.infof("Issued token %s for tenant %s (expires: %s)", tokenId, tenantId, token.expiresAt());
                })
                .replaceWith(new TokenIssueResult(tokenValue, tokenId, token.expiresAt(), token));
    }

    /**
     * Look up a token by the hash of its value.
     */
    public Uni<Optional<StoredToken>> lookup(String tokenHash) {
        return withRetry(repository.findByHash(tokenHash), "lookup");
    }

    public Uni<Optional<StoredToken>> lookupById(String tokenId) {
        return withRetry(repository.findById(tokenId), "lookupById");
    }

    /**
     * Revoke a token and drop its cache entries.
     *
     * @return Uni with true if the token went from active to revoked
     */
    public Uni<Boolean> revoke(String tokenId) {
        var changed = new AtomicBoolean(false);
        var instant = clock.instant();
        return withRetry(
                        repository.update(tokenId, current -> {
                            if (current.revoked()) {
                                return current;
                            }
                            changed.set(true);
                            return current.revoke(instant);
                        }),
                        "revoke")
                .map(updated -> {
                    updated.ifPresent(t -> cache.invalidateToken(t.tokenHash()));
                    if (changed.get()) {
                        LOG.infof("Revoked token %s", tokenId);
                    }
                    return changed.get();
                });
    }

    /**
     * Move the expiry of a token, provided nobody else extended it first.
     *
     * <p>The update only applies if the stored extension count still equals
     * {@code expectedExtensionCount} and the token is not revoked.
     *
     * @return Uni with the updated token, or empty if the update did not apply
     */
    public Uni<Optional<StoredToken>> updateExpiry(String tokenId, int expectedExtensionCount, Instant newExpiry) {
        var changed = new AtomicBoolean(false);
        return withRetry(
                        repository.update(tokenId, current -> {
                            if (current.revoked() || current.extensionCount() != expectedExtensionCount) {
                                return current;
                            }
                            changed.set(true);
                            return current.extendTo(newExpiry);
                        }),
                        "updateExpiry")
                .map(updated -> {
                    if (!changed.get()) {
                        return Optional.<StoredToken>empty();
                    }
                    updated.ifPresent(t -> cache.invalidateToken(t.tokenHash()));
                    return updated;
                });
    }

    int rateLimitFor(SecurityLevel level) {
        var limits = config.rateLimit();
        switch (level) {
            case HIGH:
                return limits.highPerHour();
            case MEDIUM:
                return limits.mediumPerHour();
            default:
                return limits.standardPerHour();
        }
    }

    private <T> Uni<T> withRetry(Uni<T> operation, String name) {
        var retry = config.store().retry();
        var guarded = operation;
        if (retry.maxAttempts() > 1) {
            guarded = guarded.onFailure(TokenStoreException.class)
                    .invoke(e -> LOG.debugf("Token store %s failed, retrying: %s", name, e.getMessage()))
                    .onFailure(TokenStoreException.class)
                    .retry()
                    .withBackOff(retry.initialBackoff(), retry.maxBackoff())
                    .atMost(retry.maxAttempts() - 1);
        }
        return guarded.onFailure(TokenStoreException.class).transform(e -> {
            LOG.warnf("Token store %s failed after %d attempt(s): %s", name, retry.maxAttempts(), e.getMessage());
            return new StoreUnavailableException("Token store unavailable", e);
        });
    }

    /**
     * Validates the requested TTL against the configured maximum.
     *
     * @throws IllegalArgumentException if TTL is missing, not positive, or above the maximum
     */
    private void validateTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        config.store().maxTtl().ifPresent(maxTtl -> {
            if (ttl.compareTo(maxTtl) > 0) {
                throw new IllegalArgumentException(
                        "TTL exceeds maximum allowed. Requested: " + ttl + ", Maximum: " + maxTtl);
            }
        });
    }
}
