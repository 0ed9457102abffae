package tollgate.core.service.validation;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tollgate.core.config.GatewayConfig;
import tollgate.core.model.audit.AuditEvent;
import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.token.StoredToken;
import tollgate.core.port.out.ValidationMetrics;
import tollgate.core.service.audit.AuditLogger;
import tollgate.core.service.token.TokenStoreService;

/**
 * Pushes the expiry of tokens in active use forward.
 *
 * <p>A token is extended when it is close to expiry and still has extensions
 * left. Extension only moves the expiry; tenant and scopes never change.
 * Concurrent extensions of one token collapse into one, since the store only
 * applies an expiry update whose expected extension count still matches.
 */
@ApplicationScoped
public class ExtensionManager {

    private static final Logger LOG = Logger.getLogger(ExtensionManager.class);

    private final TokenStoreService store;
    private final AuditLogger audit;
    private final ValidationMetrics metrics;
    private final GatewayConfig.ExtensionConfig config;
    private final Clock clock;

    @Inject
    public ExtensionManager(
            TokenStoreService store,
            AuditLogger audit,
            ValidationMetrics metrics,
            GatewayConfig config,
            Clock clock) {
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.config = config.extension();
        this.clock = clock;
    }

    /**
     * Checks whether a token qualifies for automatic extension.
     *
     * @param token the stored token
     * @param now   the current instant
     * @return true if remaining lifetime is below the threshold and extensions are left
     */
    public boolean isEligible(StoredToken token, Instant now) {
        if (!config.enabled() || token.revoked() || token.extensionCount() >= config.maxCount()) {
            return false;
        }
        if (token.isExpired(now)) {
            return withinGrace(token, now);
        }
        return token.remainingTtl(now).compareTo(config.threshold()) < 0;
    }

    /**
     * Checks whether an expired token may still be extended.
     */
    public boolean isGraceEligible(StoredToken token, Instant now) {
        return config.enabled()
                && !token.revoked()
                && token.isExpired(now)
                && token.extensionCount() < config.maxCount()
                && withinGrace(token, now);
    }

    /**
     * Extend a token if it qualifies.
     *
     * @param tokenId the token identifier
     * @return Uni with the extended token, or empty if it did not qualify or lost a race
     */
    public Uni<Optional<StoredToken>> extendIfEligible(String tokenId) {
        if (!config.enabled()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return store.lookupById(tokenId).flatMap(found -> {
            if (found.isEmpty() || !isEligible(found.get(), clock.instant())) {
                return Uni.createFrom().item(Optional.<StoredToken>empty());
            }
            return apply(found.get(), "automatic");
        });
    }

    /**
     * Extend a token regardless of its remaining lifetime.
     *
     * @param tokenId the token identifier
     * @return Uni with true if extended, false if unknown, revoked or at the extension limit
     */
    public Uni<Boolean> extend(String tokenId) {
        return store.lookupById(tokenId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            var token = found.get();
            if (token.revoked() || token.extensionCount() >= config.maxCount()) {
                LOG.debugf(
                        "Token %s not extended (revoked: %s, extensions: %d)",
                        tokenId, token.revoked(), token.extensionCount());
                return Uni.createFrom().item(false);
            }
            return apply(token, "explicit").map(Optional::isPresent);
        });
    }

    private Uni<Optional<StoredToken>> apply(StoredToken token, String trigger) {
        var newExpiry = token.expiresAt().plus(config.increment());
        return store.updateExpiry(token.id(), token.extensionCount(), newExpiry).map(updated -> {
            if (updated.isEmpty()) {
                return updated;
            }
            var extended = updated.get();
            metrics.recordExtension();
            audit.record(AuditEvent.builder(AuditEventType.EXTENDED, clock.instant())
                    .tokenRef(extended.id())
                    .tenantId(extended.tenantId())
                    .outcome("extended")
                    .detail(trigger + " extension " + extended.extensionCount() + " to " + extended.expiresAt())
                    .build());
            LOG.debugf("Extended token %s to %s (%s)", extended.id(), extended.expiresAt(), trigger);
            return updated;
        });
    }

    private boolean withinGrace(StoredToken token, Instant now) {
        return !config.gracePeriod().isZero()
                && now.isBefore(token.expiresAt().plus(config.gracePeriod()));
    }
}
