package tollgate.core.service.token;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.audit.AuditEvent;
import tollgate.core.model.audit.AuditEventType;
import tollgate.core.model.token.SecurityLevel;
import tollgate.core.model.token.TokenIssueResult;
import tollgate.core.port.in.TokenManagement;
import tollgate.core.service.audit.AuditLogger;
import tollgate.core.service.validation.ExtensionManager;

/**
 * Issue, extend and revoke tokens, with an audit record for each change.
 */
@ApplicationScoped
public class TokenManagementService implements TokenManagement {

    private final TokenStoreService store;
    private final ExtensionManager extensionManager;
    private final AuditLogger audit;
    private final Clock clock;

    @Inject
    public TokenManagementService(
            TokenStoreService store, ExtensionManager extensionManager, AuditLogger audit, Clock clock) {
        this.store = store;
        this.extensionManager = extensionManager;
        this.audit = audit;
        this.clock = clock;
    }

    @Override
    public Uni<TokenIssueResult> issue(String tenantId, Set<String> scopes, Duration ttl, SecurityLevel securityLevel) {
        return store.issue(tenantId, scopes, ttl, securityLevel).invoke(issued -> audit.record(
                AuditEvent.builder(AuditEventType.ISSUED, clock.instant())
                        .tokenRef(issued.tokenId())
                        .tenantId(tenantId)
                        .outcome("issued")
                        .detail("level=" + issued.metadata().securityLevel() + " expiresAt=" + issued.expiresAt())
                        .build()));
    }

    @Override
    public Uni<Boolean> extend(String tokenId) {
        return extensionManager.extend(tokenId);
    }

    @Override
    public Uni<Boolean> revoke(String tokenId) {
        return store.revoke(tokenId).invoke(revoked -> {
            if (revoked) {
                audit.record(AuditEvent.builder(AuditEventType.REVOKED, clock.instant())
                        .tokenRef(tokenId)
                        .outcome("revoked")
                        .build());
            }
        });
    }
}
