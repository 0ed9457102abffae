package tollgate.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.token.TenantContext;
import tollgate.core.port.out.TenantDirectory;

/**
 * In-memory implementation of TenantDirectory.
 */
@ApplicationScoped
public class InMemoryTenantDirectory implements TenantDirectory {

    private final ConcurrentHashMap<String, TenantContext> tenants = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<TenantContext>> findTenant(String tenantId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(tenants.get(tenantId)));
    }

    @Override
    public Uni<Void> register(TenantContext tenant) {
        return Uni.createFrom().item(() -> {
            tenants.putIfAbsent(tenant.tenantId(), tenant);
            return null;
        });
    }
}
