package tollgate.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.token.TenantContext;

/**
 * Port interface for tenant metadata.
 */
public interface TenantDirectory {

    /**
     * Find a tenant by its identifier.
     *
     * @param tenantId the tenant identifier
     * @return Uni with Optional containing the tenant if registered
     */
    Uni<Optional<TenantContext>> findTenant(String tenantId);

    /**
     * Register a tenant. Registering an existing tenant is a no-op.
     *
     * @param tenant the tenant to register
     * @return Uni completing when registered
     */
    Uni<Void> register(TenantContext tenant);
}
