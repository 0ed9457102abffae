package tollgate.core.model.token;

/**
 * A tenant and the isolation boundary its data lives behind.
 *
 * @param tenantId          the tenant identifier
 * @param isolationBoundary marker of the boundary (e.g., "tenant:acme")
 */
public record TenantContext(String tenantId, String isolationBoundary) {

    private static final String BOUNDARY_PREFIX = "tenant:";

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be null or blank");
        }
        if (isolationBoundary == null || isolationBoundary.isBlank()) {
            isolationBoundary = BOUNDARY_PREFIX + tenantId;
        }
    }

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId, null);
    }

    /**
     * Checks whether this context belongs to the given tenant.
     *
     * @param otherTenantId the tenant to compare with
     * @return true if the tenant ids are equal
     */
    public boolean belongsTo(String otherTenantId) {
        return tenantId.equals(otherTenantId);
    }
}
