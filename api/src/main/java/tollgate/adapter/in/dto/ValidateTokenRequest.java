package tollgate.adapter.in.dto;

/**
 * DTO for validation requests.
 *
 * @param token         the presented token value
 * @param requiredScope scope the caller needs; several may be separated by spaces or commas
 * @param tenantHint    tenant the request is made against
 * @param endpoint      endpoint the request targets, for auditing
 */
public record ValidateTokenRequest(String token, String requiredScope, String tenantHint, String endpoint) {}
