package tollgate.adapter.in.rest;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import tollgate.adapter.in.dto.ErrorResponse;
import tollgate.adapter.in.dto.ExtendTokenResponse;
import tollgate.adapter.in.dto.IssueTokenRequest;
import tollgate.adapter.in.dto.IssueTokenResponse;
import tollgate.adapter.in.dto.ValidateTokenRequest;
import tollgate.adapter.in.dto.ValidationResponse;
import tollgate.core.model.validation.ValidationRequest;
import tollgate.core.port.in.TokenManagement;
import tollgate.core.port.in.TokenValidationUseCase;
import tollgate.core.service.error.ErrorTranslator;

/**
 * REST resource for token issue, extension, revocation and validation.
 *
 * <p>Rejected validations are answered with the translated error and its
 * status code; the internal failure reason never reaches the caller.
 */
@Path("/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TokenResource {

    private final TokenManagement tokenManagement;
    private final TokenValidationUseCase validation;
    private final ErrorTranslator errorTranslator;

    @Inject
    public TokenResource(
            TokenManagement tokenManagement, TokenValidationUseCase validation, ErrorTranslator errorTranslator) {
        this.tokenManagement = tokenManagement;
        this.validation = validation;
        this.errorTranslator = errorTranslator;
    }

    /**
     * Issue a new token.
     *
     * <p>The token value is only returned in the response to this request.
     * It cannot be retrieved later - only the hash is stored.
     */
    @POST
    public Uni<Response> issue(IssueTokenRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.ttlSeconds() == null) {
            throw new IllegalArgumentException("ttlSeconds is required");
        }

        return tokenManagement
                .issue(
                        request.tenantId(),
                        request.scopes(),
                        Duration.ofSeconds(request.ttlSeconds()),
                        request.securityLevel())
                .map(result -> Response.status(Response.Status.CREATED)
                        .entity(new IssueTokenResponse(result.tokenValue(), result.tokenId(), result.expiresAt()))
                        .build());
    }

    /**
     * Push a token's expiry forward by the configured increment.
     */
    @POST
    @Path("/{tokenId}/extend")
    public Uni<ExtendTokenResponse> extend(@PathParam("tokenId") String tokenId) {
        return tokenManagement.extend(tokenId).map(extended -> new ExtendTokenResponse(tokenId, extended));
    }

    /**
     * Revoke a token. Cached validations of the token are dropped immediately.
     */
    @DELETE
    @Path("/{tokenId}")
    public Uni<Response> revoke(@PathParam("tokenId") String tokenId) {
        return tokenManagement.revoke(tokenId).map(revoked -> revoked
                ? Response.noContent().build()
                : Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("Token not found or already revoked"))
                        .build());
    }

    /**
     * Validate a token for a tenant and scope.
     *
     * <p>The client IP is taken from the first {@code X-Forwarded-For} entry.
     */
    @POST
    @Path("/validate")
    public Uni<Response> validate(
            ValidateTokenRequest request,
            @HeaderParam("X-Forwarded-For") String forwardedFor,
            @HeaderParam("User-Agent") String userAgent) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }

        var validationRequest = ValidationRequest.of(
                request.token(),
                request.requiredScope(),
                request.tenantHint(),
                clientIp(forwardedFor),
                userAgent,
                request.endpoint());

        return validation.validate(validationRequest).map(result -> {
            if (result.valid()) {
                return Response.ok(ValidationResponse.from(result)).build();
            }
            var error = errorTranslator.translate(result.failureReason());
            return Response.status(error.httpStatus())
                    .entity(ErrorResponse.from(error))
                    .build();
        });
    }

    static String clientIp(String forwardedFor) {
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return null;
        }
        var first = forwardedFor.split(",", 2)[0].trim();
        return first.isEmpty() ? null : first;
    }
}
