package tollgate.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import tollgate.adapter.in.dto.ErrorResponse;
import tollgate.core.model.validation.FailureReason;
import tollgate.core.service.error.ErrorTranslator;
import tollgate.core.service.token.StoreUnavailableException;

/**
 * Global exception mappers for converting exceptions to error responses.
 *
 * <p>These mappers prevent internal exceptions from returning 500 Internal
 * Server Error when a more appropriate status code should be used, and keep
 * exception messages from store failures away from callers.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    private final ErrorTranslator translator;

    public GlobalExceptionMappers(ErrorTranslator translator) {
        this.translator = translator;
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.badRequest(e.getMessage()))
                .build();
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(StoreUnavailableException e) {
        LOG.warnv("Token store unavailable: {0}", e.getMessage());
        var translated = translator.translate(FailureReason.STORE_UNAVAILABLE);
        return Response.status(translated.httpStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.from(translated))
                .build();
    }
}
