package tollgate.core.service.validation;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.ratelimit.RateLimitDecision;
import tollgate.core.port.out.RateLimiter;

/**
 * One request's claim on a token's rate-limit budget.
 *
 * <p>Both validation paths of a request consult the same ticket. Whichever
 * path gets there first counts the request; the other sees the same decision.
 * A request is therefore counted once, however many paths run.
 */
public final class RateLimitTicket {

    private final RateLimiter rateLimiter;
    private Uni<RateLimitDecision> decision;

    private RateLimitTicket(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public static RateLimitTicket forRequest(RateLimiter rateLimiter) {
        return new RateLimitTicket(rateLimiter);
    }

    /**
     * Count this request against a token's budget, at most once.
     *
     * @param tokenId the token being validated
     * @param limit   requests allowed per window
     * @return Uni with the decision for this request
     */
    public synchronized Uni<RateLimitDecision> consume(String tokenId, long limit) {
        if (decision == null) {
            decision = rateLimiter.checkAndConsume(tokenId, limit).memoize().indefinitely();
        }
        return decision;
    }
}
