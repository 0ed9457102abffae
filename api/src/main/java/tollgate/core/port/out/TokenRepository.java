package tollgate.core.port.out;

import java.util.Optional;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.token.StoredToken;

/**
 * Port interface for storage of issued tokens.
 *
 * <p>Tokens are keyed both by id and by the salted hash of their value. A
 * failing backend signals {@link tollgate.spi.TokenStoreException} through the
 * returned {@link Uni}.
 */
public interface TokenRepository {

    /**
     * Save a newly issued token.
     *
     * @param token the token metadata to persist
     * @return Uni completing when the save is visible to lookups
     */
    Uni<Void> save(StoredToken token);

    /**
     * Find a token by its identifier.
     *
     * @param tokenId the token identifier
     * @return Uni with Optional containing the token if found
     */
    Uni<Optional<StoredToken>> findById(String tokenId);

    /**
     * Find a token by the hash of its value.
     *
     * @param tokenHash the salted hash of the token value
     * @return Uni with Optional containing the token if found
     */
    Uni<Optional<StoredToken>> findByHash(String tokenHash);

    /**
     * Atomically replace a token with the result of applying a change to it.
     *
     * <p>The change sees the latest stored version. Returning the same
     * instance leaves the token untouched.
     *
     * @param tokenId the token identifier
     * @param change  computes the new version from the current one
     * @return Uni with the stored version after the change, or empty if not found
     */
    Uni<Optional<StoredToken>> update(String tokenId, UnaryOperator<StoredToken> change);
}
