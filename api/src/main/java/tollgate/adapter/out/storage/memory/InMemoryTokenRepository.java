package tollgate.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import tollgate.core.model.token.StoredToken;
import tollgate.core.port.out.TokenRepository;

/**
 * In-memory implementation of TokenRepository.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, testing
 * and single-instance deployments.
 *
 * <p>Thread-safety: writes go through one lock so the by-id and by-hash maps
 * always agree, and so {@link #update} is atomic with respect to other writes.
 */
@ApplicationScoped
public class InMemoryTokenRepository implements TokenRepository {

    private final ConcurrentHashMap<String, StoredToken> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StoredToken> storageByHash = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Void> save(StoredToken token) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                storageById.put(token.id(), token);
                storageByHash.put(token.tokenHash(), token);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<StoredToken>> findById(String tokenId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(tokenId)));
    }

    @Override
    public Uni<Optional<StoredToken>> findByHash(String tokenHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageByHash.get(tokenHash)));
    }

    @Override
    public Uni<Optional<StoredToken>> update(String tokenId, UnaryOperator<StoredToken> change) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var current = storageById.get(tokenId);
                if (current == null) {
                    return Optional.<StoredToken>empty();
                }
                var updated = change.apply(current);
                if (updated != current) {
                    storageById.put(updated.id(), updated);
                    storageByHash.put(updated.tokenHash(), updated);
                }
                return Optional.of(updated);
            }
        });
    }

    public int size() {
        return storageById.size();
    }
}
