package tollgate.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tollgate.core.model.token.StoredToken;
import tollgate.mock.GatewayFixture;

@DisplayName("InMemoryTokenRepository")
class InMemoryTokenRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryTokenRepository repository;
    private StoredToken token;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTokenRepository();
        token = StoredToken.builder("0123456789abcdef", "hash1")
                .tenantId("acme")
                .scopes(Set.of("read"))
                .issuedAt(GatewayFixture.T0)
                .expiresAt(GatewayFixture.T0.plus(Duration.ofHours(1)))
                .rateLimitPerHour(1000)
                .build();
        repository.save(token).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should find a saved token by id and by hash")
    void shouldFindByIdAndHash() {
        assertEquals(token, repository.findById(token.id()).await().atMost(TIMEOUT).orElseThrow());
        assertEquals(token, repository.findByHash("hash1").await().atMost(TIMEOUT).orElseThrow());
        assertTrue(repository.findByHash("other").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("should make an update visible through both keys")
    void shouldUpdateBothKeys() {
        var revoked = repository
                .update(token.id(), t -> t.revoke(GatewayFixture.T0))
                .await()
                .atMost(TIMEOUT)
                .orElseThrow();

        assertTrue(revoked.revoked());
        assertTrue(repository.findByHash("hash1").await().atMost(TIMEOUT).orElseThrow().revoked());
        assertTrue(repository.findById(token.id()).await().atMost(TIMEOUT).orElseThrow().revoked());
    }

    @Test
    @DisplayName("should leave the token alone when the change returns it unchanged")
    void shouldKeepUnchangedToken() {
        var result = repository.update(token.id(), t -> t).await().atMost(TIMEOUT).orElseThrow();

        assertSame(token, result);
        assertEquals(1, repository.size());
    }

    @Test
    @DisplayName("should report a missing token as empty")
    void shouldReturnEmptyForMissingToken() {
        assertTrue(repository.update("missing", t -> t.revoke(GatewayFixture.T0)).await().atMost(TIMEOUT).isEmpty());
    }
}
