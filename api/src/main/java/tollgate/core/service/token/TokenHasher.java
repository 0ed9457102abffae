package tollgate.core.service.token;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import tollgate.core.config.GatewayConfig;

/**
 * Generates token values and identifiers and computes the salted hash used
 * for lookup.
 *
 * <p>Token values look like {@code tg_prod_<43 Base64URL characters>}. The
 * hash is HMAC-SHA256 keyed with the configured server-side salt, hex encoded.
 */
@ApplicationScoped
public class TokenHasher {

    public static final String TOKEN_PREFIX = "tg_prod_";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int TOKEN_LENGTH_BYTES = 32;
    private static final int TOKEN_ID_LENGTH = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKeySpec key;

    @Inject
    public TokenHasher(GatewayConfig config) {
        this(config.store().hashSalt());
    }

    TokenHasher(String salt) {
        if (salt == null || salt.isBlank()) {
            throw new IllegalArgumentException("Token hash salt must be configured (tollgate.store.hash-salt)");
        }
        this.key = new SecretKeySpec(salt.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    /**
     * Generates a new token value.
     *
     * @return prefixed, Base64URL-encoded random value
     */
    public String generateValue() {
        byte[] bytes = new byte[TOKEN_LENGTH_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return TOKEN_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Generates a short random token ID for display, extension and revocation.
     *
     * @return 16-character hex string
     */
    public String generateId() {
        byte[] bytes = new byte[TOKEN_ID_LENGTH / 2];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Checks whether a presented value could be a token at all.
     */
    public boolean isWellFormed(String tokenValue) {
        return tokenValue != null
                && tokenValue.startsWith(TOKEN_PREFIX)
                && tokenValue.length() > TOKEN_PREFIX.length();
    }

    /**
     * Computes the salted hash of a token value.
     *
     * @param tokenValue the plaintext token
     * @return hex-encoded HMAC-SHA256
     */
    public String hash(String tokenValue) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            byte[] hashBytes = mac.doFinal(tokenValue.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }
}
