package tollgate.spi;

/**
 * Thrown by a token repository when the backing store cannot serve a request.
 *
 * <p>Treated as transient: callers retry with backoff before giving up.
 */
public class TokenStoreException extends RuntimeException {

    public TokenStoreException(String message) {
        super(message);
    }

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
