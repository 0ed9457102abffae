package tollgate.core.service.token;

/**
 * The token store could not be reached after retrying.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
