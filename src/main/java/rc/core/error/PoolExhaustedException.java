package rc.core.error;

/**
 * Every connection slot for a host stayed leased until the wait bound expired.
 */
public final class PoolExhaustedException extends ApiException {

    public PoolExhaustedException(String message) {
        this(message, 0);
    }

    public PoolExhaustedException(String message, int attempts) {
        super(message, null, attempts, null, null);
    }
}
