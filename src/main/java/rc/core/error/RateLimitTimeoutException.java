package rc.core.error;

/**
 * No rate-limit tokens became available before the wait bound expired. No tokens were consumed.
 */
public final class RateLimitTimeoutException extends ApiException {

    public RateLimitTimeoutException(String message) {
        this(message, 0);
    }

    public RateLimitTimeoutException(String message, int attempts) {
        super(message, null, attempts, null, null);
    }
}
