package rc.core.error;

/**
 * A request in a batch died of an error outside the failure taxonomy, such as a closed connection
 * pool. The original error is the cause. Single requests propagate such errors unwrapped.
 */
public final class RequestFailedException extends ApiException {

    public RequestFailedException(String message, int attempts, Throwable cause) {
        super(message, null, attempts, null, cause);
    }
}
