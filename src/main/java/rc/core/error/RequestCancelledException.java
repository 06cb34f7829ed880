package rc.core.error;

/**
 * The caller cancelled the request (future cancellation or thread interrupt) before it completed.
 */
public final class RequestCancelledException extends ApiException {

    public RequestCancelledException(String message, int attempts, Throwable cause) {
        super(message, null, attempts, null, cause);
    }
}
