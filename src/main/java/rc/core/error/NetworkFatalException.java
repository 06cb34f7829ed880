package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

/**
 * A network failure that must not be retried: protocol violation, TLS failure or a request the transport rejects.
 */
public final class NetworkFatalException extends ApiException {

    public NetworkFatalException(String message, FailureClassification classification, int attempts,
            CanonicalBody errorBody, Throwable cause) {
        super(message, classification, attempts, errorBody, cause);
    }
}
