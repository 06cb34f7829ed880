package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

/**
 * A network failure that would normally be retried but was surfaced, e.g. a non-idempotent request after an ambiguous send.
 */
public final class NetworkTransientException extends ApiException {

    public NetworkTransientException(String message, FailureClassification classification, int attempts,
            CanonicalBody errorBody, Throwable cause) {
        super(message, classification, attempts, errorBody, cause);
    }
}
