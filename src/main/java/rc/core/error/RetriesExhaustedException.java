package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

/**
 * Every allowed attempt failed with a transient classification.
 */
public final class RetriesExhaustedException extends ApiException {

    public RetriesExhaustedException(String message, FailureClassification classification, int attempts,
            CanonicalBody errorBody, Throwable cause) {
        super(message, classification, attempts, errorBody, cause);
    }
}
