package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

/**
 * The logical request ran out of its deadline, either while suspended or because the next attempt
 * could not start in time. The last attempt's failure, if any, is kept for diagnosis.
 */
public final class DeadlineExceededException extends ApiException {

    public DeadlineExceededException(String message, FailureClassification lastFailure, int attempts,
                                     CanonicalBody errorBody) {
        super(message, lastFailure, attempts, errorBody, null);
    }
}
