package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

/**
 * The server answered with a non-retryable status (4xx other than 429, or an unexpected 1xx/3xx).
 * The normalized error payload stays inspectable through {@link #errorBody()}.
 */
public final class HttpStatusException extends ApiException {

    public HttpStatusException(String message, FailureClassification classification, int attempts,
            CanonicalBody errorBody, Throwable cause) {
        super(message, classification, attempts, errorBody, cause);
    }
}
