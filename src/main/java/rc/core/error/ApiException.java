package rc.core.error;

import rc.core.model.FailureClassification;
import rc.core.normalize.CanonicalBody;

import java.util.Optional;

/**
 * Root of every terminal failure the engine surfaces to callers.
 *
 * A caller receives exactly one of these per failed logical request. It carries everything known at
 * the time the request gave up: the last failure classification (absent when no attempt reached the
 * network), the number of attempts consumed, and the last normalized error body from the remote
 * service, if one was received.
 */
public abstract class ApiException extends RuntimeException {

    private final FailureClassification classification;
    private final int attempts;
    private final CanonicalBody errorBody;

    protected ApiException(String message, FailureClassification classification, int attempts,
            CanonicalBody errorBody, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.attempts = attempts;
        this.errorBody = errorBody;
    }

    public Optional<FailureClassification> classification() {
        return Optional.ofNullable(classification);
    }

    public int attempts() {
        return attempts;
    }

    public Optional<CanonicalBody> errorBody() {
        return Optional.ofNullable(errorBody);
    }

    /** HTTP status of the last response, 0 when none was received. */
    public int statusCode() {
        return classification == null ? 0 : classification.statusCode();
    }
}
