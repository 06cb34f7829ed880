package rc.core.retry;

import rc.core.model.FailureClassification;

/**
 * Per logical request retry bookkeeping. Created fresh for each request, discarded on completion.
 *
 * @param attempt number of attempts made so far (1 after the first attempt)
 * @param elapsedNanos time since the logical request started
 * @param lastFailure classification of the most recent attempt
 * @param idempotent whether the request allows replay after ambiguous failures
 */
public record RetryContext(
    int attempt,
    long elapsedNanos,
    FailureClassification lastFailure,
    boolean idempotent
) {
    public RetryContext {
        if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        if (elapsedNanos < 0) throw new IllegalArgumentException("elapsedNanos < 0");
        if (lastFailure == null) throw new IllegalArgumentException("lastFailure cannot be null");
    }
}
