package rc.core.model;

/**
 * Outcome classification for a failed attempt.
 *
 * @param kind TRANSIENT failures may be retried, FATAL ones never are
 * @param reason what went wrong
 * @param exposure how far the request got, which decides replay safety for non-idempotent requests
 * @param statusCode HTTP status when a response was received, otherwise 0
 * @param retryAfterNanos server back-off hint (Retry-After), 0 when absent
 */
public record FailureClassification(
    Kind kind,
    Reason reason,
    Exposure exposure,
    int statusCode,
    long retryAfterNanos
) {
    public enum Kind {
        TRANSIENT,
        FATAL
    }

    public enum Reason {
        TIMEOUT,
        CONNECTION_RESET,
        CONNECTION_REFUSED,
        SERVER_ERROR,
        TOO_MANY_REQUESTS,
        CLIENT_ERROR,
        UNEXPECTED_STATUS,
        PROTOCOL_VIOLATION,
        MALFORMED_REQUEST,
        DECODE_ERROR
    }

    public enum Exposure {
        /** Nothing reached the server, so nothing could have been mutated. */
        NOT_SENT,
        /** Bytes may have reached the server but no response came back. */
        AMBIGUOUS,
        /** The server answered. */
        RESPONDED
    }

    public FailureClassification {
        if (kind == null) throw new IllegalArgumentException("kind cannot be null");
        if (reason == null) throw new IllegalArgumentException("reason cannot be null");
        if (exposure == null) throw new IllegalArgumentException("exposure cannot be null");
        retryAfterNanos = Math.max(0L, retryAfterNanos);
    }

    public static FailureClassification transientNetwork(Reason reason, Exposure exposure) {
        return new FailureClassification(Kind.TRANSIENT, reason, exposure, 0, 0L);
    }

    public static FailureClassification fatalNetwork(Reason reason, Exposure exposure) {
        return new FailureClassification(Kind.FATAL, reason, exposure, 0, 0L);
    }

    public static FailureClassification decodeError(int statusCode) {
        return new FailureClassification(Kind.FATAL, Reason.DECODE_ERROR, Exposure.RESPONDED, statusCode, 0L);
    }

    /**
     * Classifies a non-2xx status: 5xx and 429 are transient, every other status is fatal.
     */
    public static FailureClassification forStatus(int statusCode, long retryAfterNanos) {
        if (statusCode == 429) {
            return new FailureClassification(
                Kind.TRANSIENT, Reason.TOO_MANY_REQUESTS, Exposure.RESPONDED, statusCode, retryAfterNanos);
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return new FailureClassification(
                Kind.TRANSIENT, Reason.SERVER_ERROR, Exposure.RESPONDED, statusCode, retryAfterNanos);
        }
        Reason reason = statusCode >= 400 && statusCode <= 499 ? Reason.CLIENT_ERROR : Reason.UNEXPECTED_STATUS;
        return new FailureClassification(Kind.FATAL, reason, Exposure.RESPONDED, statusCode, 0L);
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
