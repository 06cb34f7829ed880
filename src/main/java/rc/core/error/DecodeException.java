package rc.core.error;

import rc.core.model.FailureClassification;

/**
 * A successful response carried a body that does not parse as its declared content type.
 */
public final class DecodeException extends ApiException {

    public enum Kind {
        MALFORMED_JSON,
        MALFORMED_XML
    }

    private final Kind kind;

    public DecodeException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, 0, cause);
    }

    public DecodeException(Kind kind, String message, FailureClassification classification, int attempts,
                           Throwable cause) {
        super(message, classification, attempts, null, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /** Same failure, stamped with the attempt count and classification the executor observed. */
    public DecodeException withAttempts(FailureClassification classification, int attempts) {
        return new DecodeException(kind, getMessage(), classification, attempts, getCause());
    }
}
