package rc.core.model;

/**
 * HTTP verbs the engine dispatches.
 * Each verb carries its conventional idempotency, used when a request does not state its own.
 */
public enum HttpMethod {
    GET(true),
    POST(false),
    PUT(true),
    PATCH(false),
    DELETE(true);

    private final boolean idempotent;

    HttpMethod(boolean idempotent) {
        this.idempotent = idempotent;
    }

    public boolean idempotentByDefault() {
        return idempotent;
    }
}
