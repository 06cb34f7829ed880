package rc.core.normalize;

/**
 * A decoded response. Non-2xx statuses are error results, but their body is kept so API specific
 * error payloads stay inspectable.
 */
public record NormalizedResponse(int statusCode, CanonicalBody body) {

    public NormalizedResponse {
        if (body == null) throw new IllegalArgumentException("body cannot be null");
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode <= 299;
    }

    public boolean isError() {
        return !isSuccess();
    }
}
