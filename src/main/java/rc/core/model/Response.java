package rc.core.model;

import rc.core.normalize.CanonicalBody;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Successful outcome of a logical request. Owned by the caller after return.
 *
 * @param statusCode 2xx status of the final attempt
 * @param headers response headers of the final attempt
 * @param body normalized payload
 * @param attempts network attempts consumed, including the successful one
 */
public record Response(
    int statusCode,
    Map<String, List<String>> headers,
    CanonicalBody body,
    int attempts
) {
    public Response {
        if (body == null) throw new IllegalArgumentException("body cannot be null");
        if (attempts < 1) throw new IllegalArgumentException("attempts must be >= 1");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (headers != null) headers.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        headers = Collections.unmodifiableMap(copy);
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
