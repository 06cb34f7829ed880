package rc.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical request as submitted by plugin code. Immutable once built.
 *
 * @param method HTTP verb
 * @param uri absolute target URL (http or https)
 * @param headers header name to value, insertion-ordered
 * @param body raw payload bytes, empty when there is no body
 * @param contentType declared content type of the body, null when there is no body
 * @param idempotent whether the caller allows replay after ambiguous failures
 * @param timeout overall deadline budget for all attempts, null to use the executor default
 */
public record Request(
    HttpMethod method,
    URI uri,
    Map<String, String> headers,
    byte[] body,
    String contentType,
    boolean idempotent,
    Duration timeout
) {
    public Request {
        if (method == null) throw new IllegalArgumentException("method cannot be null");
        if (uri == null) throw new IllegalArgumentException("uri cannot be null");
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("uri must be absolute http(s), got: " + uri);
        }
        if (uri.getHost() == null) throw new IllegalArgumentException("uri has no host: " + uri);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        headers = headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public Optional<Duration> timeoutOverride() {
        return Optional.ofNullable(timeout);
    }

    /**
     * Key identifying the remote endpoint: scheme, host and effective port.
     * Rate limiting and connection pooling are scoped by this key.
     */
    public String target() {
        String scheme = uri.getScheme().toLowerCase();
        int port = uri.getPort();
        if (port < 0) port = scheme.equals("https") ? 443 : 80;
        return scheme + "://" + uri.getHost().toLowerCase() + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Request other)) return false;
        return idempotent == other.idempotent
            && method == other.method
            && uri.equals(other.uri)
            && headers.equals(other.headers)
            && Arrays.equals(body, other.body)
            && Objects.equals(contentType, other.contentType)
            && Objects.equals(timeout, other.timeout);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(method, uri, headers, contentType, idempotent, timeout);
        return 31 * h + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return method + " " + uri + " (" + body.length + " bytes, idempotent=" + idempotent + ")";
    }

    public static Builder builder(HttpMethod method, URI uri) {
        return new Builder(method, uri);
    }

    public static Builder get(String url) {
        return builder(HttpMethod.GET, URI.create(url));
    }

    public static Builder post(String url) {
        return builder(HttpMethod.POST, URI.create(url));
    }

    public static final class Builder {
        private final HttpMethod method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private String contentType;
        private Boolean idempotent;
        private Duration timeout;

        private Builder(HttpMethod method, URI uri) {
            this.method = method;
            this.uri = uri;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("header name cannot be blank");
            if (value == null) throw new IllegalArgumentException("header value cannot be null");
            headers.put(name, value);
            return this;
        }

        public Builder body(byte[] body, String contentType) {
            if (contentType == null || contentType.isBlank()) {
                throw new IllegalArgumentException("contentType cannot be blank when a body is set");
            }
            this.body = body;
            this.contentType = contentType;
            return this;
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Request build() {
            boolean replayable = idempotent != null
                ? idempotent
                : method != null && method.idempotentByDefault();
            return new Request(method, uri, headers, body, contentType, replayable, timeout);
        }
    }
}
