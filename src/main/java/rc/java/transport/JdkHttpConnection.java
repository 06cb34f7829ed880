package rc.java.transport;

import rc.core.model.Request;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Connection} backed by a dedicated HTTP/1.1 {@link HttpClient}.
 *
 * Each instance owns one client, so requests sent through it sequentially reuse the same keep-alive
 * socket. Redirects are not followed; a 3xx is reported to the caller as-is.
 */
public final class JdkHttpConnection implements Connection {

    // managed by HttpClient itself, setting them throws IllegalArgumentException
    private static final Set<String> RESTRICTED_HEADERS = restrictedHeaders();

    private final String target;
    private volatile HttpClient client;

    public JdkHttpConnection(String target, Duration connectTimeout) {
        if (target == null) throw new IllegalArgumentException("target cannot be null");
        if (connectTimeout == null) throw new IllegalArgumentException("connectTimeout cannot be null");
        this.target = target;
        this.client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public CompletableFuture<RawResponse> send(Request request, Duration timeout) {
        HttpClient current = client;
        if (current == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("connection closed: " + target));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request, timeout);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return current.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
            .thenApply(r -> new RawResponse(r.statusCode(), r.headers().map(), r.body()));
    }

    @Override
    public boolean isAlive() {
        return client != null;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; dropping the reference lets its selector thread exit
        client = null;
    }

    static HttpRequest toHttpRequest(Request request, Duration timeout) {
        HttpRequest.BodyPublisher publisher = request.hasBody()
            ? HttpRequest.BodyPublishers.ofByteArray(request.body())
            : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
            .method(request.method().name(), publisher)
            .timeout(timeout);

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey())) continue;
            if (request.hasBody() && header.getKey().equalsIgnoreCase("Content-Type")) continue;
            builder.header(header.getKey(), header.getValue());
        }
        if (request.hasBody()) {
            builder.header("Content-Type", request.contentType());
        }
        return builder.build();
    }

    private static Set<String> restrictedHeaders() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(Set.of("Connection", "Content-Length", "Expect", "Host", "Upgrade"));
        return names;
    }
}
