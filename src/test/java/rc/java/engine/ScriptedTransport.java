package rc.java.engine;

import rc.core.model.Request;
import rc.java.transport.Connection;
import rc.java.transport.ConnectionFactory;
import rc.java.transport.RawResponse;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory transport replaying a script of outcomes, one per send. The last step repeats once the
 * script runs out. Records every request it sees and the peak number of concurrent exchanges.
 */
final class ScriptedTransport implements ConnectionFactory {

    private final List<Function<Request, CompletableFuture<RawResponse>>> steps = new ArrayList<>();
    private final List<Request> requests = new ArrayList<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    static RawResponse response(int status, String contentType, String body, String... headerPairs) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        if (contentType != null) headers.put("Content-Type", List.of(contentType));
        for (int i = 0; i + 1 < headerPairs.length; i += 2) {
            headers.put(headerPairs[i], List.of(headerPairs[i + 1]));
        }
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return new RawResponse(status, headers, bytes);
    }

    ScriptedTransport respond(RawResponse response) {
        return step(r -> CompletableFuture.completedFuture(response));
    }

    ScriptedTransport respond(int status) {
        return respond(response(status, "application/json", status >= 400 ? "{\"status\":" + status + "}" : "{}"));
    }

    ScriptedTransport respondAfter(Duration delay, RawResponse response) {
        return step(r -> CompletableFuture.supplyAsync(() -> response,
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)));
    }

    ScriptedTransport fail(Throwable error) {
        return step(r -> CompletableFuture.failedFuture(error));
    }

    synchronized ScriptedTransport step(Function<Request, CompletableFuture<RawResponse>> step) {
        steps.add(step);
        return this;
    }

    /** Sends made so far. */
    synchronized int sends() {
        return requests.size();
    }

    synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    int opened() {
        return opened.get();
    }

    int peakInFlight() {
        return peakInFlight.get();
    }

    private synchronized Function<Request, CompletableFuture<RawResponse>> next(Request request) {
        if (steps.isEmpty()) throw new IllegalStateException("no scripted outcome");
        int index = Math.min(requests.size(), steps.size() - 1);
        requests.add(request);
        return steps.get(index);
    }

    @Override
    public Connection open(String target) {
        opened.incrementAndGet();
        return new Connection() {
            private volatile boolean alive = true;

            @Override
            public String target() {
                return target;
            }

            @Override
            public CompletableFuture<RawResponse> send(Request request, Duration timeout) {
                peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return next(request).apply(request)
                    .whenComplete((r, e) -> inFlight.decrementAndGet());
            }

            @Override
            public boolean isAlive() {
                return alive;
            }

            @Override
            public void close() {
                alive = false;
            }
        };
    }
}
