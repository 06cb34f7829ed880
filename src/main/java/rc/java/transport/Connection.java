package rc.java.transport;

import rc.core.model.Request;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A reusable transport link to one target (scheme, host, port).
 *
 * Implementations must not block in {@link #send}: the returned future completes when the response
 * has been read or the exchange failed. Cancelling the future abandons the exchange.
 */
public interface Connection {

    String target();

    /**
     * @param timeout upper bound for this exchange, from sending the request to reading the body
     */
    CompletableFuture<RawResponse> send(Request request, Duration timeout);

    /** Cheap liveness check used before handing the connection out again. Must not do I/O. */
    boolean isAlive();

    void close();
}
