package rc.java.transport;

import rc.core.model.Request;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leased handle on a pooled {@link Connection}. Closing the handle returns it to the pool, so it can
 * be scoped with try-with-resources. Releasing twice is a no-op.
 */
public final class PooledConnection implements AutoCloseable {

    private final ConnectionPool pool;
    private final String target;
    private final Connection connection;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean invalid;

    PooledConnection(ConnectionPool pool, String target, Connection connection) {
        this.pool = pool;
        this.target = target;
        this.connection = connection;
    }

    public CompletableFuture<RawResponse> send(Request request, Duration timeout) {
        if (released.get()) throw new IllegalStateException("handle already released");
        return connection.send(request, timeout);
    }

    public String target() {
        return target;
    }

    /** Marks the underlying connection broken; it is closed instead of pooled on release. */
    public void invalidate() {
        invalid = true;
    }

    boolean isReusable() {
        return !invalid && connection.isAlive();
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    Connection connection() {
        return connection;
    }

    @Override
    public void close() {
        pool.release(this);
    }
}
