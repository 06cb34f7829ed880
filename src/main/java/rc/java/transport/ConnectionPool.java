package rc.java.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rc.core.clock.Clock;
import rc.core.error.PoolExhaustedException;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of reusable connections, keyed by target (scheme://host:port).
 *
 * Features:
 * - At most {@code maxPerHost} connections (leased + idle) per target
 * - Acquisition past the limit waits for a release, bounded by the caller's deadline
 * - Idle connections are validated before reuse: dead or idle past {@code idleTimeout} are discarded
 *   and replaced transparently, callers never receive a dead handle
 * - Most recently released connection is reused first, so cold ones age out
 * - Every acquire and release also sweeps all targets: idle connections past {@code idleTimeout} are closed
 *   and targets left with no connection are forgotten, so abandoned targets hold nothing open
 *
 * Thread-safety:
 * - One fair ReentrantLock per target; waiters are woken in arrival order
 * - Opening and closing connections happen outside the lock
 */
public final class ConnectionPool implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private static final long MAX_SWEEP_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final ConnectionFactory factory;
    private final Clock clock;
    private final int maxPerHost;
    private final long idleTimeoutNanos;
    private final long sweepIntervalNanos;
    private final AtomicLong lastSweepNanos;
    private final ConcurrentHashMap<String, HostPool> hosts = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * @param factory opens new connections
     * @param clock time source for deadlines and idle ageing
     * @param maxPerHost maximum live connections per target (must be > 0)
     * @param idleTimeoutNanos idle connections older than this are discarded instead of reused
     */
    public ConnectionPool(ConnectionFactory factory, Clock clock, int maxPerHost, long idleTimeoutNanos) {
        if (factory == null) throw new IllegalArgumentException("factory cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (maxPerHost <= 0) throw new IllegalArgumentException("maxPerHost must be > 0");
        if (idleTimeoutNanos <= 0) throw new IllegalArgumentException("idleTimeout must be > 0");
        this.factory = factory;
        this.clock = clock;
        this.maxPerHost = maxPerHost;
        this.idleTimeoutNanos = idleTimeoutNanos;
        this.sweepIntervalNanos = Math.min(idleTimeoutNanos, MAX_SWEEP_INTERVAL_NANOS);
        this.lastSweepNanos = new AtomicLong(clock.nowNanos());
    }

    /**
     * Leases a connection to the target, waiting for a free slot until {@code deadlineNanos}.
     *
     * @throws PoolExhaustedException if no slot frees up in time
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws IllegalStateException if the pool is closed
     */
    public PooledConnection acquire(String target, long deadlineNanos) throws InterruptedException {
        if (target == null) throw new IllegalArgumentException("target cannot be null");
        evictExpired();
        while (true) {
            // a null lease means the host pool was retired by a sweep in between; look it up again
            PooledConnection lease = hosts.computeIfAbsent(target, HostPool::new).acquire(deadlineNanos);
            if (lease != null) return lease;
        }
    }

    /**
     * Returns a leased handle. Broken or dead connections are closed and free their slot.
     */
    public void release(PooledConnection handle) {
        if (!handle.markReleased()) return;
        hosts.get(handle.target()).release(handle);
        evictExpired();
    }

    public int leased(String target) {
        HostPool host = hosts.get(target);
        return host == null ? 0 : host.leased();
    }

    public int idle(String target) {
        HostPool host = hosts.get(target);
        return host == null ? 0 : host.idleCount();
    }

    /**
     * Number of targets currently holding leased or idle connections.
     */
    public int trackedTargets() {
        return hosts.size();
    }

    public int maxPerHost() {
        return maxPerHost;
    }

    /**
     * Closes every idle connection. Leased connections are closed as they come back.
     */
    @Override
    public void close() {
        closed = true;
        for (HostPool host : hosts.values()) {
            host.shutdown();
        }
    }

    /**
     * Sweeps every target at most once per interval. Only one caller wins each interval.
     */
    private void evictExpired() {
        long now = clock.nowNanos();
        long last = lastSweepNanos.get();
        if (now - last < sweepIntervalNanos || !lastSweepNanos.compareAndSet(last, now)) return;
        for (HostPool host : hosts.values()) {
            host.evictExpired(now);
        }
    }

    private static void closeAll(List<Connection> connections) {
        for (Connection c : connections) {
            c.close();
        }
    }

    private record Idle(Connection connection, long releasedAtNanos) {
    }

    private final class HostPool {
        private final String target;
        private final ReentrantLock lock = new ReentrantLock(true);
        private final Condition slotFreed = lock.newCondition();
        private final Deque<Idle> idle = new ArrayDeque<>();
        private int open;
        private int waiting;
        private boolean retired;

        private HostPool(String target) {
            this.target = target;
        }

        private PooledConnection acquire(long deadlineNanos) throws InterruptedException {
            List<Connection> discarded = new ArrayList<>();
            lock.lock();
            try {
                while (true) {
                    if (closed) throw new IllegalStateException("connection pool closed");
                    if (retired) return null;

                    Idle candidate = idle.pollFirst();
                    if (candidate != null) {
                        if (reusable(candidate)) {
                            return new PooledConnection(ConnectionPool.this, target, candidate.connection());
                        }
                        discarded.add(candidate.connection());
                        open--;
                        continue;
                    }

                    if (open < maxPerHost) {
                        open++; // reserve the slot, the connection is opened outside the lock
                        break;
                    }

                    long remaining = deadlineNanos - clock.nowNanos();
                    if (remaining <= 0) {
                        throw new PoolExhaustedException(
                            "no connection to " + target + " available (max " + maxPerHost + " per host)");
                    }
                    waiting++;
                    try {
                        slotFreed.awaitNanos(remaining);
                    } finally {
                        waiting--;
                    }
                }
            } finally {
                lock.unlock();
                if (!discarded.isEmpty()) {
                    log.debug("Discarded {} stale connection(s) to {}", discarded.size(), target);
                    closeAll(discarded);
                }
            }

            try {
                Connection connection = factory.open(target);
                log.debug("Opened connection to {}", target);
                return new PooledConnection(ConnectionPool.this, target, connection);
            } catch (RuntimeException e) {
                freeSlot();
                throw e;
            }
        }

        private boolean reusable(Idle candidate) {
            return reusable(candidate, clock.nowNanos());
        }

        private boolean reusable(Idle candidate, long now) {
            if (!candidate.connection().isAlive()) return false;
            return now - candidate.releasedAtNanos() <= idleTimeoutNanos;
        }

        /**
         * Closes stale idle connections and retires this host pool once nothing is open or waiting.
         */
        private void evictExpired(long now) {
            List<Connection> expired = new ArrayList<>();
            lock.lock();
            try {
                Iterator<Idle> it = idle.iterator();
                while (it.hasNext()) {
                    Idle candidate = it.next();
                    if (!reusable(candidate, now)) {
                        it.remove();
                        expired.add(candidate.connection());
                        open--;
                    }
                }
                if (!expired.isEmpty()) slotFreed.signalAll();
                if (open == 0 && waiting == 0 && !retired) {
                    retired = true;
                    hosts.remove(target, this);
                }
            } finally {
                lock.unlock();
            }
            if (!expired.isEmpty()) {
                log.debug("Closed {} expired idle connection(s) to {}", expired.size(), target);
                closeAll(expired);
            }
        }

        private void release(PooledConnection handle) {
            Connection connection = handle.connection();
            boolean keep;
            lock.lock();
            try {
                keep = !closed && handle.isReusable();
                if (keep) {
                    idle.offerFirst(new Idle(connection, clock.nowNanos()));
                } else {
                    open--;
                }
                slotFreed.signal();
            } finally {
                lock.unlock();
            }
            if (!keep) {
                log.debug("Closing connection to {} on release", target);
                connection.close();
            }
        }

        private void freeSlot() {
            lock.lock();
            try {
                open--;
                slotFreed.signal();
            } finally {
                lock.unlock();
            }
        }

        private int leased() {
            lock.lock();
            try {
                return open - idle.size();
            } finally {
                lock.unlock();
            }
        }

        private int idleCount() {
            lock.lock();
            try {
                return idle.size();
            } finally {
                lock.unlock();
            }
        }

        private void shutdown() {
            List<Connection> toClose = new ArrayList<>();
            lock.lock();
            try {
                for (Idle i : idle) toClose.add(i.connection());
                open -= idle.size();
                idle.clear();
                slotFreed.signalAll();
            } finally {
                lock.unlock();
            }
            closeAll(toClose);
        }
    }
}
