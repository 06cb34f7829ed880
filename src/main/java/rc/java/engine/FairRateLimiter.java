package rc.java.engine;

import rc.core.clock.Clock;
import rc.core.error.RateLimitTimeoutException;
import rc.core.model.RateLimitResult;
import rc.core.model.RateLimiter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocking, first-come-first-served gate over a non-blocking {@link RateLimiter}.
 *
 * Waiters queue in arrival order and only the head of the queue may draw tokens, so a large or
 * early request is never starved by later arrivals. The head parks until the bucket reports enough
 * refill, the others park until the queue moves.
 *
 * Thread-safety:
 * - All state is guarded by one ReentrantLock; waiting releases it (Condition.awaitNanos)
 * - No I/O happens under the lock
 *
 * Parking is capped at {@link #MAX_PARK_NANOS} so a simulated clock advanced by another thread is
 * observed promptly.
 */
public final class FairRateLimiter {

    static final long MAX_PARK_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final RateLimiter bucket;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition queueMoved = lock.newCondition();
    private final Deque<Object> waiters = new ArrayDeque<>();

    public FairRateLimiter(RateLimiter bucket, Clock clock) {
        if (bucket == null) throw new IllegalArgumentException("bucket cannot be null");
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        this.bucket = bucket;
        this.clock = clock;
    }

    /**
     * Blocks until {@code cost} tokens are granted or the deadline passes.
     *
     * @param cost tokens to take (1..capacity)
     * @param deadlineNanos clock reading after which the caller gives up
     * @return the permit, its tokens already deducted
     * @throws RateLimitTimeoutException if the deadline passes first; no tokens are consumed
     * @throws InterruptedException if the waiting thread is interrupted; no tokens are consumed
     */
    public Permit acquire(int cost, long deadlineNanos) throws InterruptedException {
        if (cost <= 0) throw new IllegalArgumentException("cost must be > 0");
        if (cost > bucket.capacity()) {
            throw new IllegalArgumentException("cost " + cost + " exceeds capacity " + bucket.capacity());
        }

        Object ticket = new Object();
        lock.lockInterruptibly();
        try {
            waiters.addLast(ticket);
            try {
                while (true) {
                    long park = MAX_PARK_NANOS;
                    if (waiters.peekFirst() == ticket) {
                        RateLimitResult result = bucket.tryAcquire(cost);
                        if (result.allowed()) {
                            return new Permit(cost, clock.nowNanos());
                        }
                        park = Math.min(park, Math.max(1L, result.retryAfterNanos()));
                    }

                    long remaining = deadlineNanos - clock.nowNanos();
                    if (remaining <= 0) {
                        throw new RateLimitTimeoutException("no rate limit token within deadline (cost " + cost + ")");
                    }
                    queueMoved.awaitNanos(Math.min(park, remaining));
                }
            } finally {
                waiters.remove(ticket);
                queueMoved.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the tokens of a permit whose attempt never reached the remote endpoint.
     */
    public void release(Permit permit) {
        if (permit == null) throw new IllegalArgumentException("permit cannot be null");
        lock.lock();
        try {
            bucket.refund(permit.cost());
            queueMoved.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long capacity() {
        return bucket.capacity();
    }

    /** Number of callers currently queued. */
    public int queueLength() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }
}
