package rc.core.algorithms.token_bucket;

import rc.core.clock.Clock;
import rc.core.model.RateLimitResult;
import rc.core.model.RateLimiter;

/**
 * Token Bucket:
 * - capacity: max tokens held, also the initial fill
 * - refillTokensPerSecond: continuous refill, computed lazily from elapsed time (no timer thread)
 *
 * Invariant: 0 <= tokens <= capacity at every observation.
 *
 * Thread-safety: synchronized, callers may share one instance.
 */
public final class TokenBucket implements RateLimiter {
    private final Clock clock;
    private final long capacity;
    private final double refillPerNanos;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, long capacity, double refillTokensPerSecond) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillTokensPerSecond <= 0) throw new IllegalArgumentException("refill <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerNanos = refillTokensPerSecond / 1_000_000_000d;
        this.tokens = capacity;
        this.lastNanos = clock.nowNanos();
    }

    @Override
    public synchronized RateLimitResult tryAcquire(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        // a request larger than the bucket would wait forever
        if (permits > capacity) throw new IllegalArgumentException("permits > capacity");
        refill();

        if (tokens >= permits) {
            tokens -= permits;
            return RateLimitResult.allow();
        }

        double missing = permits - tokens;
        long retryAfter = (long) Math.ceil(missing / refillPerNanos);
        return RateLimitResult.reject(retryAfter);
    }

    @Override
    public synchronized void refund(int permits) {
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        refill();
        tokens = Math.min(capacity, tokens + permits);
    }

    @Override
    public long capacity() {
        return capacity;
    }

    /** Current token count after lazy refill. */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillPerNanos);
        lastNanos = now;
    }
}
