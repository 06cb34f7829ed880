package rc.core.model;

/**
 * Pure core contract: no I/O, no threads, never blocks.
 * Blocking and fairness are layered on top by the engine.
 */
public interface RateLimiter {
    RateLimitResult tryAcquire(int permits);

    /**
     * Returns permits that were granted but never used against the remote endpoint.
     * The token count stays capped at capacity.
     */
    void refund(int permits);

    long capacity();
}
