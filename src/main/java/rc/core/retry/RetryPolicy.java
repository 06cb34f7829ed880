package rc.core.retry;

import rc.core.model.FailureClassification;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Pure retry decision: given what happened so far, retry after some delay or stop.
 *
 * Rules, in order:
 * <ol>
 *   <li>a fatal classification always stops</li>
 *   <li>a failure the {@link IdempotencyPolicy} does not allow replaying stops</li>
 *   <li>{@code attempt >= maxAttempts} stops</li>
 *   <li>if the backoff delay would reach past the deadline, stop</li>
 * </ol>
 *
 * Backoff: {@code min(base * 2^(attempt-1), maxDelay) * jitter}, jitter drawn from [0.5, 1.5).
 * A server Retry-After hint raises the delay to at least the hint, capped at maxDelay.
 *
 * Holds no mutable state; one instance serves all requests concurrently.
 */
public final class RetryPolicy {

    private static final double MIN_JITTER = 0.5;
    private static final double MAX_JITTER = 1.5;

    private final int maxAttempts;
    private final long baseDelayNanos;
    private final long maxDelayNanos;
    private final IdempotencyPolicy idempotencyPolicy;
    private final DoubleSupplier jitter;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, IdempotencyPolicy idempotencyPolicy) {
        this(maxAttempts, baseDelay, maxDelay, idempotencyPolicy, RetryPolicy::randomJitter);
    }

    /**
     * @param jitter source of jitter factors; values are clamped into [0.5, 1.5]
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, IdempotencyPolicy idempotencyPolicy,
                       DoubleSupplier jitter) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (idempotencyPolicy == null) throw new IllegalArgumentException("idempotencyPolicy cannot be null");
        if (jitter == null) throw new IllegalArgumentException("jitter cannot be null");
        this.maxAttempts = maxAttempts;
        this.baseDelayNanos = baseDelay.toNanos();
        this.maxDelayNanos = maxDelay.toNanos();
        this.idempotencyPolicy = idempotencyPolicy;
        this.jitter = jitter;
    }

    /**
     * @param context state of the logical request after its latest failed attempt
     * @param remainingNanos time left until the request deadline
     */
    public RetryDecision decide(RetryContext context, long remainingNanos) {
        FailureClassification failure = context.lastFailure();

        if (!failure.isTransient()) {
            return RetryDecision.stop(RetryDecision.StopReason.FATAL);
        }
        if (!idempotencyPolicy.allowsReplay(context.idempotent(), failure)) {
            return RetryDecision.stop(RetryDecision.StopReason.NOT_IDEMPOTENT);
        }
        if (context.attempt() >= maxAttempts) {
            return RetryDecision.stop(RetryDecision.StopReason.MAX_ATTEMPTS);
        }

        long delay = backoffNanos(context.attempt(), failure.retryAfterNanos());
        if (delay >= remainingNanos) {
            return RetryDecision.stop(RetryDecision.StopReason.DEADLINE);
        }
        return RetryDecision.retryAfter(delay);
    }

    /**
     * Delay to wait after the given (1-based) attempt failed.
     */
    public long backoffNanos(int attempt, long serverHintNanos) {
        double exponential = baseDelayNanos * Math.pow(2, Math.max(0, attempt - 1));
        double capped = Math.min(exponential, maxDelayNanos);
        double factor = Math.max(MIN_JITTER, Math.min(MAX_JITTER, jitter.getAsDouble()));
        long delay = (long) (capped * factor);

        if (serverHintNanos > 0) {
            delay = Math.max(delay, Math.min(serverHintNanos, maxDelayNanos));
        }
        return delay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static double randomJitter() {
        return ThreadLocalRandom.current().nextDouble(MIN_JITTER, MAX_JITTER);
    }
}
