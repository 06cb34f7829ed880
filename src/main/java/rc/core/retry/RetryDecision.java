package rc.core.retry;

public record RetryDecision(
    Action action,
    long delayNanos,
    StopReason stopReason
) {
    public enum Action {
        RETRY,
        STOP
    }

    public enum StopReason {
        /** Failure classified fatal. */
        FATAL,
        /** maxAttempts reached. */
        MAX_ATTEMPTS,
        /** The next attempt could not start before the deadline. */
        DEADLINE,
        /** Transient, but replaying could duplicate a side effect on the server. */
        NOT_IDEMPOTENT
    }

    public static RetryDecision retryAfter(long delayNanos) {
        return new RetryDecision(Action.RETRY, Math.max(0L, delayNanos), null);
    }

    public static RetryDecision stop(StopReason reason) {
        return new RetryDecision(Action.STOP, 0L, reason);
    }

    public boolean shouldRetry() {
        return action == Action.RETRY;
    }
}
