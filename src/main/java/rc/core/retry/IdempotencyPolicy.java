package rc.core.retry;

import rc.core.model.FailureClassification;
import rc.core.model.FailureClassification.Exposure;

/**
 * Replay rules for requests not marked idempotent.
 *
 * Idempotent requests may be replayed after any transient failure. For the rest, the exposure of the
 * failed attempt decides:
 * <ul>
 *   <li>{@code NOT_SENT}: always replayable, the server saw nothing</li>
 *   <li>{@code RESPONDED} (5xx, 429): replayable when {@code retryOnResponse}</li>
 *   <li>{@code AMBIGUOUS} (timeout or reset after sending): replayable when {@code retryOnAmbiguous}</li>
 * </ul>
 *
 * This is a client-side policy. It does not make any server guarantee about duplicate side effects;
 * a 503 may still follow a partially applied write.
 *
 * @param retryOnResponse replay non-idempotent requests after a transient HTTP status
 * @param retryOnAmbiguous replay non-idempotent requests after an ambiguous network failure
 */
public record IdempotencyPolicy(boolean retryOnResponse, boolean retryOnAmbiguous) {

    /** Replays after transient statuses, never after ambiguous network failures. */
    public static IdempotencyPolicy defaults() {
        return new IdempotencyPolicy(true, false);
    }

    /** Replays non-idempotent requests only when nothing was sent. */
    public static IdempotencyPolicy strict() {
        return new IdempotencyPolicy(false, false);
    }

    public boolean allowsReplay(boolean idempotent, FailureClassification failure) {
        if (idempotent) return true;
        Exposure exposure = failure.exposure();
        return switch (exposure) {
            case NOT_SENT -> true;
            case RESPONDED -> retryOnResponse;
            case AMBIGUOUS -> retryOnAmbiguous;
        };
    }
}
