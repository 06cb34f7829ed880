package rc.java.engine;

/**
 * Tokens granted by a {@link FairRateLimiter}.
 *
 * @param cost tokens taken from the bucket
 * @param grantedAtNanos clock reading at the moment of the grant
 */
public record Permit(int cost, long grantedAtNanos) {
}
