package rc.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rc.core.algorithms.token_bucket.TokenBucket;
import rc.core.clock.Clock;

/**
 * One {@link FairRateLimiter} per target, created lazily with the same bucket settings.
 *
 * Shared by every executor talking to the same targets so they draw from the same budget. The set
 * of tracked targets is LRU-bounded; an evicted target starts again with a full bucket on its next
 * request, so {@code maxTargets} should comfortably exceed the number of targets in active use.
 */
public final class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Clock clock;
    private final long capacity;
    private final double refillPerSecond;
    private final LruRegistry<String, FairRateLimiter> limiters;

    public RateLimiterRegistry(Clock clock, long capacity, double refillPerSecond, int maxTargets) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.limiters = new LruRegistry<>(maxTargets,
            (target, limiter) -> log.debug("Evicted rate limiter for {}", target));
    }

    public static RateLimiterRegistry fromConfig(ExecutorConfig config, Clock clock) {
        return new RateLimiterRegistry(clock, config.rateCapacity(), config.rateRefillPerSecond(),
            config.maxTrackedHosts());
    }

    public FairRateLimiter forTarget(String target) {
        if (target == null) throw new IllegalArgumentException("target cannot be null");
        return limiters.getOrCreate(target,
            t -> new FairRateLimiter(new TokenBucket(clock, capacity, refillPerSecond), clock));
    }

    public int size() {
        return limiters.size();
    }

    public int maxSize() {
        return limiters.maxSize();
    }
}
