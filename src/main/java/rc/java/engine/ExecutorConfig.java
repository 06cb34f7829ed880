package rc.java.engine;

import rc.core.retry.IdempotencyPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Construction-time settings of a {@link RequestExecutor}. Validated eagerly.
 *
 * @param maxAttempts network attempts per logical request, including the first (>= 1)
 * @param baseDelay backoff after the first failed attempt
 * @param maxDelay backoff cap before jitter
 * @param rateCapacity token bucket size per target
 * @param rateRefillPerSecond token refill rate per target
 * @param maxConnectionsPerHost live connection limit per target
 * @param defaultTimeout deadline of a logical request that does not set its own
 * @param attemptTimeout bound of a single attempt, null for "remaining deadline"
 * @param rateLimitTimeout longest wait for a rate limit token, null for "remaining deadline"
 * @param poolTimeout longest wait for a free connection, null for "remaining deadline"
 * @param idleTimeout idle connections older than this are not reused
 * @param connectTimeout TCP/TLS connect bound of new connections
 * @param maxConcurrentRequests worker threads running submitted requests
 * @param maxTrackedHosts targets with rate limit state kept in memory
 * @param defaultHeaders headers added to every request unless the request sets them
 * @param idempotencyPolicy replay rules for non-idempotent requests
 */
public record ExecutorConfig(
    int maxAttempts,
    Duration baseDelay,
    Duration maxDelay,
    long rateCapacity,
    double rateRefillPerSecond,
    int maxConnectionsPerHost,
    Duration defaultTimeout,
    Duration attemptTimeout,
    Duration rateLimitTimeout,
    Duration poolTimeout,
    Duration idleTimeout,
    Duration connectTimeout,
    int maxConcurrentRequests,
    int maxTrackedHosts,
    Map<String, String> defaultHeaders,
    IdempotencyPolicy idempotencyPolicy
) {
    public ExecutorConfig {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        requireNonNegative(baseDelay, "baseDelay");
        requireNonNegative(maxDelay, "maxDelay");
        if (maxDelay.compareTo(baseDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        if (rateCapacity <= 0) throw new IllegalArgumentException("rateCapacity must be > 0");
        if (!(rateRefillPerSecond > 0) || Double.isInfinite(rateRefillPerSecond)) {
            throw new IllegalArgumentException("rateRefillPerSecond must be > 0");
        }
        if (maxConnectionsPerHost <= 0) throw new IllegalArgumentException("maxConnectionsPerHost must be > 0");
        requirePositive(defaultTimeout, "defaultTimeout");
        if (attemptTimeout != null) requirePositive(attemptTimeout, "attemptTimeout");
        if (rateLimitTimeout != null) requireNonNegative(rateLimitTimeout, "rateLimitTimeout");
        if (poolTimeout != null) requireNonNegative(poolTimeout, "poolTimeout");
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        if (maxConcurrentRequests <= 0) throw new IllegalArgumentException("maxConcurrentRequests must be > 0");
        if (maxTrackedHosts <= 0) throw new IllegalArgumentException("maxTrackedHosts must be > 0");
        if (idempotencyPolicy == null) throw new IllegalArgumentException("idempotencyPolicy cannot be null");
        defaultHeaders = defaultHeaders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders));
    }

    public static ExecutorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Duration> attemptTimeoutOverride() {
        return Optional.ofNullable(attemptTimeout);
    }

    public Optional<Duration> rateLimitTimeoutOverride() {
        return Optional.ofNullable(rateLimitTimeout);
    }

    public Optional<Duration> poolTimeoutOverride() {
        return Optional.ofNullable(poolTimeout);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be > 0");
    }

    private static void requireNonNegative(Duration d, String name) {
        if (d == null || d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
    }

    /**
     * Defaults: 5 attempts, 1.25s base / 60s max backoff, 10 tokens refilled at 10/s per target,
     * 5 connections per target, 5 minute request deadline, 5 concurrent requests,
     * {@code Accept: application/json}.
     */
    public static final class Builder {
        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofMillis(1250);
        private Duration maxDelay = Duration.ofSeconds(60);
        private long rateCapacity = 10;
        private double rateRefillPerSecond = 10.0;
        private int maxConnectionsPerHost = 5;
        private Duration defaultTimeout = Duration.ofMinutes(5);
        private Duration attemptTimeout;
        private Duration rateLimitTimeout;
        private Duration poolTimeout;
        private Duration idleTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxConcurrentRequests = 5;
        private int maxTrackedHosts = 1024;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>(Map.of("Accept", "application/json"));
        private IdempotencyPolicy idempotencyPolicy = IdempotencyPolicy.defaults();

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder rateCapacity(long rateCapacity) {
            this.rateCapacity = rateCapacity;
            return this;
        }

        public Builder rateRefillPerSecond(double rateRefillPerSecond) {
            this.rateRefillPerSecond = rateRefillPerSecond;
            return this;
        }

        public Builder maxConnectionsPerHost(int maxConnectionsPerHost) {
            this.maxConnectionsPerHost = maxConnectionsPerHost;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        public Builder rateLimitTimeout(Duration rateLimitTimeout) {
            this.rateLimitTimeout = rateLimitTimeout;
            return this;
        }

        public Builder poolTimeout(Duration poolTimeout) {
            this.poolTimeout = poolTimeout;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder maxTrackedHosts(int maxTrackedHosts) {
            this.maxTrackedHosts = maxTrackedHosts;
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            if (value == null) {
                defaultHeaders.remove(name);
            } else {
                defaultHeaders.put(name, value);
            }
            return this;
        }

        public Builder idempotencyPolicy(IdempotencyPolicy idempotencyPolicy) {
            this.idempotencyPolicy = idempotencyPolicy;
            return this;
        }

        public ExecutorConfig build() {
            return new ExecutorConfig(maxAttempts, baseDelay, maxDelay, rateCapacity, rateRefillPerSecond,
                maxConnectionsPerHost, defaultTimeout, attemptTimeout, rateLimitTimeout, poolTimeout, idleTimeout,
                connectTimeout, maxConcurrentRequests, maxTrackedHosts, defaultHeaders, idempotencyPolicy);
        }
    }
}
