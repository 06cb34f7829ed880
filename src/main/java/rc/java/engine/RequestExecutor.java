package rc.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rc.core.clock.Clock;
import rc.core.clock.SystemClock;
import rc.core.error.ApiException;
import rc.core.error.DeadlineExceededException;
import rc.core.error.DecodeException;
import rc.core.error.HttpStatusException;
import rc.core.error.NetworkFatalException;
import rc.core.error.NetworkTransientException;
import rc.core.error.PoolExhaustedException;
import rc.core.error.RateLimitTimeoutException;
import rc.core.error.RequestCancelledException;
import rc.core.error.RequestFailedException;
import rc.core.error.RetriesExhaustedException;
import rc.core.model.FailureClassification;
import rc.core.model.FailureClassification.Exposure;
import rc.core.model.FailureClassification.Reason;
import rc.core.model.Request;
import rc.core.model.Response;
import rc.core.normalize.CanonicalBody;
import rc.core.normalize.NormalizedResponse;
import rc.core.normalize.ResponseNormalizer;
import rc.core.retry.RetryContext;
import rc.core.retry.RetryDecision;
import rc.core.retry.RetryPolicy;
import rc.java.transport.ConnectionFactory;
import rc.java.transport.ConnectionPool;
import rc.java.transport.JdkHttpConnectionFactory;
import rc.java.transport.NetworkErrorClassifier;
import rc.java.transport.PooledConnection;
import rc.java.transport.RawResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Turns logical requests into HTTP traffic under rate limit, connection and retry constraints.
 *
 * Per logical request (see {@link ExecutionState}):
 * 1. LIMITING: take one token from the target's rate limiter, bounded by the deadline
 * 2. DISPATCHING: lease a pooled connection, send, await the response within the attempt timeout
 * 3. DECODING: normalize the body; a 2xx result succeeds
 * 4. any failure is classified and handed to the {@link RetryPolicy}; RETRYING sleeps the backoff
 *    (holding neither a token nor a connection) and loops back to LIMITING
 *
 * Guarantees:
 * - at most {@code maxAttempts} network attempts, strictly sequential within one request
 * - the caller gets either a {@link Response} or exactly one {@link ApiException}
 * - every attempt that contacted the endpoint consumed a token; a token taken for an attempt that
 *   never left (pool exhausted, deadline hit before sending) is refunded
 * - the deadline is enforced at every suspension point and surfaces as {@link DeadlineExceededException};
 *   for submitted requests it runs from submission, so time spent queued for a worker counts
 *
 * Thread-safety:
 * - Executors hold no per-request mutable state; any number of requests run concurrently
 * - Rate limiter and connection pool may be shared between executors for the same targets
 *
 * Usage example:
 * <pre>
 * ExecutorConfig config = ExecutorConfig.builder().maxAttempts(3).build();
 * try (RequestExecutor executor = new RequestExecutor(config)) {
 *     Response response = executor.execute(Request.get("https://api.example.com/items").build());
 *     // response.body() is a JsonBody, XmlBody, FormBody, TextBody or RawBody
 * }
 * </pre>
 */
public final class RequestExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ExecutorConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RateLimiterRegistry limiters;
    private final ConnectionPool pool;
    private final boolean ownsPool;
    private final ResponseNormalizer normalizer;
    private final RetryPolicy retryPolicy;
    private final ExecutorService workers;
    private final ScheduledExecutorService deadlines;

    /**
     * Creates an executor with its own rate limiters, connection pool and worker threads,
     * talking HTTP through {@link java.net.http.HttpClient}.
     */
    public RequestExecutor(ExecutorConfig config) {
        this(builder(config));
    }

    private RequestExecutor(Builder b) {
        this.config = b.config;
        this.clock = b.clock != null ? b.clock : SystemClock.instance();
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.system();
        this.limiters = b.limiters != null ? b.limiters : RateLimiterRegistry.fromConfig(config, clock);
        if (b.pool != null) {
            this.pool = b.pool;
            this.ownsPool = false;
        } else {
            ConnectionFactory factory = b.connectionFactory != null
                ? b.connectionFactory
                : new JdkHttpConnectionFactory(config.connectTimeout());
            this.pool = new ConnectionPool(factory, clock, config.maxConnectionsPerHost(),
                config.idleTimeout().toNanos());
            this.ownsPool = true;
        }
        this.normalizer = b.normalizer != null ? b.normalizer : new ResponseNormalizer();
        this.retryPolicy = b.jitter != null
            ? new RetryPolicy(config.maxAttempts(), config.baseDelay(), config.maxDelay(),
                config.idempotencyPolicy(), b.jitter)
            : new RetryPolicy(config.maxAttempts(), config.baseDelay(), config.maxDelay(),
                config.idempotencyPolicy());
        ThreadNames threads = new ThreadNames();
        this.workers = Executors.newFixedThreadPool(config.maxConcurrentRequests(), threads.named("worker"));
        this.deadlines = Executors.newSingleThreadScheduledExecutor(threads.named("deadline"));
    }

    public static Builder builder(ExecutorConfig config) {
        return new Builder(config);
    }

    /**
     * Runs a logical request to completion on the calling thread.
     *
     * @return the normalized 2xx response
     * @throws ApiException the single terminal failure of this request
     */
    public Response execute(Request request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");
        return execute(request, clock.nowNanos());
    }

    private Response execute(Request request, long startNanos) {
        Execution execution = new Execution(withDefaultHeaders(request), startNanos);
        try {
            return execution.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.transition(ExecutionState.FAILED);
            throw new RequestCancelledException("request cancelled: " + request, execution.attempts, e);
        }
    }

    /**
     * Runs a logical request on the worker pool. The deadline starts now: a request still queued
     * for a worker when it passes fails with {@link DeadlineExceededException} without being sent.
     * Cancelling the returned future interrupts the worker, which releases any held token
     * reservation or connection.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the executor is closed
     */
    public CompletableFuture<Response> submit(Request request) {
        if (request == null) throw new IllegalArgumentException("request cannot be null");

        long startNanos = clock.nowNanos();
        Duration timeout = request.timeoutOverride().orElse(config.defaultTimeout());
        CompletableFuture<Response> result = new CompletableFuture<>();
        // whichever of the worker and the expiry claims the request first owns its outcome
        AtomicBoolean claimed = new AtomicBoolean();
        Future<?> task = workers.submit(() -> {
            if (!claimed.compareAndSet(false, true)) return;
            try {
                result.complete(execute(request, startNanos));
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });
        ScheduledFuture<?> expiry = deadlines.schedule(() -> {
            if (!claimed.compareAndSet(false, true)) return;
            long waitedMillis = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - startNanos);
            log.warn("{} {} waited {} ms for a worker and exceeded its deadline", request.method(), request.uri(),
                waitedMillis);
            result.completeExceptionally(new DeadlineExceededException(
                "deadline exceeded after " + waitedMillis + " ms waiting for a worker: " + request, null, 0, null));
            task.cancel(false);
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        result.whenComplete((response, error) -> {
            expiry.cancel(false);
            if (result.isCancelled()) task.cancel(true);
        });
        return result;
    }

    /**
     * Fans the requests out concurrently and waits for all of them. A request that dies of an error
     * outside the {@link ApiException} hierarchy is recorded as a {@link RequestFailedException}.
     *
     * @return successes and failures, each in submission order
     */
    public BatchResult executeAll(Collection<Request> requests) {
        if (requests == null) throw new IllegalArgumentException("requests cannot be null");

        List<Request> ordered = new ArrayList<>(requests);
        List<CompletableFuture<Response>> futures = new ArrayList<>(ordered.size());
        for (Request request : ordered) {
            futures.add(submit(request));
        }

        List<Response> successes = new ArrayList<>();
        List<BatchResult.Failure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                successes.add(futures.get(i).join());
            } catch (CompletionException | CancellationException e) {
                failures.add(new BatchResult.Failure(ordered.get(i), asApiException(ordered.get(i), e)));
            }
        }
        log.debug("Batch of {} finished: {} succeeded, {} failed", ordered.size(), successes.size(), failures.size());
        return new BatchResult(successes, failures);
    }

    private static ApiException asApiException(Request request, RuntimeException failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
            ? failure.getCause()
            : failure;
        if (cause instanceof ApiException apiError) return apiError;
        if (cause instanceof CancellationException) {
            return new RequestCancelledException("request cancelled: " + request, 0, cause);
        }
        return new RequestFailedException("request failed: " + request + ": " + cause, 0, cause);
    }

    public ExecutorConfig config() {
        return config;
    }

    /**
     * Stops accepting work, waits briefly for running requests, then closes the connection pool
     * if this executor created it.
     */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Workers still running after {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            deadlines.shutdownNow();
            if (ownsPool) pool.close();
        }
    }

    private Request withDefaultHeaders(Request request) {
        if (config.defaultHeaders().isEmpty()) return request;

        Map<String, String> merged = new LinkedHashMap<>();
        config.defaultHeaders().forEach((name, value) -> {
            boolean overridden = request.headers().keySet().stream().anyMatch(name::equalsIgnoreCase);
            if (!overridden) merged.put(name, value);
        });
        merged.putAll(request.headers());
        return new Request(request.method(), request.uri(), merged, request.body(), request.contentType(),
            request.idempotent(), request.timeout());
    }

    private long boundedWait(long deadlineNanos, Duration wait) {
        if (wait == null) return deadlineNanos;
        return Math.min(deadlineNanos, clock.nowNanos() + wait.toNanos());
    }

    /**
     * Seconds form of Retry-After; the HTTP-date form is ignored.
     */
    static long retryAfterNanos(RawResponse raw) {
        String value = raw.header("Retry-After").map(String::trim).orElse("");
        if (value.isEmpty() || value.length() > 9 || !value.chars().allMatch(Character::isDigit)) return 0L;
        return TimeUnit.SECONDS.toNanos(Long.parseLong(value));
    }

    /**
     * State of one logical request. Confined to the thread running it.
     */
    private final class Execution {
        private final Request request;
        private final long startNanos;
        private final long deadlineNanos;
        private final FairRateLimiter limiter;

        private ExecutionState state = ExecutionState.PENDING;
        private int attempts;
        private FailureClassification lastFailure;
        private CanonicalBody lastErrorBody;
        private Throwable lastCause;
        private DecodeException lastDecodeError;

        private Execution(Request request, long startNanos) {
            this.request = request;
            this.startNanos = startNanos;
            this.deadlineNanos = startNanos + request.timeoutOverride().orElse(config.defaultTimeout()).toNanos();
            this.limiter = limiters.forTarget(request.target());
        }

        private Response run() throws InterruptedException {
            if (clock.nowNanos() >= deadlineNanos) throw deadlineExceeded();
            while (true) {
                Response response = attempt();
                if (response != null) {
                    transition(ExecutionState.SUCCEEDED);
                    return response;
                }

                long now = clock.nowNanos();
                RetryDecision decision = retryPolicy.decide(
                    new RetryContext(attempts, now - startNanos, lastFailure, request.idempotent()),
                    deadlineNanos - now);

                if (!decision.shouldRetry()) {
                    transition(ExecutionState.FAILED);
                    ApiException error = terminalError(decision.stopReason());
                    log.warn("{} {} failed after {} attempt(s): {} ({})", request.method(), request.uri(),
                        attempts, decision.stopReason(), describe(lastFailure));
                    throw error;
                }

                transition(ExecutionState.RETRYING);
                log.warn("{} {} attempt {} failed ({}), retrying in {} ms", request.method(), request.uri(),
                    attempts, describe(lastFailure), TimeUnit.NANOSECONDS.toMillis(decision.delayNanos()));
                sleeper.sleep(decision.delayNanos());
            }
        }

        /**
         * One pass through LIMITING, DISPATCHING and DECODING.
         *
         * @return the response on success, null after recording a retryable-or-not failure
         */
        private Response attempt() throws InterruptedException {
            transition(ExecutionState.LIMITING);
            Permit permit = acquirePermit();

            transition(ExecutionState.DISPATCHING);
            PooledConnection connection = leaseConnection(permit);

            RawResponse raw;
            try (connection) {
                long remaining = deadlineNanos - clock.nowNanos();
                if (remaining <= 0) {
                    limiter.release(permit);
                    throw deadlineExceeded();
                }

                attempts++;
                long attemptBudget = config.attemptTimeoutOverride()
                    .map(t -> Math.min(t.toNanos(), remaining))
                    .orElse(remaining);
                log.debug("{} {} attempt {} via {}", request.method(), request.uri(), attempts, connection.target());

                CompletableFuture<RawResponse> exchange = connection.send(request, Duration.ofNanos(attemptBudget));
                try {
                    raw = exchange.get(attemptBudget, TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    exchange.cancel(true);
                    connection.invalidate();
                    record(FailureClassification.transientNetwork(Reason.TIMEOUT, Exposure.AMBIGUOUS), null, e);
                    if (clock.nowNanos() >= deadlineNanos) throw deadlineExceeded();
                    return null;
                } catch (ExecutionException e) {
                    FailureClassification failure = NetworkErrorClassifier.classify(e);
                    if (NetworkErrorClassifier.breaksConnection(failure)) connection.invalidate();
                    record(failure, null, e.getCause());
                    if (clock.nowNanos() >= deadlineNanos) throw deadlineExceeded();
                    return null;
                } catch (InterruptedException e) {
                    exchange.cancel(true);
                    connection.invalidate();
                    throw e;
                }
            }

            transition(ExecutionState.DECODING);
            log.debug("{} {} attempt {} -> {} ({})", request.method(), request.uri(), attempts, raw.statusCode(),
                raw.contentType());

            NormalizedResponse normalized;
            try {
                normalized = normalizer.normalize(raw.statusCode(), raw.body(), raw.contentType());
            } catch (DecodeException e) {
                lastDecodeError = e;
                record(FailureClassification.decodeError(raw.statusCode()), null, e);
                return null;
            }

            if (normalized.isSuccess()) {
                return new Response(raw.statusCode(), raw.headers(), normalized.body(), attempts);
            }
            record(FailureClassification.forStatus(raw.statusCode(), retryAfterNanos(raw)), normalized.body(), null);
            return null;
        }

        private Permit acquirePermit() throws InterruptedException {
            try {
                return limiter.acquire(1, boundedWait(deadlineNanos, config.rateLimitTimeout()));
            } catch (RateLimitTimeoutException e) {
                if (clock.nowNanos() >= deadlineNanos) throw deadlineExceeded();
                transition(ExecutionState.FAILED);
                throw new RateLimitTimeoutException(
                    "no rate limit token for " + request.target() + " within " + config.rateLimitTimeout(), attempts);
            }
        }

        private PooledConnection leaseConnection(Permit permit) throws InterruptedException {
            try {
                return pool.acquire(request.target(), boundedWait(deadlineNanos, config.poolTimeout()));
            } catch (PoolExhaustedException e) {
                limiter.release(permit);
                if (clock.nowNanos() >= deadlineNanos) throw deadlineExceeded();
                transition(ExecutionState.FAILED);
                throw new PoolExhaustedException(e.getMessage(), attempts);
            } catch (InterruptedException | RuntimeException e) {
                limiter.release(permit);
                throw e;
            }
        }

        private void record(FailureClassification failure, CanonicalBody errorBody, Throwable cause) {
            lastFailure = failure;
            lastCause = cause;
            if (errorBody != null) lastErrorBody = errorBody;
            if (failure.reason() != Reason.DECODE_ERROR) lastDecodeError = null;
        }

        private DeadlineExceededException deadlineExceeded() {
            transition(ExecutionState.FAILED);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - startNanos);
            log.warn("{} {} exceeded its deadline after {} ms and {} attempt(s)", request.method(), request.uri(),
                elapsedMillis, attempts);
            return new DeadlineExceededException(
                "deadline exceeded after " + elapsedMillis + " ms: " + request, lastFailure, attempts, lastErrorBody);
        }

        private ApiException terminalError(RetryDecision.StopReason reason) {
            String summary = request + " after " + attempts + " attempt(s): " + describe(lastFailure);
            if (reason == RetryDecision.StopReason.MAX_ATTEMPTS) {
                return new RetriesExhaustedException("retries exhausted for " + summary, lastFailure, attempts,
                    lastErrorBody, lastCause);
            }
            if (reason == RetryDecision.StopReason.DEADLINE) {
                return new DeadlineExceededException("no time left to retry " + summary, lastFailure, attempts,
                    lastErrorBody);
            }
            // FATAL or NOT_IDEMPOTENT: surface the failure itself
            if (lastDecodeError != null) {
                return lastDecodeError.withAttempts(lastFailure, attempts);
            }
            if (lastFailure.exposure() == Exposure.RESPONDED) {
                return new HttpStatusException("HTTP " + lastFailure.statusCode() + " for " + summary, lastFailure,
                    attempts, lastErrorBody, lastCause);
            }
            if (lastFailure.isTransient()) {
                return new NetworkTransientException("not replayed, request is not idempotent: " + summary,
                    lastFailure, attempts, lastErrorBody, lastCause);
            }
            return new NetworkFatalException("network failure for " + summary, lastFailure, attempts,
                lastErrorBody, lastCause);
        }

        private void transition(ExecutionState next) {
            if (state.isTerminal()) return;
            log.debug("{} {}: {} -> {}", request.method(), request.uri(), state, next);
            state = next;
        }
    }

    private static String describe(FailureClassification failure) {
        if (failure == null) return "no attempt";
        String status = failure.statusCode() > 0 ? " " + failure.statusCode() : "";
        return failure.kind() + " " + failure.reason() + status;
    }

    private static final class ThreadNames {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();
        private final int pool = POOL_SEQUENCE.incrementAndGet();

        private ThreadFactory named(String role) {
            AtomicInteger sequence = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, "rest-core-" + pool + "-" + role + "-" + sequence.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }

    /**
     * Wires an executor with injected collaborators; anything left unset gets the default.
     * Pass the same {@link RateLimiterRegistry} and {@link ConnectionPool} to several executors to
     * make them share per-target budgets. An injected pool is not closed by {@link #close()}.
     */
    public static final class Builder {
        private final ExecutorConfig config;
        private Clock clock;
        private Sleeper sleeper;
        private RateLimiterRegistry limiters;
        private ConnectionPool pool;
        private ConnectionFactory connectionFactory;
        private ResponseNormalizer normalizer;
        private DoubleSupplier jitter;

        private Builder(ExecutorConfig config) {
            if (config == null) throw new IllegalArgumentException("config cannot be null");
            this.config = config;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder rateLimiters(RateLimiterRegistry limiters) {
            this.limiters = limiters;
            return this;
        }

        public Builder connectionPool(ConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        public Builder normalizer(ResponseNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /** Jitter factor source for backoff, values in [0.5, 1.5). */
        public Builder jitter(DoubleSupplier jitter) {
            this.jitter = jitter;
            return this;
        }

        public RequestExecutor build() {
            if (pool != null && connectionFactory != null) {
                throw new IllegalArgumentException("set either connectionPool or connectionFactory, not both");
            }
            return new RequestExecutor(this);
        }
    }
}
