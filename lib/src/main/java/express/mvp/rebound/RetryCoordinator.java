package express.mvp.rebound;

import express.mvp.rebound.circuit.CircuitBreaker;
import express.mvp.rebound.circuit.CircuitBreakerRegistry;
import express.mvp.rebound.circuit.CircuitOpenException;
import express.mvp.rebound.error.ErrorClass;
import express.mvp.rebound.error.ErrorClassifier;
import express.mvp.rebound.error.TableErrorClassifier;
import express.mvp.rebound.observe.RetryObserver;
import express.mvp.rebound.policy.BackoffPolicy;
import express.mvp.rebound.policy.JitteredBackoff;
import express.mvp.rebound.policy.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-executes fallible operations on transient failure with exponential backoff and jitter.
 *
 * <p>Every failure is classified by the configured {@link ErrorClassifier}. Only {@link
 * ErrorClass#TRANSIENT_RETRYABLE} failures are retried; anything else ends the sequence at
 * once. The caller always sees either the operation's value or the most recent error itself,
 * never a wrapper.
 *
 * <h2>Retry Loop</h2>
 *
 * <pre>
 * attempt 1 ──▶ success ──────────────────────────────▶ value
 *     │
 *     └─▶ failure ──▶ classify ──▶ not retryable ─────▶ same error
 *                         │
 *                         ├─▶ last attempt ──────────▶ same error
 *                         │
 *                         └─▶ delay = backoff(current)
 *                             sleep(delay)
 *                             current = min(current * multiplier, max)
 *                             attempt 2 ...
 * </pre>
 *
 * <h2>Forms</h2>
 *
 * <ul>
 *   <li><b>Blocking:</b> {@link #run(RetryPolicy, RetryableOperation)} sleeps on the calling
 *       thread. Interrupting it while it waits ends the sequence with {@link
 *       RetryCancelledException}.
 *   <li><b>Asynchronous:</b> {@link #runAsync(RetryPolicy, AsyncOperation)} schedules delays on
 *       a {@link ScheduledExecutorService}; no thread is blocked between attempts. Cancelling
 *       the returned future cancels the pending attempt.
 *   <li><b>Callback:</b> {@link #run(RetryPolicy, RetryableOperation, RetryCallback)} reports
 *       the outcome exactly once through a {@link RetryCallback}.
 * </ul>
 *
 * <h2>Circuit Breakers</h2>
 *
 * <p>With a {@link CircuitBreakerRegistry} configured, every sequence run under an explicit
 * operation name asks the breaker of that name for permission before each attempt and reports
 * the attempt's result to it. A refused attempt ends the sequence with {@link
 * CircuitOpenException}, which is never retried. Sequences under {@link
 * #DEFAULT_OPERATION_NAME} bypass the breakers.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (RetryCoordinator coordinator = RetryCoordinator.builder()
 *         .observer(new LoggingRetryObserver())
 *         .build()) {
 *     Profile profile = coordinator.run("load-profile", RetryPolicy.defaults(),
 *         () -> profiles.load(userId));
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A coordinator is immutable after construction and may be shared. Each invocation keeps
 * its state in its own {@link RetryContext}; concurrent invocations do not interact.
 *
 * @see RetryPolicy
 * @see ErrorClassifier
 * @see RetryObserver
 */
public final class RetryCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetryCoordinator.class);

    /** Operation name used when the caller does not supply one. */
    public static final String DEFAULT_OPERATION_NAME = "operation";

    private final ErrorClassifier classifier;
    private final BackoffPolicy backoff;
    private final RetryObserver observer;
    private final Sleeper sleeper;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final CircuitBreakerRegistry circuitBreakers;
    private final boolean ownsScheduler;
    private final boolean ownsWorkers;

    private RetryCoordinator(Builder builder) {
        this.classifier = builder.classifier;
        this.backoff = builder.backoff;
        this.observer = builder.observer;
        this.sleeper = builder.sleeper;
        this.circuitBreakers = builder.circuitBreakers;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler =
                ownsScheduler
                        ? Executors.newSingleThreadScheduledExecutor(
                                new RetryThreadFactory("rebound-scheduler"))
                        : builder.scheduler;
        this.ownsWorkers = builder.workers == null;
        this.workers =
                ownsWorkers
                        ? Executors.newCachedThreadPool(new RetryThreadFactory("rebound-worker"))
                        : builder.workers;
    }

    /**
     * Creates a new builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a coordinator with the standard classifier, jittered backoff and no observer.
     *
     * @return new coordinator
     */
    public static RetryCoordinator create() {
        return builder().build();
    }

    // ========== Blocking form ==========

    /**
     * Runs an operation, retrying transient failures on the calling thread.
     *
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws RetryCancelledException if the thread is interrupted between attempts
     * @throws Exception the error of the last attempt, unchanged
     */
    public <T> T run(RetryPolicy policy, RetryableOperation<T> operation) throws Exception {
        return run(DEFAULT_OPERATION_NAME, policy, operation);
    }

    /**
     * Runs a named operation, retrying transient failures on the calling thread.
     *
     * @param operationName identifier reported to observers
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws RetryCancelledException if the thread is interrupted between attempts
     * @throws Exception the error of the last attempt, unchanged
     */
    public <T> T run(String operationName, RetryPolicy policy, RetryableOperation<T> operation)
            throws Exception {
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(operation, "operation");
        return execute(new RetryContext(operationName, policy), policy, operation);
    }

    /**
     * Runs an operation and returns its outcome instead of throwing.
     *
     * <p>Cancellation is still raised as {@link RetryCancelledException}.
     *
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return the outcome
     */
    public <T> RetryOutcome<T> runForOutcome(RetryPolicy policy, RetryableOperation<T> operation) {
        return runForOutcome(DEFAULT_OPERATION_NAME, policy, operation);
    }

    /**
     * Runs a named operation and returns its outcome instead of throwing.
     *
     * @param operationName identifier reported to observers
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return the outcome
     */
    public <T> RetryOutcome<T> runForOutcome(
            String operationName, RetryPolicy policy, RetryableOperation<T> operation) {
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(operation, "operation");
        RetryContext context = new RetryContext(operationName, policy);
        try {
            return RetryOutcome.success(
                    execute(context, policy, operation), context.getAttemptCount());
        } catch (RetryCancelledException e) {
            throw e;
        } catch (Exception e) {
            return RetryOutcome.failure(e, context.getAttemptCount());
        }
    }

    private <T> T execute(RetryContext context, RetryPolicy policy, RetryableOperation<T> operation)
            throws Exception {
        CircuitBreaker breaker = breakerFor(context);
        while (true) {
            context.startAttempt();
            notifyObserver(o -> o.onAttemptStart(context));
            T value;
            try {
                value = callThrough(breaker, operation);
            } catch (Exception e) {
                if (!shouldRetry(context, e)) {
                    throw e;
                }
                pause(context, policy);
                continue;
            }
            notifyObserver(o -> o.onAttemptSuccess(context));
            return value;
        }
    }

    private static <T> T callThrough(CircuitBreaker breaker, RetryableOperation<T> operation)
            throws Exception {
        if (breaker == null) {
            return operation.call();
        }
        breaker.acquirePermission();
        T value;
        try {
            value = operation.call();
        } catch (Exception e) {
            breaker.recordFailure(e);
            throw e;
        }
        breaker.recordSuccess();
        return value;
    }

    private CircuitBreaker breakerFor(RetryContext context) {
        if (circuitBreakers == null
                || DEFAULT_OPERATION_NAME.equals(context.getOperationName())) {
            return null;
        }
        return circuitBreakers.breakerFor(context.getOperationName());
    }

    /**
     * Classifies a failure, reports it and decides whether another attempt follows.
     *
     * @return true if the sequence continues after a delay
     */
    private boolean shouldRetry(RetryContext context, Throwable error) {
        ErrorClass errorClass = classify(error);
        context.recordFailure(error, errorClass);
        notifyObserver(o -> o.onAttemptFailure(context, error, errorClass));
        if (!errorClass.isRetryable()) {
            return false;
        }
        if (context.isLastAttempt()) {
            notifyObserver(o -> o.onAttemptsExhausted(context, error));
            return false;
        }
        return true;
    }

    private ErrorClass classify(Throwable error) {
        // Errors and refused attempts are never retried, whatever the classifier says.
        if (!(error instanceof Exception) || error instanceof CircuitOpenException) {
            return ErrorClass.NON_RETRYABLE;
        }
        return Objects.requireNonNull(classifier.classify(error), "classifier returned null");
    }

    private Duration scheduleDelay(RetryContext context, RetryPolicy policy) {
        Duration delay =
                Objects.requireNonNull(
                        backoff.nextDelay(
                                context.getAttemptCount(),
                                context.getCurrentDelay(),
                                context.getLastError(),
                                policy),
                        "backoff returned null");
        notifyObserver(o -> o.onRetryScheduled(context, delay));
        return delay;
    }

    private void pause(RetryContext context, RetryPolicy policy) {
        Duration delay = scheduleDelay(context, policy);
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(context);
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled(context);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw cancelled(context);
        }
        context.recordDelay(delay, policy);
    }

    private RetryCancelledException cancelled(RetryContext context) {
        notifyObserver(o -> o.onRetryCancelled(context));
        return new RetryCancelledException(
                context.getOperationName(), context.getAttemptCount(), context.getLastError());
    }

    // ========== Asynchronous form ==========

    /**
     * Runs an asynchronous operation, scheduling retries without blocking a thread.
     *
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return future completed with the value or the last error
     */
    public <T> CompletableFuture<T> runAsync(RetryPolicy policy, AsyncOperation<T> operation) {
        return runAsync(DEFAULT_OPERATION_NAME, policy, operation);
    }

    /**
     * Runs a named asynchronous operation, scheduling retries without blocking a thread.
     *
     * <p>The first attempt is started on the calling thread; later attempts start on the
     * coordinator's scheduler. Cancelling the returned future while a delay is pending cancels
     * the pending attempt.
     *
     * @param operationName identifier reported to observers
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return future completed with the value or the last error
     */
    public <T> CompletableFuture<T> runAsync(
            String operationName, RetryPolicy policy, AsyncOperation<T> operation) {
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(operation, "operation");
        AsyncRetryLoop<T> loop = new AsyncRetryLoop<>(operationName, policy, operation);
        loop.start();
        return loop.result;
    }

    /**
     * Runs a blocking operation on the coordinator's worker threads and returns a future.
     *
     * @param policy the retry policy
     * @param operation the blocking operation
     * @param <T> the result type
     * @return future completed with the value or the last error
     */
    public <T> CompletableFuture<T> supplyAsync(
            RetryPolicy policy, RetryableOperation<T> operation) {
        return supplyAsync(DEFAULT_OPERATION_NAME, policy, operation);
    }

    /**
     * Runs a named blocking operation on the coordinator's worker threads and returns a future.
     *
     * @param operationName identifier reported to observers
     * @param policy the retry policy
     * @param operation the blocking operation
     * @param <T> the result type
     * @return future completed with the value or the last error
     */
    public <T> CompletableFuture<T> supplyAsync(
            String operationName, RetryPolicy policy, RetryableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return runAsync(operationName, policy, onWorker(operation));
    }

    private <T> AsyncOperation<T> onWorker(RetryableOperation<T> operation) {
        return () -> {
            CompletableFuture<T> attempt = new CompletableFuture<>();
            workers.execute(
                    () -> {
                        try {
                            attempt.complete(operation.call());
                        } catch (Throwable t) {
                            attempt.completeExceptionally(t);
                        }
                    });
            return attempt;
        };
    }

    // ========== Callback form ==========

    /**
     * Runs a blocking operation on the worker threads and reports the outcome to a callback.
     *
     * <p>Exactly one of {@link RetryCallback#onSuccess} and {@link RetryCallback#onFailure} is
     * called, exactly once. Cancelling the returned future reports a {@link
     * java.util.concurrent.CancellationException} to {@code onFailure}.
     *
     * @param policy the retry policy
     * @param operation the blocking operation
     * @param callback receives the outcome
     * @param <T> the result type
     * @return future of the same outcome, usable for cancellation
     */
    public <T> CompletableFuture<T> run(
            RetryPolicy policy, RetryableOperation<T> operation, RetryCallback<T> callback) {
        return run(DEFAULT_OPERATION_NAME, policy, operation, callback);
    }

    /**
     * Runs a named blocking operation on the worker threads and reports the outcome to a
     * callback.
     *
     * @param operationName identifier reported to observers
     * @param policy the retry policy
     * @param operation the blocking operation
     * @param callback receives the outcome
     * @param <T> the result type
     * @return future of the same outcome, usable for cancellation
     */
    public <T> CompletableFuture<T> run(
            String operationName,
            RetryPolicy policy,
            RetryableOperation<T> operation,
            RetryCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        return deliver(supplyAsync(operationName, policy, operation), callback);
    }

    /**
     * Runs an asynchronous operation and reports the outcome to a callback.
     *
     * @param policy the retry policy
     * @param operation the operation
     * @param callback receives the outcome
     * @param <T> the result type
     * @return future of the same outcome, usable for cancellation
     */
    public <T> CompletableFuture<T> runAsync(
            RetryPolicy policy, AsyncOperation<T> operation, RetryCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        return deliver(runAsync(DEFAULT_OPERATION_NAME, policy, operation), callback);
    }

    private static <T> CompletableFuture<T> deliver(
            CompletableFuture<T> future, RetryCallback<T> callback) {
        future.whenComplete(
                (value, error) -> {
                    try {
                        if (error == null) {
                            callback.onSuccess(value);
                        } else {
                            callback.onFailure(unwrap(error));
                        }
                    } catch (RuntimeException e) {
                        LOG.warn("Retry callback {} failed", callback, e);
                    }
                });
        return future;
    }

    // ========== Category wrappers ==========

    /**
     * Runs an operation with the preset of a category.
     *
     * @param category the operation category
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws Exception the error of the last attempt
     */
    public <T> T run(RetryCategory category, RetryableOperation<T> operation) throws Exception {
        Objects.requireNonNull(category, "category");
        return run(category.operationName(), category.policy(), operation);
    }

    /**
     * Runs a network call with {@link RetryPolicy#aggressive()}.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws Exception the error of the last attempt
     */
    public <T> T retryNetworkOperation(RetryableOperation<T> operation) throws Exception {
        return run(RetryCategory.NETWORK, operation);
    }

    /**
     * Runs a database or storage call with {@link RetryPolicy#defaults()}.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws Exception the error of the last attempt
     */
    public <T> T retryDatabaseOperation(RetryableOperation<T> operation) throws Exception {
        return run(RetryCategory.DATABASE, operation);
    }

    /**
     * Runs an upload with {@link RetryPolicy#conservative()}.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the value of the first successful attempt
     * @throws Exception the error of the last attempt
     */
    public <T> T retryUploadOperation(RetryableOperation<T> operation) throws Exception {
        return run(RetryCategory.UPLOAD, operation);
    }

    // ========== Lifecycle ==========

    /**
     * Shuts down the executors this coordinator created itself.
     *
     * <p>Executors supplied through the builder are left running. Retries that are already
     * scheduled still run; a retry that can no longer be scheduled completes its future with
     * {@link RetryCancelledException}.
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdown();
        }
        if (ownsWorkers) {
            workers.shutdown();
        }
    }

    private void notifyObserver(Consumer<RetryObserver> event) {
        try {
            event.accept(observer);
        } catch (RuntimeException e) {
            LOG.warn("Retry observer {} failed", observer, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public String toString() {
        return "RetryCoordinator[classifier="
                + classifier
                + ", backoff="
                + backoff
                + ", observer="
                + observer
                + "]";
    }

    /** One asynchronous retry sequence. */
    private final class AsyncRetryLoop<T> {
        private final RetryPolicy policy;
        private final AsyncOperation<T> operation;
        private final RetryContext context;
        private final CircuitBreaker breaker;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private volatile Future<?> pending;

        AsyncRetryLoop(String operationName, RetryPolicy policy, AsyncOperation<T> operation) {
            this.policy = policy;
            this.operation = operation;
            this.context = new RetryContext(operationName, policy);
            this.breaker = breakerFor(context);
        }

        void start() {
            result.whenComplete(
                    (value, error) -> {
                        if (result.isCancelled()) {
                            Future<?> scheduled = pending;
                            if (scheduled != null) {
                                scheduled.cancel(false);
                            }
                        }
                        if (error instanceof CancellationException
                                && !(error instanceof RetryCancelledException)) {
                            notifyObserver(o -> o.onRetryCancelled(context));
                        }
                    });
            attempt();
        }

        private void attempt() {
            if (result.isDone()) {
                return;
            }
            context.startAttempt();
            notifyObserver(o -> o.onAttemptStart(context));
            CompletionStage<T> stage;
            try {
                if (breaker != null) {
                    breaker.acquirePermission();
                }
            } catch (CircuitOpenException e) {
                onFailure(e);
                return;
            }
            try {
                stage = Objects.requireNonNull(operation.call(), "operation returned null");
            } catch (Throwable t) {
                recordFailure(t);
                onFailure(t);
                return;
            }
            stage.whenComplete(
                    (value, error) -> {
                        if (error == null) {
                            if (breaker != null) {
                                breaker.recordSuccess();
                            }
                            onSuccess(value);
                        } else {
                            Throwable cause = unwrap(error);
                            recordFailure(cause);
                            onFailure(cause);
                        }
                    });
        }

        private void recordFailure(Throwable error) {
            if (breaker != null) {
                breaker.recordFailure(error);
            }
        }

        private void onSuccess(T value) {
            if (result.isDone()) {
                return;
            }
            notifyObserver(o -> o.onAttemptSuccess(context));
            result.complete(value);
        }

        private void onFailure(Throwable error) {
            if (result.isDone()) {
                return;
            }
            if (!shouldRetry(context, error)) {
                result.completeExceptionally(error);
                return;
            }
            Duration delay = scheduleDelay(context, policy);
            try {
                pending =
                        scheduler.schedule(
                                () -> {
                                    context.recordDelay(delay, policy);
                                    attempt();
                                },
                                delay.toNanos(),
                                TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                LOG.debug("Retry of '{}' could not be scheduled", context.getOperationName(), e);
                result.completeExceptionally(cancelled(context));
                return;
            }
            if (result.isCancelled()) {
                pending.cancel(false);
            }
        }
    }

    /**
     * Builder for {@link RetryCoordinator}.
     *
     * <p>Every collaborator has a default: the standard classification table, jittered
     * backoff, no observer, {@link Thread#sleep}, and executors owned by the coordinator.
     */
    public static final class Builder {
        private ErrorClassifier classifier = TableErrorClassifier.standard();
        private BackoffPolicy backoff = new JitteredBackoff();
        private RetryObserver observer = RetryObserver.NOOP;
        private Sleeper sleeper = Sleeper.threadSleep();
        private ScheduledExecutorService scheduler;
        private ExecutorService workers;
        private CircuitBreakerRegistry circuitBreakers;

        private Builder() {}

        /**
         * Sets the error classifier.
         *
         * @param classifier the classifier
         * @return this builder
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        /**
         * Sets the backoff computation.
         *
         * @param backoff the backoff policy
         * @return this builder
         */
        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Sets the observer notified of retry progress.
         *
         * @param observer the observer
         * @return this builder
         */
        public Builder observer(RetryObserver observer) {
            this.observer = Objects.requireNonNull(observer, "observer");
            return this;
        }

        /**
         * Sets how the blocking form waits between attempts.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Sets the scheduler for asynchronous delays. The coordinator does not shut it down.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        /**
         * Sets the executor running blocking operations for {@code supplyAsync} and the
         * blocking callback form. The coordinator does not shut it down.
         *
         * @param workers the executor
         * @return this builder
         */
        public Builder workers(ExecutorService workers) {
            this.workers = Objects.requireNonNull(workers, "workers");
            return this;
        }

        /**
         * Sets the circuit breakers consulted by named retry sequences.
         *
         * @param circuitBreakers the registry
         * @return this builder
         */
        public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
            this.circuitBreakers = Objects.requireNonNull(circuitBreakers, "circuitBreakers");
            return this;
        }

        /**
         * Builds the coordinator.
         *
         * @return new coordinator
         */
        public RetryCoordinator build() {
            return new RetryCoordinator(this);
        }
    }
}
