package express.mvp.rebound;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.rebound.error.ErrorClass;
import express.mvp.rebound.policy.RetryPolicy;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks the state of one retry sequence.
 *
 * <p>A context is created by {@link RetryCoordinator} for every {@code run} invocation and
 * dropped when the invocation finishes. It records the current attempt (1-based), the current
 * base delay, the last error and its class, and timing. Observers receive the context to
 * report on progress; only the coordinator mutates it.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. A context belongs to exactly one retry sequence; in the
 * asynchronous form successive attempts may run on different threads, but never concurrently.
 *
 * @see RetryCoordinator
 * @see express.mvp.rebound.observe.RetryObserver
 */
public final class RetryContext {

    /** Identifier for the operation being retried. */
    private final String operationName;

    /** Maximum number of attempts (including initial). */
    private final int maxAttempts;

    /** Current attempt number (1-based, 0 before the first attempt). */
    private int attemptCount;

    /** Base delay for the next retry, before jitter. */
    private Duration currentDelay;

    /** Time of first attempt. */
    private final Instant startTime;

    /** Monotonic start, for elapsed time. */
    private final long startNanos;

    /** Last error encountered. */
    private Throwable lastError;

    /** Class of last error. */
    private ErrorClass lastErrorClass;

    /** Total time spent suspended between attempts. */
    private Duration totalDelay = Duration.ZERO;

    /**
     * Creates a context for a retry sequence.
     *
     * @param operationName identifier for the operation
     * @param policy the policy governing the sequence
     */
    RetryContext(String operationName, RetryPolicy policy) {
        this.operationName = operationName;
        this.maxAttempts = policy.getMaxAttempts();
        this.currentDelay = policy.getInitialDelay();
        this.startTime = Instant.now();
        this.startNanos = System.nanoTime();
    }

    /**
     * Returns the operation identifier.
     *
     * @return the operation name
     */
    public String getOperationName() {
        return operationName;
    }

    /**
     * Returns the maximum number of attempts allowed.
     *
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the current attempt number.
     *
     * @return 1-based attempt number (0 before the first attempt)
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Returns the number of retries (attempts minus 1).
     *
     * @return number of retries
     */
    public int getRetryCount() {
        return Math.max(0, attemptCount - 1);
    }

    /**
     * Checks if another attempt is allowed after the current one.
     *
     * @return true if more attempts are allowed
     */
    public boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    /**
     * Checks if the current attempt is the last one allowed.
     *
     * @return true if no more retries are allowed after this attempt
     */
    public boolean isLastAttempt() {
        return attemptCount >= maxAttempts;
    }

    /**
     * Returns the base delay for the next retry, before jitter.
     *
     * @return current delay
     */
    public Duration getCurrentDelay() {
        return currentDelay;
    }

    /**
     * Returns the last error encountered.
     *
     * @return the last error, or null if no failures yet
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable getLastError() {
        return lastError;
    }

    /**
     * Returns the class of the last error.
     *
     * @return the error class, or null if no failures yet
     */
    public ErrorClass getLastErrorClass() {
        return lastErrorClass;
    }

    /**
     * Returns the time when the sequence started.
     *
     * @return the start time
     */
    public Instant getStartTime() {
        return startTime;
    }

    /**
     * Returns the total elapsed time since start.
     *
     * @return elapsed duration
     */
    public Duration getElapsedTime() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Returns the total time spent waiting between attempts.
     *
     * @return total delay
     */
    public Duration getTotalDelay() {
        return totalDelay;
    }

    /** Records that an attempt is starting and returns its number. */
    int startAttempt() {
        attemptCount++;
        return attemptCount;
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Throwable is kept for diagnostics and cannot be safely copied.")
    void recordFailure(Throwable error, ErrorClass errorClass) {
        this.lastError = error;
        this.lastErrorClass = errorClass;
    }

    /** Records a completed delay and grows the base delay for the following retry. */
    void recordDelay(Duration delay, RetryPolicy policy) {
        this.totalDelay = totalDelay.plus(delay);
        this.currentDelay = policy.grow(currentDelay);
    }

    @Override
    public String toString() {
        return String.format(
                "RetryContext[op=%s, attempt=%d/%d, elapsed=%dms, lastError=%s]",
                operationName,
                attemptCount,
                maxAttempts,
                getElapsedTime().toMillis(),
                lastErrorClass);
    }
}
