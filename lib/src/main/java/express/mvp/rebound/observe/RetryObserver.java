package express.mvp.rebound.observe;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.error.ErrorClass;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Callback interface for retry progress events.
 *
 * <p>Observers are purely informational. The coordinator invokes them synchronously at fixed
 * points of the attempt loop and ignores anything they throw, so an observer can never change
 * the outcome of a retry sequence. Implementations should return quickly; any asynchronous
 * work they start is not awaited.
 *
 * <h2>Event Order</h2>
 *
 * <pre>
 * onAttemptStart
 *   ├─▶ onAttemptSuccess                          (done)
 *   └─▶ onAttemptFailure
 *         ├─▶ (non-retryable)                     (done)
 *         ├─▶ onAttemptsExhausted                 (done)
 *         └─▶ onRetryScheduled ─▶ onAttemptStart  (next attempt)
 *                  └─▶ onRetryCancelled           (done)
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryCoordinator coordinator = RetryCoordinator.builder()
 *     .observer(RetryObserver.composite(new LoggingRetryObserver(), metrics))
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>One observer instance receives events from every concurrent retry sequence of its
 * coordinator. Implementations must be thread-safe.
 *
 * @see LoggingRetryObserver
 * @see CountingRetryObserver
 * @see ActiveRetryTracker
 */
public interface RetryObserver {

    /** Observer that ignores every event. */
    RetryObserver NOOP = new RetryObserver() {};

    /**
     * Called before each attempt.
     *
     * @param context the sequence state, with the attempt number already incremented
     */
    default void onAttemptStart(RetryContext context) {
        // Default: no-op
    }

    /**
     * Called when an attempt failed, after classification.
     *
     * @param context the sequence state
     * @param error the attempt's error
     * @param errorClass the classification of the error
     */
    default void onAttemptFailure(RetryContext context, Throwable error, ErrorClass errorClass) {
        // Default: no-op
    }

    /**
     * Called when the next attempt has been scheduled.
     *
     * @param context the sequence state
     * @param delay the wait before the next attempt
     */
    default void onRetryScheduled(RetryContext context, Duration delay) {
        // Default: no-op
    }

    /**
     * Called when an attempt succeeded.
     *
     * @param context the sequence state; {@code getAttemptCount()} is the successful attempt
     */
    default void onAttemptSuccess(RetryContext context) {
        // Default: no-op
    }

    /**
     * Called when a retryable failure happened on the last allowed attempt.
     *
     * @param context the sequence state
     * @param error the final attempt's error, which is surfaced to the caller
     */
    default void onAttemptsExhausted(RetryContext context, Throwable error) {
        // Default: no-op
    }

    /**
     * Called when the sequence was cancelled while waiting for its next attempt.
     *
     * @param context the sequence state; {@code getAttemptCount()} is the last attempt made
     */
    default void onRetryCancelled(RetryContext context) {
        // Default: no-op
    }

    /**
     * Returns an observer forwarding every event to each of the given observers in order.
     *
     * @param observers the observers
     * @return composite observer
     */
    static RetryObserver composite(RetryObserver... observers) {
        Objects.requireNonNull(observers, "observers");
        return new CompositeRetryObserver(List.of(observers));
    }
}
