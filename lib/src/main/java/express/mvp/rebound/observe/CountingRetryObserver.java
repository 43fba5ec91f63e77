package express.mvp.rebound.observe;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.error.ErrorClass;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Observer that keeps lock-free counters of retry activity.
 *
 * <p>Counters cover every sequence of the coordinator the observer is attached to. Use
 * {@link #getStats()} for a consistent-enough snapshot; individual counters are updated
 * independently, so a snapshot taken during activity may be off by in-flight events.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CountingRetryObserver metrics = new CountingRetryObserver();
 * RetryCoordinator coordinator = RetryCoordinator.builder().observer(metrics).build();
 * // ...
 * System.out.println(metrics.getStats());
 * }</pre>
 */
public final class CountingRetryObserver implements RetryObserver {

    private final LongAdder attempts = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final LongAdder transientFailures = new LongAdder();
    private final LongAdder nonRetryableFailures = new LongAdder();
    private final LongAdder unknownFailures = new LongAdder();
    private final LongAdder retriesScheduled = new LongAdder();
    private final LongAdder exhausted = new LongAdder();
    private final AtomicLong scheduledDelayNanos = new AtomicLong();

    @Override
    public void onAttemptStart(RetryContext context) {
        attempts.increment();
    }

    @Override
    public void onAttemptFailure(RetryContext context, Throwable error, ErrorClass errorClass) {
        switch (errorClass) {
            case TRANSIENT_RETRYABLE -> transientFailures.increment();
            case NON_RETRYABLE -> nonRetryableFailures.increment();
            case UNKNOWN -> unknownFailures.increment();
        }
    }

    @Override
    public void onRetryScheduled(RetryContext context, Duration delay) {
        retriesScheduled.increment();
        scheduledDelayNanos.addAndGet(delay.toNanos());
    }

    @Override
    public void onAttemptSuccess(RetryContext context) {
        successes.increment();
    }

    @Override
    public void onAttemptsExhausted(RetryContext context, Throwable error) {
        exhausted.increment();
    }

    /**
     * Returns a snapshot of the counters.
     *
     * @return current statistics
     */
    public Stats getStats() {
        return new Stats(
                attempts.sum(),
                successes.sum(),
                transientFailures.sum(),
                nonRetryableFailures.sum(),
                unknownFailures.sum(),
                retriesScheduled.sum(),
                exhausted.sum(),
                Duration.ofNanos(scheduledDelayNanos.get()));
    }

    /**
     * Immutable snapshot of retry statistics.
     *
     * @param attempts number of attempts started
     * @param successes number of successful attempts
     * @param transientFailures failures classified as transient
     * @param nonRetryableFailures failures classified as non-retryable
     * @param unknownFailures failures the classifier did not recognize
     * @param retriesScheduled number of retries scheduled
     * @param exhausted sequences that ran out of attempts
     * @param totalScheduledDelay sum of all scheduled delays
     */
    public record Stats(
            long attempts,
            long successes,
            long transientFailures,
            long nonRetryableFailures,
            long unknownFailures,
            long retriesScheduled,
            long exhausted,
            Duration totalScheduledDelay) {

        /**
         * Returns the total number of failed attempts.
         *
         * @return failures of every class
         */
        public long failures() {
            return transientFailures + nonRetryableFailures + unknownFailures;
        }

        /**
         * Returns the attempt success rate as a percentage (0-100).
         *
         * @return the success rate, or 100 if no attempt finished
         */
        public double successRate() {
            long finished = successes + failures();
            return finished == 0 ? 100.0 : (successes * 100.0) / finished;
        }

        @Override
        public String toString() {
            return String.format(
                    "Stats[attempts=%d, successes=%d, failures=%d, retries=%d, exhausted=%d,"
                            + " delay=%dms, successRate=%.1f%%]",
                    attempts,
                    successes,
                    failures(),
                    retriesScheduled,
                    exhausted,
                    totalScheduledDelay.toMillis(),
                    successRate());
        }
    }
}
