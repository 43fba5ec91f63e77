package express.mvp.rebound.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff whose base delay follows a {@link BackoffStrategy} of the failed attempt number.
 *
 * <p>Formula: {@code base = initialDelay * strategy.factor(n, multiplier)}, then the base goes
 * through a {@link JitteredBackoff}, which applies jitter and the policy cap. The current base
 * delay tracked by the coordinator is ignored, so the policy multiplier only matters for
 * {@link BackoffStrategy#EXPONENTIAL}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryCoordinator coordinator = RetryCoordinator.builder()
 *     .backoff(new StrategyBackoff(BackoffStrategy.FIBONACCI))
 *     .build();
 * }</pre>
 *
 * <p>Called without an attempt number ({@link #nextDelay(Duration, RetryPolicy)}), the current
 * delay is jittered as-is.
 */
public final class StrategyBackoff implements BackoffPolicy {

    private final BackoffStrategy strategy;
    private final JitteredBackoff jitter;

    /**
     * Creates a strategy backoff with random jitter.
     *
     * @param strategy the delay shape
     */
    public StrategyBackoff(BackoffStrategy strategy) {
        this(strategy, new JitteredBackoff());
    }

    /**
     * Creates a strategy backoff with the given jitter source.
     *
     * @param strategy the delay shape
     * @param jitter jitter and cap, {@link JitteredBackoff#noJitter()} for exact delays
     */
    public StrategyBackoff(BackoffStrategy strategy, JitteredBackoff jitter) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    /**
     * Returns the delay shape.
     *
     * @return strategy
     */
    public BackoffStrategy getStrategy() {
        return strategy;
    }

    @Override
    public Duration nextDelay(Duration currentDelay, RetryPolicy policy) {
        return jitter.nextDelay(currentDelay, policy);
    }

    @Override
    public Duration nextDelay(
            int failedAttempt, Duration currentDelay, Throwable error, RetryPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        return jitter.nextDelay(baseDelay(failedAttempt, policy), policy);
    }

    /**
     * Computes the un-jittered, uncapped base delay.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @param policy the policy supplying initial delay and multiplier
     * @return base delay, saturated at {@link RetryPolicy#MAX_SUPPORTED_DELAY}
     */
    Duration baseDelay(int failedAttempt, RetryPolicy policy) {
        double nanos =
                RetryPolicy.saturatedNanos(policy.getInitialDelay())
                        * strategy.factor(failedAttempt, policy.getMultiplier());
        if (nanos >= Long.MAX_VALUE) {
            return RetryPolicy.MAX_SUPPORTED_DELAY;
        }
        return Duration.ofNanos((long) nanos);
    }

    @Override
    public String toString() {
        return "StrategyBackoff[" + strategy + ", " + jitter + "]";
    }
}
