package express.mvp.rebound.policy;

import java.time.Duration;

/**
 * Computes how long to wait before the next attempt.
 *
 * <p>The coordinator owns the growth of the base delay ({@link RetryPolicy#grow(Duration)});
 * a backoff policy only turns the current base delay into the actual wait, for example by
 * adding jitter. Results must lie in {@code [0, policy.getMaxDelay()]}, with the exception of
 * {@link RateLimitAwareBackoff}, which may stretch a rate-limited wait past the cap.
 *
 * <p>The coordinator calls {@link #nextDelay(int, Duration, Throwable, RetryPolicy)}, which
 * also receives the number of the failed attempt and its error. Its default ignores both and
 * delegates to {@link #nextDelay(Duration, RetryPolicy)}; attempt-based strategies and
 * error-aware decorators override it.
 *
 * <p>Implementations must be safe to call from concurrent retry loops.
 *
 * @see JitteredBackoff
 * @see StrategyBackoff
 * @see RateLimitAwareBackoff
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * Returns the delay to wait before the next attempt.
     *
     * @param currentDelay the current base delay
     * @param policy the retry policy supplying the cap
     * @return the delay, within {@code [0, policy.getMaxDelay()]}
     */
    Duration nextDelay(Duration currentDelay, RetryPolicy policy);

    /**
     * Returns the delay to wait after a failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @param currentDelay the current base delay
     * @param error the failed attempt's error
     * @param policy the retry policy supplying the cap
     * @return the delay
     */
    default Duration nextDelay(
            int failedAttempt, Duration currentDelay, Throwable error, RetryPolicy policy) {
        return nextDelay(currentDelay, policy);
    }
}
