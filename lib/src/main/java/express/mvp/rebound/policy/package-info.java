/**
 * Retry budgets and backoff computation.
 *
 * <ul>
 *   <li>{@link express.mvp.rebound.policy.RetryPolicy} - Attempt budget, delays and presets
 *   <li>{@link express.mvp.rebound.policy.BackoffPolicy} - Delay before the next attempt
 *   <li>{@link express.mvp.rebound.policy.JitteredBackoff} - Capped delay with 0.8-1.2 jitter
 * </ul>
 */
package express.mvp.rebound.policy;
