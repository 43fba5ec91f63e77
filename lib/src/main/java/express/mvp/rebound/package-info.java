/**
 * Retry-with-backoff coordination for fallible operations.
 *
 * <p>This package defines the coordinator that re-executes operations on transient failure,
 * along with the operation, outcome and callback contracts it works with.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.rebound.RetryCoordinator} - Runs the retry loop (blocking, async,
 *       callback)
 *   <li>{@link express.mvp.rebound.RetryableOperation} - Blocking operation, one call per attempt
 *   <li>{@link express.mvp.rebound.AsyncOperation} - Operation returning a completion stage
 *   <li>{@link express.mvp.rebound.RetryContext} - State of one retry sequence
 *   <li>{@link express.mvp.rebound.Retryable} - Mixin for services with an injected coordinator
 * </ul>
 *
 * @see express.mvp.rebound.policy.RetryPolicy
 * @see express.mvp.rebound.error.TableErrorClassifier
 */
package express.mvp.rebound;
