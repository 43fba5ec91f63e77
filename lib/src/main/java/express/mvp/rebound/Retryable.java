package express.mvp.rebound;

import express.mvp.rebound.policy.RetryPolicy;

/**
 * Mixin for services that retry their own operations.
 *
 * <p>Implementors provide the coordinator (usually injected through the constructor) and get
 * {@code performWithRetry} helpers for free:
 *
 * <pre>{@code
 * final class ProfileRepository implements Retryable {
 *     private final RetryCoordinator coordinator;
 *
 *     ProfileRepository(RetryCoordinator coordinator) {
 *         this.coordinator = coordinator;
 *     }
 *
 *     @Override
 *     public RetryCoordinator retryCoordinator() {
 *         return coordinator;
 *     }
 *
 *     Profile load(String id) throws Exception {
 *         return performWithRetry(() -> store.get(id));
 *     }
 * }
 * }</pre>
 */
public interface Retryable {

    /**
     * Returns the coordinator used by the helpers.
     *
     * @return the coordinator
     */
    RetryCoordinator retryCoordinator();

    /**
     * Runs an operation with the given policy.
     *
     * @param policy the retry policy
     * @param operation the operation
     * @param <T> the result type
     * @return the operation's result
     * @throws Exception the last attempt's error
     */
    default <T> T performWithRetry(RetryPolicy policy, RetryableOperation<T> operation)
            throws Exception {
        return retryCoordinator().run(getClass().getSimpleName(), policy, operation);
    }

    /**
     * Runs an operation with {@link RetryPolicy#defaults()}.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the operation's result
     * @throws Exception the last attempt's error
     */
    default <T> T performWithRetry(RetryableOperation<T> operation) throws Exception {
        return performWithRetry(RetryPolicy.defaults(), operation);
    }
}
