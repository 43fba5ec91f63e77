package express.mvp.rebound;

import java.util.concurrent.CompletionStage;

/**
 * A fallible operation that completes asynchronously.
 *
 * <p>Each call starts one attempt and returns a stage that completes with the result or
 * exceptionally with the failure. Throwing from {@link #call()} counts as a failed attempt as
 * well. The operation may use its own threads and timeouts; the coordinator only observes the
 * stage's single outcome.
 *
 * @param <T> the result type
 * @see RetryCoordinator
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    /**
     * Starts one attempt.
     *
     * @return stage completing with the attempt's outcome, must not be null
     * @throws Exception if the attempt cannot be started
     */
    CompletionStage<T> call() throws Exception;
}
