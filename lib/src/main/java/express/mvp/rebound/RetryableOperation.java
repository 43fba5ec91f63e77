package express.mvp.rebound;

import express.mvp.rebound.error.ExceptionTranslator;
import java.util.Objects;

/**
 * A fallible operation that completes on the calling thread.
 *
 * <p>The coordinator invokes the operation once per attempt. Each call either returns a value
 * (which may be null) or throws.
 *
 * @param <T> the result type
 * @see AsyncOperation
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * Performs one attempt.
     *
     * @return the result
     * @throws Exception if the attempt fails
     */
    T call() throws Exception;

    /**
     * Wraps an operation so that every failure is converted into a structured {@link
     * express.mvp.rebound.error.OperationException} by {@link ExceptionTranslator}.
     *
     * @param operation the operation to wrap
     * @param <T> the result type
     * @return translating operation
     */
    static <T> RetryableOperation<T> translating(RetryableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return () -> {
            try {
                return operation.call();
            } catch (Exception e) {
                throw ExceptionTranslator.translate(e);
            }
        };
    }
}
