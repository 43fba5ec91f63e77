package express.mvp.rebound;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a retry sequence is cancelled while waiting between attempts.
 *
 * <p>Cancellation is never reported as an ordinary failure of the operation: the caller's
 * thread was interrupted (blocking form) or the returned future was cancelled (asynchronous
 * form), and no further attempt is made. The error of the attempt that preceded the wait, if
 * any, is available as the {@linkplain #getCause() cause}.
 *
 * <p>In the blocking form the interrupt flag of the calling thread is restored before this
 * exception is thrown.
 */
public class RetryCancelledException extends CancellationException {

    private final String operationName;
    private final int attempts;

    /**
     * Constructs a new cancellation exception.
     *
     * @param operationName the cancelled operation
     * @param attempts number of attempts made before cancellation
     * @param lastError error of the last attempt, may be null
     */
    public RetryCancelledException(String operationName, int attempts, Throwable lastError) {
        super("Retry of '" + operationName + "' cancelled after " + attempts + " attempt(s)");
        this.operationName = operationName;
        this.attempts = attempts;
        if (lastError != null) {
            initCause(lastError);
        }
    }

    /**
     * Returns the name of the cancelled operation.
     *
     * @return operation name
     */
    public String getOperationName() {
        return operationName;
    }

    /**
     * Returns the number of attempts made before cancellation.
     *
     * @return attempts
     */
    public int getAttempts() {
        return attempts;
    }
}
