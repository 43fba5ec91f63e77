package express.mvp.rebound.error;

/**
 * Retry eligibility of a failed attempt.
 *
 * <p>Every failure observed by the coordinator is mapped to exactly one class:
 *
 * <ul>
 *   <li><b>TRANSIENT_RETRYABLE:</b> Expected to clear on its own, retry after a backoff delay
 *   <li><b>NON_RETRYABLE:</b> Retrying cannot help, surface the error now
 *   <li><b>UNKNOWN:</b> Unrecognized failure, treated as non-retryable
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorClass errorClass = classifier.classify(error);
 * if (errorClass.isRetryable()) {
 *     // schedule the next attempt
 * } else {
 *     throw error;
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 */
public enum ErrorClass {

    /**
     * Failures expected to resolve without intervention.
     *
     * <p>Examples:
     *
     * <ul>
     *   <li>Request timed out
     *   <li>Host unreachable or connection lost
     *   <li>Backend service unavailable or overloaded
     *   <li>Transaction aborted due to contention
     * </ul>
     */
    TRANSIENT_RETRYABLE(true, "Transient error - may succeed on retry"),

    /**
     * Failures that another attempt cannot fix.
     *
     * <p>Examples:
     *
     * <ul>
     *   <li>No network connectivity at all
     *   <li>Permission denied or invalid argument
     *   <li>Retry budget already exhausted upstream
     * </ul>
     */
    NON_RETRYABLE(false, "Non-retryable error - fail immediately"),

    /**
     * Failures the classifier does not recognize.
     *
     * <p>Unfamiliar errors fail fast instead of being retried blindly.
     */
    UNKNOWN(false, "Unknown error - treated as non-retryable");

    private final boolean retryable;
    private final String description;

    ErrorClass(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    /**
     * Checks if failures of this class should be retried.
     *
     * <p>Even for a retryable class the coordinator stops once the policy's attempt budget is
     * spent.
     *
     * @return true only for {@link #TRANSIENT_RETRYABLE}
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns a human-readable description of this class.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
