package express.mvp.rebound.error;

/**
 * Maps a failure to its retry eligibility.
 *
 * <p>Implementations must be pure: the same error always yields the same class, no I/O is
 * performed and no state is mutated. A single instance is shared by every concurrent retry
 * loop of a coordinator, so implementations must also be safe to call without
 * synchronization.
 *
 * <p>New (domain, code) pairs are added by building a new classifier, never by changing the
 * coordinator:
 *
 * <pre>{@code
 * ErrorClassifier classifier = TableErrorClassifier.standard().toBuilder()
 *         .rule(ErrorDomain.BACKEND_SERVICE, ServiceCode.RESOURCE_EXHAUSTED.code(),
 *               ErrorClass.TRANSIENT_RETRYABLE)
 *         .build();
 * }</pre>
 *
 * @see TableErrorClassifier
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param error the failure, may be null
     * @return the retry eligibility, never null
     */
    ErrorClass classify(Throwable error);

    /**
     * Returns a detailed description of the classification result.
     *
     * @param error the failure to describe
     * @return formatted description including class and details
     */
    default String describe(Throwable error) {
        if (error == null) {
            return "null exception";
        }

        ErrorClass errorClass = classify(error);
        StringBuilder sb = new StringBuilder();
        sb.append("Class: ").append(errorClass.name());
        sb.append("\nRetryable: ").append(errorClass.isRetryable());
        sb.append("\nType: ").append(error.getClass().getName());
        if (error instanceof OperationException) {
            OperationException op = (OperationException) error;
            sb.append("\nDomain: ").append(op.domain());
            sb.append("\nCode: ").append(op.code());
        }
        sb.append("\nMessage: ").append(error.getMessage());

        Throwable cause = error.getCause();
        if (cause != null) {
            sb.append("\nCause: ").append(cause.getClass().getSimpleName());
            sb.append(" - ").append(cause.getMessage());
        }

        return sb.toString();
    }
}
