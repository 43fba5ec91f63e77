package express.mvp.rebound.error;

import java.util.Objects;

/**
 * Unchecked exception carrying a structured description of a failed operation.
 *
 * <p>Operations raise this exception at the boundary where the underlying call fails, so that
 * classification works on a closed, typed representation ({@link ErrorDomain} plus numeric
 * code) rather than on exception types or message text. It extends {@link RuntimeException}
 * to avoid cluttering operation signatures with checked exceptions.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * try {
 *     return storage.write(blob);
 * } catch (StorageClientException e) {
 *     throw new OperationException(
 *             ErrorDomain.BACKEND_SERVICE, e.statusCode(), "Blob write failed", e);
 * }
 * }</pre>
 *
 * <p>Failures raised as plain JDK exceptions can be converted with {@link
 * ExceptionTranslator#translate(Throwable)}.
 *
 * @see ErrorClassifier
 */
public class OperationException extends RuntimeException {

    private final ErrorDomain domain;
    private final int code;

    /**
     * Constructs a new operation exception.
     *
     * @param domain the domain that produced the failure
     * @param code the domain-specific numeric code
     * @param message the detail message describing the failure
     */
    public OperationException(ErrorDomain domain, int code, String message) {
        this(domain, code, message, null);
    }

    /**
     * Constructs a new operation exception with an underlying cause.
     *
     * @param domain the domain that produced the failure
     * @param code the domain-specific numeric code
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure, may be null
     */
    public OperationException(ErrorDomain domain, int code, String message, Throwable cause) {
        super(message, cause);
        this.domain = Objects.requireNonNull(domain, "domain");
        this.code = code;
    }

    /**
     * Constructs a connectivity or transport exception from a symbolic code.
     *
     * @param domain {@link ErrorDomain#CONNECTIVITY} or {@link ErrorDomain#TRANSPORT}
     * @param code the symbolic code
     * @param message the detail message
     */
    public OperationException(ErrorDomain domain, ConnectivityCode code, String message) {
        this(domain, code.code(), message, null);
    }

    /**
     * Constructs a backend service exception from a symbolic code.
     *
     * @param code the symbolic code
     * @param message the detail message
     */
    public OperationException(ServiceCode code, String message) {
        this(ErrorDomain.BACKEND_SERVICE, code.code(), message, null);
    }

    /**
     * Returns the domain that produced the failure.
     *
     * @return the domain
     */
    public ErrorDomain domain() {
        return domain;
    }

    /**
     * Returns the domain-specific numeric code.
     *
     * @return the code
     */
    public int code() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "[domain=" + domain
                + ", code=" + code
                + ", message=" + getMessage()
                + "]";
    }
}
