package express.mvp.rebound.error;

/**
 * Symbolic codes for {@link ErrorDomain#BACKEND_SERVICE} errors.
 *
 * <p>Positive values are the standard RPC status codes shared by most managed database and
 * storage backends. Negative values are storage-specific codes.
 */
public enum ServiceCode {
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    INTERNAL(13),
    UNAVAILABLE(14),
    UNAUTHENTICATED(16),

    /** Storage backend could not describe the failure. */
    STORAGE_UNKNOWN(-13000),

    /** Storage client already spent its own retry budget. */
    RETRY_LIMIT_EXCEEDED(-13010);

    private final int code;

    ServiceCode(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric code.
     *
     * @return the code
     */
    public int code() {
        return code;
    }
}
