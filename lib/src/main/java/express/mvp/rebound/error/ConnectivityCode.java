package express.mvp.rebound.error;

/**
 * Symbolic codes for {@link ErrorDomain#CONNECTIVITY} and {@link ErrorDomain#TRANSPORT} errors.
 *
 * <p>Numeric values follow the widely used URL loading error codes so that errors crossing a
 * platform boundary keep their original number.
 */
public enum ConnectivityCode {
    CANCELLED(-999),
    BAD_URL(-1000),
    TIMED_OUT(-1001),
    CANNOT_FIND_HOST(-1003),
    CANNOT_CONNECT_TO_HOST(-1004),
    NETWORK_CONNECTION_LOST(-1005),
    DNS_LOOKUP_FAILED(-1006),
    RESOURCE_UNAVAILABLE(-1008),
    NOT_CONNECTED_TO_INTERNET(-1009),
    SECURE_CONNECTION_FAILED(-1200),
    SERVER_CERTIFICATE_BAD_DATE(-1201),
    SERVER_CERTIFICATE_UNTRUSTED(-1202);

    private final int code;

    ConnectivityCode(int code) {
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
