package express.mvp.rebound.error;

import java.util.Locale;

/**
 * Family of the component that produced a failure.
 *
 * <p>The domain decides which code table applies to a structured error. Codes are only
 * meaningful inside their domain: {@code 14} is "unavailable" for a backend service but means
 * nothing for a connectivity error.
 *
 * @see OperationException
 * @see ConnectivityCode
 * @see ServiceCode
 */
public enum ErrorDomain {

    /** URL loading and network reachability errors, coded by {@link ConnectivityCode}. */
    CONNECTIVITY,

    /** Managed cloud, storage and database services, coded by {@link ServiceCode}. */
    BACKEND_SERVICE,

    /**
     * Generic transport failures raised outside the URL loading layer, coded by the
     * transport subset of {@link ConnectivityCode}.
     */
    TRANSPORT,

    /** Everything else. Application errors are never retried by the standard table. */
    APPLICATION;

    /**
     * Maps a raw vendor domain tag onto a domain family.
     *
     * <p>Tags naming a cloud service, storage or database (for example
     * {@code "FIRFirestoreErrorDomain"} or {@code "FIRStorageErrorDomain"}) map to
     * {@link #BACKEND_SERVICE}; URL and network tags map to {@link #CONNECTIVITY}; anything
     * else is {@link #APPLICATION}.
     *
     * @param tag the vendor domain tag, may be null
     * @return the matching domain
     */
    public static ErrorDomain fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return APPLICATION;
        }

        String lower = tag.toLowerCase(Locale.ROOT);
        if (lower.contains("firebase")
                || lower.contains("firestore")
                || lower.contains("storage")
                || lower.contains("database")
                || lower.contains("grpc")) {
            return BACKEND_SERVICE;
        }
        if (lower.contains("url") || lower.contains("network") || lower.contains("connectivity")) {
            return CONNECTIVITY;
        }
        if (lower.contains("transport") || lower.contains("socket")) {
            return TRANSPORT;
        }
        return APPLICATION;
    }
}
