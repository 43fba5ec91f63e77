package express.mvp.rebound.error;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies failures by looking up their (domain, code) pair in an immutable table.
 *
 * <p>The table is consulted for (domain, code) pairs. A throwable is searched along its cause
 * chain for the first link that carries one: an {@link OperationException}, or a plain JDK
 * transport failure that {@link ExceptionTranslator} maps outside the application domain (a
 * {@code SocketTimeoutException} thrown by a socket read, or an {@code HttpTimeoutException}
 * completing an {@code HttpClient.sendAsync} future). If no link carries a pair the failure is
 * {@link ErrorClass#UNKNOWN}.
 *
 * <h2>Standard Table</h2>
 *
 * <table border="1">
 *   <caption>Standard classification</caption>
 *   <tr><th>Domain</th><th>Retryable codes</th><th>Everything else</th></tr>
 *   <tr><td>CONNECTIVITY</td><td>timed out, cannot find host, cannot connect, connection lost,
 *       DNS failure, resource unavailable, TLS and certificate failures</td>
 *       <td>NON_RETRYABLE (including not connected to internet)</td></tr>
 *   <tr><td>BACKEND_SERVICE</td><td>unavailable, deadline exceeded, aborted, internal,
 *       storage unknown</td><td>NON_RETRYABLE (including retry limit exceeded)</td></tr>
 *   <tr><td>TRANSPORT</td><td>timed out, cannot find host, cannot connect, connection
 *       lost</td><td>NON_RETRYABLE</td></tr>
 *   <tr><td>APPLICATION</td><td>none</td><td>UNKNOWN</td></tr>
 * </table>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances are immutable and can be shared by any number of concurrent retry loops.
 *
 * @see ErrorClassifier
 */
public final class TableErrorClassifier implements ErrorClassifier {

    /** Maximum depth searched along a cause chain. */
    private static final int MAX_CAUSE_DEPTH = 16;

    private static final TableErrorClassifier STANDARD = buildStandard();

    /** Explicit rules per domain, keyed by numeric code. */
    private final Map<ErrorDomain, Map<Integer, ErrorClass>> rules;

    /** Class used when a domain has no rule for a code. */
    private final Map<ErrorDomain, ErrorClass> fallbacks;

    private TableErrorClassifier(Builder builder) {
        Map<ErrorDomain, Map<Integer, ErrorClass>> copy = new EnumMap<>(ErrorDomain.class);
        for (Map.Entry<ErrorDomain, Map<Integer, ErrorClass>> entry : builder.rules.entrySet()) {
            copy.put(
                    entry.getKey(), Collections.unmodifiableMap(new HashMap<>(entry.getValue())));
        }
        this.rules = Collections.unmodifiableMap(copy);
        this.fallbacks = Collections.unmodifiableMap(new EnumMap<>(builder.fallbacks));
    }

    /**
     * Returns the standard classifier for connectivity, backend service and transport errors.
     *
     * @return the shared standard classifier
     */
    public static TableErrorClassifier standard() {
        return STANDARD;
    }

    /**
     * Returns an empty builder. Every domain without a fallback classifies as {@link
     * ErrorClass#UNKNOWN}.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this classifier's table.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (Map.Entry<ErrorDomain, Map<Integer, ErrorClass>> entry : rules.entrySet()) {
            builder.rules.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        builder.fallbacks.putAll(fallbacks);
        return builder;
    }

    @Override
    public ErrorClass classify(Throwable error) {
        OperationException structured = findStructured(error);
        if (structured == null) {
            return ErrorClass.UNKNOWN;
        }
        return classify(structured.domain(), structured.code());
    }

    /**
     * Classifies a (domain, code) pair directly.
     *
     * @param domain the error domain
     * @param code the numeric code
     * @return the retry eligibility
     */
    public ErrorClass classify(ErrorDomain domain, int code) {
        Map<Integer, ErrorClass> domainRules = rules.get(domain);
        if (domainRules != null) {
            ErrorClass explicit = domainRules.get(code);
            if (explicit != null) {
                return explicit;
            }
        }
        return fallbacks.getOrDefault(domain, ErrorClass.UNKNOWN);
    }

    /**
     * Finds the first structured error along the cause chain. Plain exceptions are translated;
     * a translation into the application domain carries no signal and the search continues.
     */
    private static OperationException findStructured(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof OperationException) {
                return (OperationException) current;
            }
            OperationException translated = ExceptionTranslator.translate(current);
            if (translated.domain() != ErrorDomain.APPLICATION) {
                return translated;
            }
            Throwable cause = current.getCause();
            if (cause == current) {
                return null;
            }
            current = cause;
        }
        return null;
    }

    private static TableErrorClassifier buildStandard() {
        Builder builder = builder();

        ConnectivityCode[] transientConnectivity = {
            ConnectivityCode.TIMED_OUT,
            ConnectivityCode.CANNOT_FIND_HOST,
            ConnectivityCode.CANNOT_CONNECT_TO_HOST,
            ConnectivityCode.NETWORK_CONNECTION_LOST,
            ConnectivityCode.DNS_LOOKUP_FAILED,
            ConnectivityCode.RESOURCE_UNAVAILABLE,
            ConnectivityCode.SECURE_CONNECTION_FAILED,
            ConnectivityCode.SERVER_CERTIFICATE_BAD_DATE,
            ConnectivityCode.SERVER_CERTIFICATE_UNTRUSTED
        };
        for (ConnectivityCode code : transientConnectivity) {
            builder.rule(ErrorDomain.CONNECTIVITY, code, ErrorClass.TRANSIENT_RETRYABLE);
        }
        // No network path at all: another attempt cannot help
        builder.rule(
                ErrorDomain.CONNECTIVITY,
                ConnectivityCode.NOT_CONNECTED_TO_INTERNET,
                ErrorClass.NON_RETRYABLE);
        builder.fallback(ErrorDomain.CONNECTIVITY, ErrorClass.NON_RETRYABLE);

        ServiceCode[] transientService = {
            ServiceCode.UNAVAILABLE,
            ServiceCode.DEADLINE_EXCEEDED,
            ServiceCode.ABORTED,
            ServiceCode.INTERNAL,
            ServiceCode.STORAGE_UNKNOWN
        };
        for (ServiceCode code : transientService) {
            builder.rule(code, ErrorClass.TRANSIENT_RETRYABLE);
        }
        builder.rule(ServiceCode.RETRY_LIMIT_EXCEEDED, ErrorClass.NON_RETRYABLE);
        builder.fallback(ErrorDomain.BACKEND_SERVICE, ErrorClass.NON_RETRYABLE);

        ConnectivityCode[] transientTransport = {
            ConnectivityCode.TIMED_OUT,
            ConnectivityCode.CANNOT_FIND_HOST,
            ConnectivityCode.CANNOT_CONNECT_TO_HOST,
            ConnectivityCode.NETWORK_CONNECTION_LOST
        };
        for (ConnectivityCode code : transientTransport) {
            builder.rule(ErrorDomain.TRANSPORT, code, ErrorClass.TRANSIENT_RETRYABLE);
        }
        builder.fallback(ErrorDomain.TRANSPORT, ErrorClass.NON_RETRYABLE);

        return builder.build();
    }

    @Override
    public String toString() {
        int ruleCount = rules.values().stream().mapToInt(Map::size).sum();
        return "TableErrorClassifier[rules=" + ruleCount + ", fallbacks=" + fallbacks + "]";
    }

    /**
     * Builder for {@link TableErrorClassifier}.
     */
    public static final class Builder {
        private final Map<ErrorDomain, Map<Integer, ErrorClass>> rules =
                new EnumMap<>(ErrorDomain.class);
        private final Map<ErrorDomain, ErrorClass> fallbacks = new EnumMap<>(ErrorDomain.class);

        private Builder() {}

        /**
         * Adds or replaces the rule for a (domain, code) pair.
         *
         * @param domain the error domain
         * @param code the numeric code
         * @param errorClass the class to assign
         * @return this builder
         */
        public Builder rule(ErrorDomain domain, int code, ErrorClass errorClass) {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(errorClass, "errorClass");
            rules.computeIfAbsent(domain, d -> new HashMap<>()).put(code, errorClass);
            return this;
        }

        /**
         * Adds or replaces the rule for a connectivity or transport code.
         *
         * @param domain the error domain
         * @param code the symbolic code
         * @param errorClass the class to assign
         * @return this builder
         */
        public Builder rule(ErrorDomain domain, ConnectivityCode code, ErrorClass errorClass) {
            return rule(domain, code.code(), errorClass);
        }

        /**
         * Adds or replaces the rule for a backend service code.
         *
         * @param code the symbolic code
         * @param errorClass the class to assign
         * @return this builder
         */
        public Builder rule(ServiceCode code, ErrorClass errorClass) {
            return rule(ErrorDomain.BACKEND_SERVICE, code.code(), errorClass);
        }

        /**
         * Sets the class used for codes of a domain that have no explicit rule.
         *
         * @param domain the error domain
         * @param errorClass the fallback class
         * @return this builder
         */
        public Builder fallback(ErrorDomain domain, ErrorClass errorClass) {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(errorClass, "errorClass");
            fallbacks.put(domain, errorClass);
            return this;
        }

        /**
         * Builds the classifier.
         *
         * @return new immutable classifier
         */
        public TableErrorClassifier build() {
            return new TableErrorClassifier(this);
        }
    }
}
