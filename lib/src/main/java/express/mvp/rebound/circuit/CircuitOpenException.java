package express.mvp.rebound.circuit;

import java.time.Instant;

/**
 * Thrown instead of running an attempt while a service's circuit is open.
 *
 * <p>The coordinator never retries this exception: waiting out the cooldown is the caller's
 * decision, and {@link #getResetAt()} tells when the circuit lets attempts through again.
 */
public class CircuitOpenException extends RuntimeException {

    private final String serviceName;
    private final Instant resetAt;

    /**
     * Constructs a new circuit-open exception.
     *
     * @param serviceName the protected service
     * @param resetAt when the cooldown ends
     */
    public CircuitOpenException(String serviceName, Instant resetAt) {
        super("Circuit for '" + serviceName + "' is open until " + resetAt);
        this.serviceName = serviceName;
        this.resetAt = resetAt;
    }

    /**
     * Returns the name of the protected service.
     *
     * @return service name
     */
    public String getServiceName() {
        return serviceName;
    }

    /**
     * Returns when the circuit lets attempts through again.
     *
     * @return end of the cooldown
     */
    public Instant getResetAt() {
        return resetAt;
    }
}
