package express.mvp.rebound.circuit;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one {@link CircuitBreaker} per service name.
 *
 * <p>Breakers are created on first use with the registry's default config unless a config is
 * given for that first use. Later lookups return the same breaker whatever config they pass.
 *
 * <pre>{@code
 * CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults());
 * RetryCoordinator coordinator = RetryCoordinator.builder().circuitBreakers(breakers).build();
 * ...
 * List<String> degraded = breakers.unhealthyServices();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe.
 */
public final class CircuitBreakerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig defaultConfig;
    private final Clock clock;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    /** Creates a registry using {@link CircuitBreakerConfig#defaults()}. */
    public CircuitBreakerRegistry() {
        this(CircuitBreakerConfig.defaults());
    }

    /**
     * Creates a registry with a default config and the system clock.
     *
     * @param defaultConfig config for breakers created without one
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this(defaultConfig, Clock.systemUTC());
    }

    /**
     * Creates a registry.
     *
     * @param defaultConfig config for breakers created without one
     * @param clock time source handed to every breaker
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig, Clock clock) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the breaker for a service, creating it with the default config.
     *
     * @param serviceName the service
     * @return the service's breaker
     */
    public CircuitBreaker breakerFor(String serviceName) {
        return breakerFor(serviceName, defaultConfig);
    }

    /**
     * Returns the breaker for a service, creating it with the given config.
     *
     * @param serviceName the service
     * @param config config used only if the breaker does not exist yet
     * @return the service's breaker
     */
    public CircuitBreaker breakerFor(String serviceName, CircuitBreakerConfig config) {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(config, "config");
        return breakers.computeIfAbsent(
                serviceName, name -> new CircuitBreaker(name, config, clock));
    }

    /**
     * Returns the breaker for a service if it exists.
     *
     * @param serviceName the service
     * @return the breaker, or empty
     */
    public Optional<CircuitBreaker> find(String serviceName) {
        return Optional.ofNullable(breakers.get(serviceName));
    }

    /**
     * Returns a status snapshot of every breaker.
     *
     * @return statuses in no particular order
     */
    public List<CircuitBreaker.Status> statuses() {
        return breakers.values().stream()
                .map(CircuitBreaker::getStatus)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the services whose circuit is not closed.
     *
     * @return service names in no particular order
     */
    public List<String> unhealthyServices() {
        return breakers.values().stream()
                .filter(breaker -> breaker.getState() != CircuitState.CLOSED)
                .map(CircuitBreaker::getServiceName)
                .collect(Collectors.toUnmodifiableList());
    }

    /** Resets every breaker to closed. */
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        LOG.info("Reset {} circuit breaker(s)", breakers.size());
    }

    @Override
    public String toString() {
        return "CircuitBreakerRegistry[breakers=" + breakers.keySet() + "]";
    }
}
