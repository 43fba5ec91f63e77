package express.mvp.rebound.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refuses attempts against a service after repeated failures until it has had time to recover.
 *
 * <p>The breaker counts failures inside a sliding window. Reaching the failure threshold opens
 * the circuit: {@link #acquirePermission()} then throws {@link CircuitOpenException} until the
 * cooldown has elapsed. The first permission request after the cooldown moves the circuit to
 * half-open, where attempts pass again; enough successes close it, any failure reopens it. A
 * failure reported while the circuit is open restarts the cooldown.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CircuitBreaker breaker = registry.breakerFor("profile-service");
 * breaker.acquirePermission();
 * try {
 *     Profile profile = api.fetch(id);
 *     breaker.recordSuccess();
 *     return profile;
 * } catch (IOException e) {
 *     breaker.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe; state changes are serialized on the breaker's monitor.
 *
 * @see CircuitBreakerRegistry
 * @see CircuitState
 */
public final class CircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String serviceName;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    /** Failure times inside the window, oldest first. */
    private final Deque<Instant> failures = new ArrayDeque<>();

    private CircuitState state = CircuitState.CLOSED;
    private int successCount;
    private Instant openedAt;
    private Instant lastFailureTime;

    /**
     * Creates a closed breaker using the system clock.
     *
     * @param serviceName the protected service
     * @param config the thresholds
     */
    public CircuitBreaker(String serviceName, CircuitBreakerConfig config) {
        this(serviceName, config, Clock.systemUTC());
    }

    /**
     * Creates a closed breaker.
     *
     * @param serviceName the protected service
     * @param config the thresholds
     * @param clock time source for windows and cooldowns
     */
    public CircuitBreaker(String serviceName, CircuitBreakerConfig config, Clock clock) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getServiceName() {
        return serviceName;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Returns the current state without advancing it.
     *
     * @return current state
     */
    public synchronized CircuitState getState() {
        return state;
    }

    /**
     * Checks whether an attempt may run now.
     *
     * @throws CircuitOpenException if the circuit is open and the cooldown has not elapsed
     */
    public synchronized void acquirePermission() {
        if (state != CircuitState.OPEN) {
            return;
        }
        Instant resetAt = openedAt.plus(config.getCooldown());
        if (clock.instant().isBefore(resetAt)) {
            throw new CircuitOpenException(serviceName, resetAt);
        }
        transitionTo(CircuitState.HALF_OPEN);
    }

    /** Records a successful attempt. */
    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED:
                evictExpired();
                break;
            case HALF_OPEN:
                successCount++;
                if (successCount >= config.getSuccessThreshold()) {
                    failures.clear();
                    successCount = 0;
                    transitionTo(CircuitState.CLOSED);
                }
                break;
            case OPEN:
            default:
                transitionTo(CircuitState.CLOSED);
                break;
        }
    }

    /**
     * Records a failed attempt.
     *
     * @param error the attempt's error, used for logging only
     */
    public synchronized void recordFailure(Throwable error) {
        Instant now = clock.instant();
        lastFailureTime = now;
        failures.addLast(now);
        evictExpired();
        LOG.debug("Circuit for '{}' recorded failure {}: {}", serviceName, failures.size(), error);
        switch (state) {
            case CLOSED:
                if (failures.size() >= config.getFailureThreshold()) {
                    open(now);
                }
                break;
            case HALF_OPEN:
                successCount = 0;
                open(now);
                break;
            case OPEN:
            default:
                openedAt = now;
                break;
        }
    }

    /** Closes the circuit and forgets all failures. */
    public synchronized void reset() {
        failures.clear();
        successCount = 0;
        openedAt = null;
        lastFailureTime = null;
        transitionTo(CircuitState.CLOSED);
        LOG.info("Circuit for '{}' reset", serviceName);
    }

    /**
     * Returns a snapshot of the breaker.
     *
     * @return current status
     */
    public synchronized Status getStatus() {
        evictExpired();
        Duration untilRetry = Duration.ZERO;
        if (state == CircuitState.OPEN) {
            Duration remaining =
                    Duration.between(clock.instant(), openedAt.plus(config.getCooldown()));
            untilRetry = remaining.isNegative() ? Duration.ZERO : remaining;
        }
        return new Status(
                serviceName,
                state,
                failures.size(),
                successCount,
                (double) failures.size() / config.getFailureThreshold(),
                untilRetry,
                lastFailureTime);
    }

    private void open(Instant now) {
        openedAt = now;
        transitionTo(CircuitState.OPEN);
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(config.getFailureWindow());
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
            failures.removeFirst();
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous == next) {
            return;
        }
        if (next == CircuitState.OPEN) {
            LOG.warn(
                    "Circuit for '{}' opened after {} failure(s), cooling down for {}",
                    serviceName,
                    failures.size(),
                    config.getCooldown());
        } else {
            LOG.info("Circuit for '{}' {} -> {}", serviceName, previous, next);
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker[service=" + serviceName + ", state=" + getState() + "]";
    }

    /**
     * Snapshot of a breaker.
     *
     * @param serviceName the protected service
     * @param state the state when the snapshot was taken
     * @param failureCount failures inside the window
     * @param successCount half-open successes so far
     * @param failureRate failures inside the window divided by the failure threshold
     * @param timeUntilRetry remaining cooldown, zero unless open
     * @param lastFailureTime time of the last failure, null if none
     */
    public record Status(
            String serviceName,
            CircuitState state,
            int failureCount,
            int successCount,
            double failureRate,
            Duration timeUntilRetry,
            Instant lastFailureTime) {

        /**
         * Checks whether the service looks healthy: closed and below half the threshold.
         *
         * @return true if healthy
         */
        public boolean isHealthy() {
            return state == CircuitState.CLOSED && failureRate < 0.5;
        }
    }
}
