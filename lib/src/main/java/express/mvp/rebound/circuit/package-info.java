/**
 * Per-service circuit breakers.
 *
 * <p>A {@link express.mvp.rebound.circuit.CircuitBreaker} stops attempts against a service
 * after repeated failures and lets them through again once a cooldown has passed. When a
 * {@link express.mvp.rebound.circuit.CircuitBreakerRegistry} is given to the coordinator, every
 * named retry sequence consults the breaker of its operation name before each attempt.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.rebound.circuit.CircuitBreaker} - Sliding-window failure counting
 *   <li>{@link express.mvp.rebound.circuit.CircuitState} - Closed, open, half-open
 *   <li>{@link express.mvp.rebound.circuit.CircuitBreakerConfig} - Thresholds and presets
 *   <li>{@link express.mvp.rebound.circuit.CircuitBreakerRegistry} - One breaker per service
 *   <li>{@link express.mvp.rebound.circuit.CircuitOpenException} - Refused attempt
 * </ul>
 */
package express.mvp.rebound.circuit;
