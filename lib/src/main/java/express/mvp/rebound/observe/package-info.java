/**
 * Observation hooks for retry sequences.
 *
 * <p>The retry loop itself does not log. Progress is reported through {@link
 * express.mvp.rebound.observe.RetryObserver}; {@link
 * express.mvp.rebound.observe.LoggingRetryObserver} writes it to SLF4J and {@link
 * express.mvp.rebound.observe.CountingRetryObserver} keeps counters.
 */
package express.mvp.rebound.observe;
