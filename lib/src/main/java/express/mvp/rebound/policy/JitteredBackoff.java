package express.mvp.rebound.policy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Backoff that scales the current delay by a random factor in {@code [0.8, 1.2]}.
 *
 * <p>Formula: {@code delay = min(currentDelay * jitter, maxDelay)}. Jitter is drawn for every
 * call and applied to the current base delay before capping, so callers that started retrying
 * at the same moment drift apart instead of hitting the backend in lockstep.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BackoffPolicy backoff = new JitteredBackoff();
 * Duration wait = backoff.nextDelay(Duration.ofSeconds(2), RetryPolicy.defaults());
 * // 1.6s <= wait <= 2.4s
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Thread-safe as long as the random source is. The default source uses {@link
 * ThreadLocalRandom}.
 */
public final class JitteredBackoff implements BackoffPolicy {

    /** Lower bound of the jitter factor. */
    public static final double MIN_JITTER = 0.8;

    /** Upper bound of the jitter factor. */
    public static final double MAX_JITTER = 1.2;

    private static final JitteredBackoff NO_JITTER = new JitteredBackoff(() -> 0.5);

    /** Uniform source in {@code [0, 1)}. */
    private final DoubleSupplier random;

    /** Creates a backoff drawing jitter from {@link ThreadLocalRandom}. */
    public JitteredBackoff() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a backoff drawing jitter from the given source.
     *
     * @param random supplier of uniform values in {@code [0, 1)}
     */
    public JitteredBackoff(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns a backoff whose jitter factor is always 1.0.
     *
     * @return deterministic backoff
     */
    public static JitteredBackoff noJitter() {
        return NO_JITTER;
    }

    /**
     * Maps a uniform sample onto the jitter range.
     *
     * @param sample value in {@code [0, 1]}, clamped if outside
     * @return factor in {@code [0.8, 1.2]}
     */
    static double jitterFactor(double sample) {
        double clamped = Math.min(1.0, Math.max(0.0, sample));
        return MIN_JITTER + (MAX_JITTER - MIN_JITTER) * clamped;
    }

    @Override
    public Duration nextDelay(Duration currentDelay, RetryPolicy policy) {
        Objects.requireNonNull(currentDelay, "currentDelay");
        Objects.requireNonNull(policy, "policy");
        return scale(currentDelay, jitterFactor(random.getAsDouble()), policy);
    }

    /**
     * Applies an explicit jitter factor and the policy cap.
     *
     * @param currentDelay the current base delay
     * @param jitter the jitter factor
     * @param policy the retry policy supplying the cap
     * @return the delay, within {@code [0, policy.getMaxDelay()]}
     */
    static Duration scale(Duration currentDelay, double jitter, RetryPolicy policy) {
        long maxNanos = policy.getMaxDelay().toNanos();
        double scaledNanos = RetryPolicy.saturatedNanos(currentDelay) * jitter;
        if (scaledNanos >= maxNanos) {
            return policy.getMaxDelay();
        }
        if (!(scaledNanos > 0)) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) scaledNanos);
    }

    @Override
    public String toString() {
        return "JitteredBackoff[" + MIN_JITTER + ".." + MAX_JITTER + "]";
    }
}
