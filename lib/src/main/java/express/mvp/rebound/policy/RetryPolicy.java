package express.mvp.rebound.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry budget and backoff shape for one kind of operation.
 *
 * <p>A policy holds four values: the maximum number of attempts (the first call included), the
 * delay before the first retry, the cap applied to every delay, and the multiplier applied to
 * the delay between consecutive retries.
 *
 * <h2>Named Presets</h2>
 *
 * <table border="1">
 *   <caption>Presets</caption>
 *   <tr><th>Preset</th><th>Attempts</th><th>Initial</th><th>Max</th><th>Multiplier</th></tr>
 *   <tr><td>{@link #defaults()}</td><td>3</td><td>1s</td><td>10s</td><td>2.0</td></tr>
 *   <tr><td>{@link #aggressive()}</td><td>5</td><td>500ms</td><td>15s</td><td>2.0</td></tr>
 *   <tr><td>{@link #conservative()}</td><td>3</td><td>1s</td><td>10s</td><td>2.0</td></tr>
 *   <tr><td>{@link #noRetry()}</td><td>1</td><td>0</td><td>0</td><td>1.0</td></tr>
 * </table>
 *
 * <p>{@code conservative} currently carries the same values as {@code defaults}. It stays a
 * separate entry point so callers can state intent and the values can diverge later.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(4)
 *     .initialDelay(Duration.ofMillis(250))
 *     .maxDelay(Duration.ofSeconds(5))
 *     .multiplier(3.0)
 *     .build();
 *
 * String name = coordinator.run(policy, () -> directory.lookup(userId));
 * }</pre>
 *
 * @see BackoffPolicy
 */
public final class RetryPolicy {

    /** Longest delay a policy accepts: {@code Long.MAX_VALUE} nanoseconds, about 292 years. */
    public static final Duration MAX_SUPPORTED_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    private static final Duration MIN_SUPPORTED_DELAY = Duration.ofNanos(Long.MIN_VALUE);

    private static final RetryPolicy DEFAULTS = builder().build();

    private static final RetryPolicy AGGRESSIVE =
            builder()
                    .maxAttempts(5)
                    .initialDelay(Duration.ofMillis(500))
                    .maxDelay(Duration.ofSeconds(15))
                    .multiplier(2.0)
                    .build();

    private static final RetryPolicy CONSERVATIVE = builder().build();

    private static final RetryPolicy NO_RETRY =
            builder()
                    .maxAttempts(1)
                    .initialDelay(Duration.ZERO)
                    .maxDelay(Duration.ZERO)
                    .multiplier(1.0)
                    .build();

    /** Maximum number of attempts, including the first. */
    private final int maxAttempts;

    /** Delay before the first retry. */
    private final Duration initialDelay;

    /** Cap for every delay. */
    private final Duration maxDelay;

    /** Growth factor between consecutive delays (1.0 = fixed delay). */
    private final double multiplier;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
    }

    /**
     * Returns the general purpose preset: 3 attempts, 1s initial delay, 10s cap, multiplier 2.
     *
     * @return default policy
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the preset for flaky network calls: 5 attempts, 500ms initial delay, 15s cap,
     * multiplier 2.
     *
     * @return aggressive policy
     */
    public static RetryPolicy aggressive() {
        return AGGRESSIVE;
    }

    /**
     * Returns the preset for expensive operations such as uploads. Same values as {@link
     * #defaults()}.
     *
     * @return conservative policy
     */
    public static RetryPolicy conservative() {
        return CONSERVATIVE;
    }

    /**
     * Returns a policy that never retries.
     *
     * @return single-attempt policy
     */
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    /**
     * Returns a builder initialized with the {@link #defaults()} values.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the maximum number of attempts, including the first.
     *
     * @return max attempts
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the delay before the first retry.
     *
     * @return initial delay
     */
    public Duration getInitialDelay() {
        return initialDelay;
    }

    /**
     * Returns the cap applied to every delay.
     *
     * @return max delay
     */
    public Duration getMaxDelay() {
        return maxDelay;
    }

    /**
     * Returns the growth factor between consecutive delays.
     *
     * @return multiplier
     */
    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Computes the base delay for the retry after {@code currentDelay}.
     *
     * @param currentDelay the base delay used for the previous retry
     * @return {@code min(currentDelay * multiplier, maxDelay)}
     */
    public Duration grow(Duration currentDelay) {
        Objects.requireNonNull(currentDelay, "currentDelay");
        double grownNanos = saturatedNanos(currentDelay) * multiplier;
        if (grownNanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos(Math.max(0L, (long) grownNanos));
    }

    /**
     * Clamps a delay into {@code [0, maxDelay]}.
     *
     * @param delay the delay to clamp
     * @return the clamped delay
     */
    public Duration clamp(Duration delay) {
        if (delay.isNegative()) {
            return Duration.ZERO;
        }
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Converts a duration to nanoseconds, saturating instead of overflowing.
     *
     * @param delay the duration to convert
     * @return nanoseconds, clamped to the {@code long} range
     */
    static long saturatedNanos(Duration delay) {
        if (delay.compareTo(MAX_SUPPORTED_DELAY) >= 0) {
            return Long.MAX_VALUE;
        }
        if (delay.compareTo(MIN_SUPPORTED_DELAY) <= 0) {
            return Long.MIN_VALUE;
        }
        return delay.toNanos();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RetryPolicy)) {
            return false;
        }
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts
                && Double.compare(that.multiplier, multiplier) == 0
                && initialDelay.equals(that.initialDelay)
                && maxDelay.equals(that.maxDelay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, initialDelay, maxDelay, multiplier);
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts
                + ", initialDelay=" + initialDelay.toMillis() + "ms"
                + ", maxDelay=" + maxDelay.toMillis() + "ms"
                + ", multiplier=" + multiplier
                + "]";
    }

    /**
     * Builder for {@link RetryPolicy}.
     *
     * <p>Starts from the {@link RetryPolicy#defaults()} values. Each setter validates its own
     * argument; {@link #build()} validates the relation between initial and max delay.
     */
    public static final class Builder {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double multiplier = 2.0;

        private Builder() {}

        /**
         * Returns a builder initialized with the values of an existing policy.
         *
         * @param policy the policy to copy
         * @return new builder
         */
        public static Builder from(RetryPolicy policy) {
            Objects.requireNonNull(policy, "policy");
            Builder builder = new Builder();
            builder.maxAttempts = policy.maxAttempts;
            builder.initialDelay = policy.initialDelay;
            builder.maxDelay = policy.maxDelay;
            builder.multiplier = policy.multiplier;
            return builder;
        }

        /**
         * Sets the maximum number of attempts.
         *
         * @param maxAttempts max attempts (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay before the first retry.
         *
         * @param delay initial delay (must not be negative or above {@link #MAX_SUPPORTED_DELAY})
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must be >= 0");
            }
            if (delay.compareTo(MAX_SUPPORTED_DELAY) > 0) {
                throw new IllegalArgumentException(
                        "initialDelay must be <= " + MAX_SUPPORTED_DELAY);
            }
            this.initialDelay = delay;
            return this;
        }

        /**
         * Sets the cap applied to every delay.
         *
         * @param maxDelay maximum delay (must not be negative or above {@link
         *     #MAX_SUPPORTED_DELAY})
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must be >= 0");
            }
            if (maxDelay.compareTo(MAX_SUPPORTED_DELAY) > 0) {
                throw new IllegalArgumentException("maxDelay must be <= " + MAX_SUPPORTED_DELAY);
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Sets the growth factor between consecutive delays.
         *
         * @param multiplier multiplier (1.0 = fixed delay, 2.0 = double each time)
         * @return this builder
         */
        public Builder multiplier(double multiplier) {
            if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
                throw new IllegalArgumentException("multiplier must be a finite value >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         * @throws IllegalArgumentException if maxDelay is shorter than initialDelay
         */
        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException(
                        "maxDelay ("
                                + maxDelay
                                + ") must be >= initialDelay ("
                                + initialDelay
                                + ")");
            }
            return new RetryPolicy(this);
        }
    }
}
