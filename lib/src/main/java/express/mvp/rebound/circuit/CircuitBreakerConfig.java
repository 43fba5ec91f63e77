package express.mvp.rebound.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable thresholds of a {@link CircuitBreaker}.
 *
 * <table border="1">
 *   <caption>Presets</caption>
 *   <tr><th>Preset</th><th>Failures</th><th>Window</th><th>Cooldown</th><th>Successes</th></tr>
 *   <tr><td>{@link #defaults()}</td><td>5</td><td>60s</td><td>30s</td><td>2</td></tr>
 *   <tr><td>{@link #aggressive()}</td><td>3</td><td>30s</td><td>15s</td><td>2</td></tr>
 *   <tr><td>{@link #tolerant()}</td><td>10</td><td>120s</td><td>60s</td><td>3</td></tr>
 * </table>
 */
public final class CircuitBreakerConfig {

    private static final CircuitBreakerConfig DEFAULTS = builder().build();

    private static final CircuitBreakerConfig AGGRESSIVE =
            builder()
                    .failureThreshold(3)
                    .failureWindow(Duration.ofSeconds(30))
                    .cooldown(Duration.ofSeconds(15))
                    .successThreshold(2)
                    .build();

    private static final CircuitBreakerConfig TOLERANT =
            builder()
                    .failureThreshold(10)
                    .failureWindow(Duration.ofSeconds(120))
                    .cooldown(Duration.ofSeconds(60))
                    .successThreshold(3)
                    .build();

    /** Failures within the window that open the circuit. */
    private final int failureThreshold;

    /** How far back failures are counted. */
    private final Duration failureWindow;

    /** Time the circuit stays open before attempts are let through again. */
    private final Duration cooldown;

    /** Successes in half-open state that close the circuit. */
    private final int successThreshold;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.failureWindow = builder.failureWindow;
        this.cooldown = builder.cooldown;
        this.successThreshold = builder.successThreshold;
    }

    /**
     * Returns the general purpose preset.
     *
     * @return default config
     */
    public static CircuitBreakerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the preset that opens quickly and recovers quickly.
     *
     * @return aggressive config
     */
    public static CircuitBreakerConfig aggressive() {
        return AGGRESSIVE;
    }

    /**
     * Returns the preset that tolerates more failures and cools down longer.
     *
     * @return tolerant config
     */
    public static CircuitBreakerConfig tolerant() {
        return TOLERANT;
    }

    /**
     * Returns a builder initialized with the {@link #defaults()} values.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getFailureWindow() {
        return failureWindow;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CircuitBreakerConfig)) {
            return false;
        }
        CircuitBreakerConfig that = (CircuitBreakerConfig) o;
        return failureThreshold == that.failureThreshold
                && successThreshold == that.successThreshold
                && failureWindow.equals(that.failureWindow)
                && cooldown.equals(that.cooldown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(failureThreshold, failureWindow, cooldown, successThreshold);
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig[failureThreshold=" + failureThreshold
                + ", failureWindow=" + failureWindow.toSeconds() + "s"
                + ", cooldown=" + cooldown.toSeconds() + "s"
                + ", successThreshold=" + successThreshold
                + "]";
    }

    /** Builder for {@link CircuitBreakerConfig}. */
    public static final class Builder {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(30);
        private int successThreshold = 2;

        private Builder() {}

        /**
         * Sets the number of failures within the window that opens the circuit.
         *
         * @param failureThreshold threshold (must be >= 1)
         * @return this builder
         */
        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Sets how far back failures are counted.
         *
         * @param failureWindow window (must be positive)
         * @return this builder
         */
        public Builder failureWindow(Duration failureWindow) {
            this.failureWindow = positive(failureWindow, "failureWindow");
            return this;
        }

        /**
         * Sets how long the circuit stays open.
         *
         * @param cooldown cooldown (must be positive)
         * @return this builder
         */
        public Builder cooldown(Duration cooldown) {
            this.cooldown = positive(cooldown, "cooldown");
            return this;
        }

        /**
         * Sets the number of half-open successes that close the circuit.
         *
         * @param successThreshold threshold (must be >= 1)
         * @return this builder
         */
        public Builder successThreshold(int successThreshold) {
            if (successThreshold < 1) {
                throw new IllegalArgumentException("successThreshold must be >= 1");
            }
            this.successThreshold = successThreshold;
            return this;
        }

        /**
         * Builds the config.
         *
         * @return new config
         */
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }
    }
}
