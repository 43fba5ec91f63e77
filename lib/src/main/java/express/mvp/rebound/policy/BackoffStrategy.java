package express.mvp.rebound.policy;

/**
 * Shapes of the base delay as a function of the retry number.
 *
 * <p>Each strategy returns a factor applied to the policy's initial delay for the retry that
 * follows failed attempt {@code n} (1-based):
 *
 * <table border="1">
 *   <caption>Delay factors</caption>
 *   <tr><th>Strategy</th><th>Factor</th><th>n = 1..6</th></tr>
 *   <tr><td>{@link #EXPONENTIAL}</td><td>multiplier<sup>n-1</sup></td>
 *       <td>1, 2, 4, 8, 16, 32 (multiplier 2)</td></tr>
 *   <tr><td>{@link #LINEAR}</td><td>n</td><td>1, 2, 3, 4, 5, 6</td></tr>
 *   <tr><td>{@link #FIBONACCI}</td><td>fib(n)</td><td>1, 1, 2, 3, 5, 8</td></tr>
 *   <tr><td>{@link #ADAPTIVE}</td><td>1 up to n = 2, then 1.5<sup>n-2</sup> up to n = 4,
 *       then 2<sup>n-4</sup></td><td>1, 1, 1.5, 2.25, 2, 4</td></tr>
 * </table>
 *
 * @see StrategyBackoff
 */
public enum BackoffStrategy {

    /** Grows by the policy multiplier after every retry. */
    EXPONENTIAL {
        @Override
        public double factor(int failedAttempt, double multiplier) {
            return Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        }
    },

    /** Grows by one initial delay per retry. */
    LINEAR {
        @Override
        public double factor(int failedAttempt, double multiplier) {
            return Math.max(1, failedAttempt);
        }
    },

    /** Grows along the Fibonacci sequence. */
    FIBONACCI {
        @Override
        public double factor(int failedAttempt, double multiplier) {
            double previous = 1;
            double current = 1;
            for (int i = 2; i < failedAttempt && !Double.isInfinite(current); i++) {
                double next = previous + current;
                previous = current;
                current = next;
            }
            return current;
        }
    },

    /** Holds the initial delay for two retries, then grows gently, then doubles. */
    ADAPTIVE {
        @Override
        public double factor(int failedAttempt, double multiplier) {
            if (failedAttempt <= 2) {
                return 1;
            }
            if (failedAttempt <= 4) {
                return Math.pow(1.5, failedAttempt - 2);
            }
            return Math.pow(2.0, failedAttempt - 4);
        }
    };

    /**
     * Returns the factor applied to the initial delay.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @param multiplier the policy multiplier, used by {@link #EXPONENTIAL} only
     * @return factor, at least 1, possibly infinite
     */
    public abstract double factor(int failedAttempt, double multiplier);
}
