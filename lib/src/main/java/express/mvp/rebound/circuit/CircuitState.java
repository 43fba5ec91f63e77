package express.mvp.rebound.circuit;

/**
 * States of a {@link CircuitBreaker}.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 *            failures &gt;= threshold
 * ┌────────┐ within the window      ┌────────┐
 * │ CLOSED │───────────────────────▶│  OPEN  │◀──────────┐
 * └────────┘                        └────────┘           │
 *      ▲                                 │ cooldown      │ any failure
 *      │ successes &gt;= threshold          ▼ elapsed       │
 *      │                           ┌───────────┐         │
 *      └───────────────────────────│ HALF_OPEN │─────────┘
 *                                  └───────────┘
 * </pre>
 */
public enum CircuitState {

    /** Normal operation: every attempt passes. */
    CLOSED("Healthy"),

    /** Too many recent failures: attempts are refused until the cooldown ends. */
    OPEN("Unavailable"),

    /** Cooldown over: attempts pass and successes are counted towards closing. */
    HALF_OPEN("Recovering");

    private final String description;

    CircuitState(String description) {
        this.description = description;
    }

    /**
     * Returns a short health description.
     *
     * @return description such as "Healthy"
     */
    public String description() {
        return description;
    }

    /**
     * Checks whether attempts are refused in this state.
     *
     * @return true for {@link #OPEN}
     */
    public boolean isOpen() {
        return this == OPEN;
    }
}
