package express.mvp.rebound;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.rebound.circuit.CircuitOpenException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Final result of a retry sequence: a success value or the last observed error, never both.
 *
 * <p>Returned by {@link RetryCoordinator#runForOutcome} for callers that prefer inspecting a
 * value over catching exceptions.
 *
 * <pre>{@code
 * RetryOutcome<Profile> outcome = coordinator.runForOutcome(policy, () -> api.fetch(id));
 * if (outcome.isSuccess()) {
 *     render(outcome.getValue());
 * } else {
 *     report(outcome.getError(), outcome.getAttempts());
 * }
 * }</pre>
 *
 * @param <T> the result type
 */
public final class RetryOutcome<T> {

    private final T value;
    private final Throwable error;
    private final int attempts;

    private RetryOutcome(T value, Throwable error, int attempts) {
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    /**
     * Creates a successful outcome.
     *
     * @param value the result, may be null
     * @param attempts number of attempts made
     * @param <T> the result type
     * @return success outcome
     */
    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return new RetryOutcome<>(value, null, attempts);
    }

    /**
     * Creates a failed outcome.
     *
     * @param error the last observed error
     * @param attempts number of attempts made
     * @param <T> the result type
     * @return failure outcome
     */
    public static <T> RetryOutcome<T> failure(Throwable error, int attempts) {
        return new RetryOutcome<>(null, Objects.requireNonNull(error, "error"), attempts);
    }

    /**
     * Checks if the sequence produced a value.
     *
     * @return true on success
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Checks if the sequence ended with an error.
     *
     * @return true on failure
     */
    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the success value.
     *
     * @return the value, may be null
     * @throws IllegalStateException if the outcome is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Outcome is a failure", error);
        }
        return value;
    }

    /**
     * Returns the last observed error.
     *
     * @return the error, or null on success
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable getError() {
        return error;
    }

    /**
     * Returns when an open circuit lets attempts through again, if the sequence was refused by
     * one.
     *
     * @return end of the cooldown, or empty if the outcome is not a refused attempt
     */
    public Optional<Instant> circuitResetAt() {
        if (error instanceof CircuitOpenException) {
            return Optional.of(((CircuitOpenException) error).getResetAt());
        }
        return Optional.empty();
    }

    /**
     * Returns the number of attempts made.
     *
     * @return attempts, at least 1
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns the value, or the fallback on failure.
     *
     * @param fallback value returned on failure
     * @return the value or fallback
     */
    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    /**
     * Returns the value or rethrows the error unchanged.
     *
     * @return the value
     * @throws Exception the last observed error
     */
    public T getOrThrow() throws Exception {
        if (error == null) {
            return value;
        }
        if (error instanceof Exception) {
            throw (Exception) error;
        }
        throw (Error) error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RetryOutcome[success, attempts=" + attempts + "]"
                : "RetryOutcome[failure=" + error + ", attempts=" + attempts + "]";
    }
}
