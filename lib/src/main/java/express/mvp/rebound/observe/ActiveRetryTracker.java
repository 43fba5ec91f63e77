package express.mvp.rebound.observe;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.error.ErrorClass;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Observer that knows which operations are in the middle of a retry sequence.
 *
 * <p>A sequence becomes active with its first attempt and stops being active when it succeeds,
 * fails without retry, exhausts its attempts or is cancelled. Sequences are tracked
 * individually, so several concurrent sequences sharing an operation name stay visible until
 * the last of them ends.
 *
 * <pre>{@code
 * ActiveRetryTracker active = new ActiveRetryTracker();
 * RetryCoordinator coordinator = RetryCoordinator.builder().observer(active).build();
 * ...
 * if (active.hasActiveRetries("sync-inbox")) {
 *     showSpinner(active.currentAttempt("sync-inbox").orElse(1));
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe.
 */
public final class ActiveRetryTracker implements RetryObserver {

    /** Running sequences and the attempt each one is on. */
    private final Map<RetryContext, Active> active = new ConcurrentHashMap<>();

    @Override
    public void onAttemptStart(RetryContext context) {
        active.put(context, new Active(context.getOperationName(), context.getAttemptCount()));
    }

    @Override
    public void onAttemptFailure(RetryContext context, Throwable error, ErrorClass errorClass) {
        if (!errorClass.isRetryable()) {
            active.remove(context);
        }
    }

    @Override
    public void onAttemptSuccess(RetryContext context) {
        active.remove(context);
    }

    @Override
    public void onAttemptsExhausted(RetryContext context, Throwable error) {
        active.remove(context);
    }

    @Override
    public void onRetryCancelled(RetryContext context) {
        active.remove(context);
    }

    /**
     * Checks whether any sequence with this operation name is running.
     *
     * @param operationName the operation name
     * @return true if at least one sequence is active
     */
    public boolean hasActiveRetries(String operationName) {
        return active.values().stream().anyMatch(a -> a.operationName.equals(operationName));
    }

    /**
     * Returns the highest attempt number among running sequences with this operation name.
     *
     * @param operationName the operation name
     * @return the attempt, or empty if none is active
     */
    public OptionalInt currentAttempt(String operationName) {
        return active.values().stream()
                .filter(a -> a.operationName.equals(operationName))
                .mapToInt(a -> a.attempt)
                .max();
    }

    /**
     * Returns the names of all operations with a running sequence.
     *
     * @return operation names
     */
    public Set<String> activeOperations() {
        return active.values().stream()
                .map(a -> a.operationName)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String toString() {
        return "ActiveRetryTracker[active=" + active.size() + "]";
    }

    private static final class Active {
        final String operationName;
        final int attempt;

        Active(String operationName, int attempt) {
            this.operationName = operationName;
            this.attempt = attempt;
        }
    }
}
