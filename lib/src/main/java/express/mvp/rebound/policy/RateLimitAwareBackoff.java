package express.mvp.rebound.policy;

import express.mvp.rebound.error.ErrorDomain;
import express.mvp.rebound.error.OperationException;
import express.mvp.rebound.error.ServiceCode;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decorator that waits longer after a rate-limited attempt.
 *
 * <p>When the failed attempt's error is rate limited, the delegate's delay becomes {@code
 * max(delay * 2, 5s)}. This happens after the policy cap, so a rate-limited wait may exceed
 * {@link RetryPolicy#getMaxDelay()}; it never exceeds {@link RetryPolicy#MAX_SUPPORTED_DELAY}.
 * Other errors get the delegate's delay unchanged.
 *
 * <p>By default an error is rate limited when its cause chain holds a backend {@link
 * ServiceCode#RESOURCE_EXHAUSTED}. The standard classification table does not retry that code;
 * register it as transient to make the decorator matter:
 *
 * <pre>{@code
 * RetryCoordinator coordinator = RetryCoordinator.builder()
 *     .classifier(TableErrorClassifier.standard().toBuilder()
 *         .rule(ServiceCode.RESOURCE_EXHAUSTED, ErrorClass.TRANSIENT_RETRYABLE)
 *         .build())
 *     .backoff(new RateLimitAwareBackoff(new JitteredBackoff()))
 *     .build();
 * }</pre>
 */
public final class RateLimitAwareBackoff implements BackoffPolicy {

    /** Shortest wait after a rate-limited attempt. */
    public static final Duration DEFAULT_MIN_DELAY = Duration.ofSeconds(5);

    /** Factor applied to the delegate's delay after a rate-limited attempt. */
    public static final double STRETCH = 2.0;

    private static final int MAX_CAUSE_DEPTH = 16;

    private final BackoffPolicy delegate;
    private final Predicate<Throwable> rateLimited;
    private final Duration minDelay;

    /**
     * Creates a decorator using the backend resource-exhausted code as the rate-limit signal.
     *
     * @param delegate the backoff to stretch
     */
    public RateLimitAwareBackoff(BackoffPolicy delegate) {
        this(delegate, RateLimitAwareBackoff::isResourceExhausted, DEFAULT_MIN_DELAY);
    }

    /**
     * Creates a decorator with a custom rate-limit signal and floor.
     *
     * @param delegate the backoff to stretch
     * @param rateLimited tells whether an error is rate limited
     * @param minDelay shortest wait after a rate-limited attempt
     */
    public RateLimitAwareBackoff(
            BackoffPolicy delegate, Predicate<Throwable> rateLimited, Duration minDelay) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.rateLimited = Objects.requireNonNull(rateLimited, "rateLimited");
        this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
        if (minDelay.isNegative() || minDelay.compareTo(RetryPolicy.MAX_SUPPORTED_DELAY) > 0) {
            throw new IllegalArgumentException("minDelay out of range: " + minDelay);
        }
    }

    @Override
    public Duration nextDelay(Duration currentDelay, RetryPolicy policy) {
        return delegate.nextDelay(currentDelay, policy);
    }

    @Override
    public Duration nextDelay(
            int failedAttempt, Duration currentDelay, Throwable error, RetryPolicy policy) {
        Duration delay = delegate.nextDelay(failedAttempt, currentDelay, error, policy);
        if (error == null || !rateLimited.test(error)) {
            return delay;
        }
        Duration stretched = stretch(delay);
        return stretched.compareTo(minDelay) < 0 ? minDelay : stretched;
    }

    private static Duration stretch(Duration delay) {
        double nanos = RetryPolicy.saturatedNanos(delay) * STRETCH;
        if (nanos >= Long.MAX_VALUE) {
            return RetryPolicy.MAX_SUPPORTED_DELAY;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * Tells whether the cause chain holds a backend resource-exhausted error.
     *
     * @param error the failure
     * @return true if rate limited
     */
    public static boolean isResourceExhausted(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof OperationException) {
                OperationException structured = (OperationException) current;
                return structured.domain() == ErrorDomain.BACKEND_SERVICE
                        && structured.code() == ServiceCode.RESOURCE_EXHAUSTED.code();
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public String toString() {
        return "RateLimitAwareBackoff[" + delegate + ", min=" + minDelay + "]";
    }
}
