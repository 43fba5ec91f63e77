package express.mvp.rebound.observe;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.error.ErrorClass;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans events out to several observers.
 *
 * <p>A failing delegate does not prevent the remaining delegates from seeing the event.
 */
final class CompositeRetryObserver implements RetryObserver {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeRetryObserver.class);

    private final List<RetryObserver> delegates;

    CompositeRetryObserver(List<RetryObserver> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void onAttemptStart(RetryContext context) {
        forEach(o -> o.onAttemptStart(context));
    }

    @Override
    public void onAttemptFailure(RetryContext context, Throwable error, ErrorClass errorClass) {
        forEach(o -> o.onAttemptFailure(context, error, errorClass));
    }

    @Override
    public void onRetryScheduled(RetryContext context, Duration delay) {
        forEach(o -> o.onRetryScheduled(context, delay));
    }

    @Override
    public void onAttemptSuccess(RetryContext context) {
        forEach(o -> o.onAttemptSuccess(context));
    }

    @Override
    public void onAttemptsExhausted(RetryContext context, Throwable error) {
        forEach(o -> o.onAttemptsExhausted(context, error));
    }

    @Override
    public void onRetryCancelled(RetryContext context) {
        forEach(o -> o.onRetryCancelled(context));
    }

    private void forEach(Consumer<RetryObserver> event) {
        for (RetryObserver delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                LOG.warn("Retry observer {} failed", delegate, e);
            }
        }
    }

    @Override
    public String toString() {
        return "CompositeRetryObserver" + delegates;
    }
}
