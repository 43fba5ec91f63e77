package express.mvp.rebound.observe;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.error.ErrorClass;
import express.mvp.rebound.error.OperationException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observer that writes retry progress to an SLF4J logger.
 *
 * <table border="1">
 *   <caption>Log levels</caption>
 *   <tr><th>Event</th><th>Level</th></tr>
 *   <tr><td>Attempt start</td><td>DEBUG</td></tr>
 *   <tr><td>Retryable failure</td><td>WARN</td></tr>
 *   <tr><td>Non-retryable failure</td><td>ERROR</td></tr>
 *   <tr><td>Retry scheduled</td><td>INFO</td></tr>
 *   <tr><td>Success after retries</td><td>INFO</td></tr>
 *   <tr><td>Attempts exhausted</td><td>ERROR</td></tr>
 * </table>
 */
public final class LoggingRetryObserver implements RetryObserver {

    private final Logger log;

    /** Creates an observer logging to this class's logger. */
    public LoggingRetryObserver() {
        this(LoggerFactory.getLogger(LoggingRetryObserver.class));
    }

    /**
     * Creates an observer logging to the given logger.
     *
     * @param log the target logger
     */
    public LoggingRetryObserver(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public void onAttemptStart(RetryContext context) {
        log.debug(
                "Retry: starting '{}' attempt {}/{}",
                context.getOperationName(),
                context.getAttemptCount(),
                context.getMaxAttempts());
    }

    @Override
    public void onAttemptFailure(RetryContext context, Throwable error, ErrorClass errorClass) {
        if (errorClass.isRetryable()) {
            log.warn(
                    "Retry: '{}' attempt {} failed - {} ({})",
                    context.getOperationName(),
                    context.getAttemptCount(),
                    summarize(error),
                    errorClass.name());
        } else {
            log.error(
                    "Retry: '{}' attempt {} failed with {} error, not retrying - {}",
                    context.getOperationName(),
                    context.getAttemptCount(),
                    errorClass.name(),
                    summarize(error),
                    error);
        }
    }

    @Override
    public void onRetryScheduled(RetryContext context, Duration delay) {
        log.info(
                "Retry: waiting {}ms before '{}' attempt {}",
                delay.toMillis(),
                context.getOperationName(),
                context.getAttemptCount() + 1);
    }

    @Override
    public void onAttemptSuccess(RetryContext context) {
        if (context.getAttemptCount() > 1) {
            log.info(
                    "Retry: '{}' succeeded on attempt {}",
                    context.getOperationName(),
                    context.getAttemptCount());
        }
    }

    @Override
    public void onAttemptsExhausted(RetryContext context, Throwable error) {
        log.error(
                "Retry: all {} attempts of '{}' exhausted",
                context.getMaxAttempts(),
                context.getOperationName(),
                error);
    }

    @Override
    public void onRetryCancelled(RetryContext context) {
        log.info(
                "Retry: '{}' cancelled after {} attempt(s)",
                context.getOperationName(),
                context.getAttemptCount());
    }

    private static String summarize(Throwable error) {
        if (error instanceof OperationException) {
            OperationException op = (OperationException) error;
            return "domain: " + op.domain() + ", code: " + op.code() + ", " + op.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    @Override
    public String toString() {
        return "LoggingRetryObserver[" + log.getName() + "]";
    }
}
