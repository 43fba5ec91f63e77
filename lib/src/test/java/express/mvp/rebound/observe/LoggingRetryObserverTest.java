package express.mvp.rebound.observe;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import express.mvp.rebound.RetryCoordinator;
import express.mvp.rebound.error.ConnectivityCode;
import express.mvp.rebound.error.ErrorDomain;
import express.mvp.rebound.error.OperationException;
import express.mvp.rebound.error.ServiceCode;
import express.mvp.rebound.policy.JitteredBackoff;
import express.mvp.rebound.policy.RetryPolicy;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Unit tests for {@link LoggingRetryObserver}. */
@DisplayName("LoggingRetryObserver")
class LoggingRetryObserverTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private RetryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger("rebound.test.retry");
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        coordinator =
                RetryCoordinator.builder()
                        .observer(new LoggingRetryObserver(logger))
                        .backoff(JitteredBackoff.noJitter())
                        .sleeper(delay -> {})
                        .build();
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        coordinator.close();
    }

    private List<Level> levels() {
        return appender.list.stream().map(ILoggingEvent::getLevel).collect(Collectors.toList());
    }

    @Test
    @DisplayName("first-attempt success logs only the start at debug")
    void firstAttemptSuccess() throws Exception {
        coordinator.run("quick", RetryPolicy.defaults(), () -> "ok");

        assertEquals(List.of(Level.DEBUG), levels());
    }

    @Test
    @DisplayName("retry sequence logs warn, info and success")
    void retrySequence() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        coordinator.run(
                "fetch",
                RetryPolicy.defaults(),
                () -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new OperationException(
                                ErrorDomain.CONNECTIVITY, ConnectivityCode.TIMED_OUT, "slow");
                    }
                    return "ok";
                });

        assertEquals(
                List.of(Level.DEBUG, Level.WARN, Level.INFO, Level.DEBUG, Level.INFO), levels());
        String warning = appender.list.get(1).getFormattedMessage();
        assertTrue(warning.contains("'fetch'"));
        assertTrue(warning.contains("domain: CONNECTIVITY"));
        assertTrue(warning.contains("code: -1001"));
        assertTrue(appender.list.get(2).getFormattedMessage().contains("1000ms"));
        assertTrue(appender.list.get(4).getFormattedMessage().contains("attempt 2"));
    }

    @Test
    @DisplayName("non-retryable failure logs an error with the exception")
    void nonRetryable() {
        OperationException error = new OperationException(ServiceCode.NOT_FOUND, "missing");

        assertThrows(
                OperationException.class,
                () ->
                        coordinator.run(
                                "load",
                                RetryPolicy.defaults(),
                                () -> {
                                    throw error;
                                }));

        assertEquals(List.of(Level.DEBUG, Level.ERROR), levels());
        assertNotNull(appender.list.get(1).getThrowableProxy());
    }

    @Test
    @DisplayName("exhaustion logs an error after the last warning")
    void exhaustion() {
        assertThrows(
                OperationException.class,
                () ->
                        coordinator.run(
                                "flaky",
                                RetryPolicy.noRetry(),
                                () -> {
                                    throw new OperationException(ServiceCode.UNAVAILABLE, "down");
                                }));

        assertEquals(List.of(Level.DEBUG, Level.WARN, Level.ERROR), levels());
        assertTrue(appender.list.get(2).getFormattedMessage().contains("all 1 attempts"));
    }
}
