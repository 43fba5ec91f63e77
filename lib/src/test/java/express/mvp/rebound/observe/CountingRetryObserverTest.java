package express.mvp.rebound.observe;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.rebound.RetryContext;
import express.mvp.rebound.RetryCoordinator;
import express.mvp.rebound.error.OperationException;
import express.mvp.rebound.error.ServiceCode;
import express.mvp.rebound.policy.JitteredBackoff;
import express.mvp.rebound.policy.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CountingRetryObserver} and {@link RetryObserver#composite}. */
@DisplayName("CountingRetryObserver")
class CountingRetryObserverTest {

    private CountingRetryObserver metrics;
    private RetryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        metrics = new CountingRetryObserver();
        coordinator =
                RetryCoordinator.builder()
                        .observer(metrics)
                        .backoff(JitteredBackoff.noJitter())
                        .sleeper(delay -> {})
                        .build();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("fresh observer reports zeros and full success rate")
        void freshObserver() {
            CountingRetryObserver.Stats stats = metrics.getStats();

            assertEquals(0, stats.attempts());
            assertEquals(0, stats.failures());
            assertEquals(100.0, stats.successRate());
            assertEquals(Duration.ZERO, stats.totalScheduledDelay());
        }

        @Test
        @DisplayName("counts attempts, failures, retries and delays")
        void countsSequence() throws Exception {
            AtomicInteger calls = new AtomicInteger();

            coordinator.run(
                    RetryPolicy.defaults(),
                    () -> {
                        if (calls.incrementAndGet() < 3) {
                            throw new OperationException(ServiceCode.UNAVAILABLE, "down");
                        }
                        return "ok";
                    });

            CountingRetryObserver.Stats stats = metrics.getStats();
            assertEquals(3, stats.attempts());
            assertEquals(1, stats.successes());
            assertEquals(2, stats.transientFailures());
            assertEquals(2, stats.retriesScheduled());
            assertEquals(0, stats.exhausted());
            assertEquals(Duration.ofSeconds(3), stats.totalScheduledDelay());
        }

        @Test
        @DisplayName("counts non-retryable, unknown and exhausted sequences")
        void countsTerminalFailures() {
            assertThrows(
                    OperationException.class,
                    () ->
                            coordinator.run(
                                    RetryPolicy.defaults(),
                                    () -> {
                                        throw new OperationException(
                                                ServiceCode.PERMISSION_DENIED, "no");
                                    }));
            assertThrows(
                    IllegalStateException.class,
                    () ->
                            coordinator.run(
                                    RetryPolicy.defaults(),
                                    () -> {
                                        throw new IllegalStateException("bug");
                                    }));
            assertThrows(
                    OperationException.class,
                    () ->
                            coordinator.run(
                                    RetryPolicy.noRetry(),
                                    () -> {
                                        throw new OperationException(ServiceCode.ABORTED, "a");
                                    }));

            CountingRetryObserver.Stats stats = metrics.getStats();
            assertEquals(1, stats.nonRetryableFailures());
            assertEquals(1, stats.unknownFailures());
            assertEquals(1, stats.transientFailures());
            assertEquals(1, stats.exhausted());
            assertEquals(0.0, stats.successRate());
            assertTrue(stats.toString().contains("failures=3"));
        }
    }

    @Nested
    @DisplayName("Composite")
    class CompositeTests {

        @Test
        @DisplayName("composite forwards every event to each observer")
        void forwardsEvents() throws Exception {
            CountingRetryObserver second = new CountingRetryObserver();

            try (RetryCoordinator both =
                    RetryCoordinator.builder()
                            .observer(RetryObserver.composite(metrics, second))
                            .sleeper(delay -> {})
                            .build()) {
                both.run(RetryPolicy.defaults(), () -> "ok");
            }

            assertEquals(1, metrics.getStats().successes());
            assertEquals(1, second.getStats().successes());
        }

        @Test
        @DisplayName("failing delegate does not hide the event from the others")
        void failingDelegate_isIsolated() throws Exception {
            List<String> seen = new ArrayList<>();
            RetryObserver broken =
                    new RetryObserver() {
                        @Override
                        public void onAttemptSuccess(RetryContext context) {
                            throw new IllegalStateException("observer bug");
                        }
                    };
            RetryObserver recording =
                    new RetryObserver() {
                        @Override
                        public void onAttemptSuccess(RetryContext context) {
                            seen.add(context.getOperationName());
                        }
                    };

            try (RetryCoordinator isolated =
                    RetryCoordinator.builder()
                            .observer(RetryObserver.composite(broken, recording))
                            .sleeper(delay -> {})
                            .build()) {
                assertEquals("ok", isolated.run("isolated", RetryPolicy.defaults(), () -> "ok"));
            }

            assertEquals(List.of("isolated"), seen);
        }
    }
}
