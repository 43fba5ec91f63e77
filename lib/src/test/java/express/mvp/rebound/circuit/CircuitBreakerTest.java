package express.mvp.rebound.circuit;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CircuitBreaker}. */
@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private final IOException failure = new IOException("down");

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        breaker =
                new CircuitBreaker(
                        "inbox",
                        CircuitBreakerConfig.builder()
                                .failureThreshold(3)
                                .failureWindow(Duration.ofSeconds(60))
                                .cooldown(Duration.ofSeconds(30))
                                .successThreshold(2)
                                .build(),
                        clock);
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            breaker.recordFailure(failure);
        }
    }

    @Nested
    @DisplayName("Closed state")
    class ClosedTests {

        @Test
        @DisplayName("new breaker is closed and permits attempts")
        void newBreaker_isClosed() {
            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertDoesNotThrow(breaker::acquirePermission);
            assertTrue(breaker.getStatus().isHealthy());
        }

        @Test
        @DisplayName("stays closed below the failure threshold")
        void belowThreshold_staysClosed() {
            failTimes(2);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(2, breaker.getStatus().failureCount());
            assertFalse(breaker.getStatus().isHealthy());
        }

        @Test
        @DisplayName("failures outside the window are forgotten")
        void oldFailures_forgotten() {
            failTimes(2);
            clock.advance(Duration.ofSeconds(61));
            failTimes(1);

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(1, breaker.getStatus().failureCount());
        }
    }

    @Nested
    @DisplayName("Open state")
    class OpenTests {

        @Test
        @DisplayName("reaching the threshold opens the circuit")
        void threshold_opensCircuit() {
            failTimes(3);

            assertEquals(CircuitState.OPEN, breaker.getState());
            CircuitOpenException refused =
                    assertThrows(CircuitOpenException.class, breaker::acquirePermission);
            assertEquals("inbox", refused.getServiceName());
            assertEquals(START.plusSeconds(30), refused.getResetAt());
        }

        @Test
        @DisplayName("status reports the remaining cooldown")
        void status_reportsCooldown() {
            failTimes(3);
            clock.advance(Duration.ofSeconds(10));

            CircuitBreaker.Status status = breaker.getStatus();

            assertEquals(Duration.ofSeconds(20), status.timeUntilRetry());
            assertEquals(1.0, status.failureRate(), 1e-9);
            assertEquals(START, status.lastFailureTime());
            assertEquals("Unavailable", status.state().description());
        }

        @Test
        @DisplayName("failure while open restarts the cooldown")
        void failureWhileOpen_restartsCooldown() {
            failTimes(3);
            clock.advance(Duration.ofSeconds(20));
            failTimes(1);
            clock.advance(Duration.ofSeconds(20));

            assertThrows(CircuitOpenException.class, breaker::acquirePermission);
        }
    }

    @Nested
    @DisplayName("Half-open state")
    class HalfOpenTests {

        @BeforeEach
        void openAndCoolDown() {
            failTimes(3);
            clock.advance(Duration.ofSeconds(30));
            breaker.acquirePermission();
        }

        @Test
        @DisplayName("cooldown end moves the circuit to half-open")
        void cooldownEnd_halfOpens() {
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        }

        @Test
        @DisplayName("enough successes close the circuit")
        void successes_closeCircuit() {
            breaker.recordSuccess();
            assertEquals(CircuitState.HALF_OPEN, breaker.getState());

            breaker.recordSuccess();

            assertEquals(CircuitState.CLOSED, breaker.getState());
            assertEquals(0, breaker.getStatus().failureCount());
        }

        @Test
        @DisplayName("any failure reopens the circuit")
        void failure_reopensCircuit() {
            breaker.recordSuccess();
            breaker.recordFailure(failure);

            assertEquals(CircuitState.OPEN, breaker.getState());
            assertEquals(0, breaker.getStatus().successCount());
        }
    }

    @Test
    @DisplayName("reset closes the circuit and clears history")
    void reset_clearsHistory() {
        failTimes(3);

        breaker.reset();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getStatus().failureCount());
        assertNull(breaker.getStatus().lastFailureTime());
        assertDoesNotThrow(breaker::acquirePermission);
    }

    @Test
    @DisplayName("config presets carry the documented thresholds")
    void presets_haveExpectedValues() {
        assertEquals(5, CircuitBreakerConfig.defaults().getFailureThreshold());
        assertEquals(Duration.ofSeconds(30), CircuitBreakerConfig.defaults().getCooldown());
        assertEquals(3, CircuitBreakerConfig.aggressive().getFailureThreshold());
        assertEquals(Duration.ofSeconds(15), CircuitBreakerConfig.aggressive().getCooldown());
        assertEquals(10, CircuitBreakerConfig.tolerant().getFailureThreshold());
        assertEquals(3, CircuitBreakerConfig.tolerant().getSuccessThreshold());
        assertThrows(
                IllegalArgumentException.class,
                () -> CircuitBreakerConfig.builder().cooldown(Duration.ZERO));
    }
}
