package express.mvp.rebound.circuit;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CircuitBreakerRegistry}. */
@DisplayName("CircuitBreakerRegistry")
class CircuitBreakerRegistryTest {

    private final CircuitBreakerRegistry registry =
            new CircuitBreakerRegistry(
                    CircuitBreakerConfig.aggressive(),
                    new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));

    @Test
    @DisplayName("returns the same breaker for the same service")
    void sameService_sameBreaker() {
        CircuitBreaker first = registry.breakerFor("uploads");

        assertSame(first, registry.breakerFor("uploads"));
        assertSame(first, registry.breakerFor("uploads", CircuitBreakerConfig.tolerant()));
        assertEquals(CircuitBreakerConfig.aggressive(), first.getConfig());
    }

    @Test
    @DisplayName("first lookup decides the config")
    void firstLookup_decidesConfig() {
        CircuitBreaker tolerant = registry.breakerFor("search", CircuitBreakerConfig.tolerant());

        assertEquals(CircuitBreakerConfig.tolerant(), tolerant.getConfig());
        assertTrue(registry.find("search").isPresent());
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    @DisplayName("unhealthy services lists open circuits only")
    void unhealthyServices_listsOpenCircuits() {
        registry.breakerFor("healthy");
        CircuitBreaker failing = registry.breakerFor("failing");
        for (int i = 0; i < 3; i++) {
            failing.recordFailure(new IOException("down"));
        }

        assertEquals(List.of("failing"), registry.unhealthyServices());
        assertEquals(2, registry.statuses().size());
    }

    @Test
    @DisplayName("resetAll closes every circuit")
    void resetAll_closesEveryCircuit() {
        CircuitBreaker failing = registry.breakerFor("failing");
        for (int i = 0; i < 3; i++) {
            failing.recordFailure(new IOException("down"));
        }

        registry.resetAll();

        assertTrue(registry.unhealthyServices().isEmpty());
        assertEquals(CircuitState.CLOSED, failing.getState());
    }
}
