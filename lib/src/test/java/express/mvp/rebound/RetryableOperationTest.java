package express.mvp.rebound;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.rebound.error.ConnectivityCode;
import express.mvp.rebound.error.ErrorDomain;
import express.mvp.rebound.error.OperationException;
import express.mvp.rebound.policy.JitteredBackoff;
import express.mvp.rebound.policy.RetryPolicy;
import java.net.ConnectException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryableOperation#translating}. */
@DisplayName("RetryableOperation")
class RetryableOperationTest {

    @Test
    @DisplayName("translating converts JDK exceptions into structured errors")
    void translating_convertsExceptions() {
        RetryableOperation<String> operation =
                RetryableOperation.translating(
                        () -> {
                            throw new ConnectException("refused");
                        });

        OperationException thrown = assertThrows(OperationException.class, operation::call);

        assertEquals(ErrorDomain.TRANSPORT, thrown.domain());
        assertEquals(ConnectivityCode.CANNOT_CONNECT_TO_HOST.code(), thrown.code());
        assertInstanceOf(ConnectException.class, thrown.getCause());
    }

    @Test
    @DisplayName("translated socket failures are retried by the coordinator")
    void translated_areRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryableOperation<String> operation =
                RetryableOperation.translating(
                        () -> {
                            if (calls.incrementAndGet() == 1) {
                                throw new ConnectException("refused");
                            }
                            return "connected";
                        });

        try (RetryCoordinator coordinator =
                RetryCoordinator.builder()
                        .backoff(JitteredBackoff.noJitter())
                        .sleeper(delay -> {})
                        .build()) {
            assertEquals("connected", coordinator.run(RetryPolicy.defaults(), operation));
        }
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("translating passes values through")
    void translating_passesValues() throws Exception {
        assertEquals("v", RetryableOperation.translating(() -> "v").call());
    }
}
