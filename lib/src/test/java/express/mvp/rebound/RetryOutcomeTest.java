package express.mvp.rebound;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryOutcome} and {@link RetryCancelledException}. */
@DisplayName("RetryOutcome")
class RetryOutcomeTest {

    @Test
    @DisplayName("success exposes the value")
    void success() throws Exception {
        RetryOutcome<String> outcome = RetryOutcome.success("v", 2);

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isFailure());
        assertEquals("v", outcome.getValue());
        assertEquals("v", outcome.getOrThrow());
        assertEquals("v", outcome.orElse("other"));
        assertEquals(2, outcome.getAttempts());
        assertNull(outcome.getError());
    }

    @Test
    @DisplayName("failure rethrows the original exception")
    void failure() {
        IOException error = new IOException("io");
        RetryOutcome<String> outcome = RetryOutcome.failure(error, 3);

        assertTrue(outcome.isFailure());
        assertSame(error, outcome.getError());
        assertSame(error, assertThrows(IOException.class, outcome::getOrThrow));
        IllegalStateException state = assertThrows(IllegalStateException.class, outcome::getValue);
        assertSame(error, state.getCause());
        assertTrue(outcome.toString().contains("attempts=3"));
    }

    @Test
    @DisplayName("failure requires an error")
    void failureRequiresError() {
        assertThrows(NullPointerException.class, () -> RetryOutcome.failure(null, 1));
    }

    @Test
    @DisplayName("cancellation carries operation, attempts and cause")
    void cancellationDetails() {
        IOException last = new IOException("last");
        RetryCancelledException cancelled = new RetryCancelledException("sync", 2, last);

        assertEquals("sync", cancelled.getOperationName());
        assertEquals(2, cancelled.getAttempts());
        assertSame(last, cancelled.getCause());
        assertTrue(cancelled.getMessage().contains("'sync'"));
        assertNull(new RetryCancelledException("x", 0, null).getCause());
    }
}
