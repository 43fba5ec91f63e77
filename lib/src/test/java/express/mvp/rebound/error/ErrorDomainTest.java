package express.mvp.rebound.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for {@link ErrorDomain}, {@link ErrorClass} and {@link OperationException}. */
@DisplayName("ErrorDomain")
class ErrorDomainTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
        "FIRFirestoreErrorDomain, BACKEND_SERVICE",
        "FIRStorageErrorDomain, BACKEND_SERVICE",
        "io.grpc.Status, BACKEND_SERVICE",
        "NSURLErrorDomain, CONNECTIVITY",
        "network, CONNECTIVITY",
        "socket, TRANSPORT",
        "com.example.app, APPLICATION"
    })
    @DisplayName("fromTag maps vendor tags to domains")
    void fromTag_mapsTags(String tag, ErrorDomain expected) {
        assertEquals(expected, ErrorDomain.fromTag(tag));
    }

    @Test
    @DisplayName("fromTag maps blank and null to application")
    void fromTag_blankIsApplication() {
        assertEquals(ErrorDomain.APPLICATION, ErrorDomain.fromTag(null));
        assertEquals(ErrorDomain.APPLICATION, ErrorDomain.fromTag("  "));
    }

    @Test
    @DisplayName("only transient errors are retryable")
    void onlyTransient_isRetryable() {
        assertTrue(ErrorClass.TRANSIENT_RETRYABLE.isRetryable());
        assertFalse(ErrorClass.NON_RETRYABLE.isRetryable());
        assertFalse(ErrorClass.UNKNOWN.isRetryable());
    }

    @Test
    @DisplayName("operation exception exposes domain and code")
    void operationException_exposesFields() {
        OperationException error =
                new OperationException(ErrorDomain.CONNECTIVITY, ConnectivityCode.TIMED_OUT, "t");

        assertEquals(ErrorDomain.CONNECTIVITY, error.domain());
        assertEquals(-1001, error.code());
        assertEquals("t", error.getMessage());
        assertTrue(error.toString().contains("code=-1001"));
    }

    @Test
    @DisplayName("operation exception requires a domain")
    void operationException_requiresDomain() {
        assertThrows(NullPointerException.class, () -> new OperationException(null, 1, "x"));
    }
}
