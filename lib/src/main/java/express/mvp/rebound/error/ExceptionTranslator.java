package express.mvp.rebound.error;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Converts JDK exceptions into structured {@link OperationException}s.
 *
 * <p>Use this at the boundary where an operation calls into code that reports failures as
 * plain exceptions. After translation the classifier only sees (domain, code) pairs.
 *
 * <h2>Translation Table</h2>
 *
 * <ol>
 *   <li>{@link OperationException}: returned unchanged
 *   <li>Timeouts ({@link SocketTimeoutException}, {@link TimeoutException}, {@link
 *       HttpTimeoutException}): TRANSPORT / TIMED_OUT
 *   <li>{@link UnknownHostException}: TRANSPORT / CANNOT_FIND_HOST
 *   <li>{@link ConnectException}, {@link NoRouteToHostException}, {@link
 *       PortUnreachableException}: TRANSPORT / CANNOT_CONNECT_TO_HOST
 *   <li>Other {@link SocketException}, {@link ClosedChannelException}, {@link EOFException}:
 *       TRANSPORT / NETWORK_CONNECTION_LOST
 *   <li>{@link SSLException}: CONNECTIVITY / SECURE_CONNECTION_FAILED
 *   <li>Anything else: APPLICATION / 0
 * </ol>
 *
 * <p>The original exception is always kept as the cause.
 */
public final class ExceptionTranslator {

    /** Code used for failures that have no structured equivalent. */
    public static final int UNSTRUCTURED_CODE = 0;

    private ExceptionTranslator() {
        // Utility class
    }

    /**
     * Translates a throwable into a structured exception.
     *
     * @param throwable the failure to translate
     * @return the structured exception, never null
     */
    public static OperationException translate(Throwable throwable) {
        if (throwable instanceof OperationException) {
            return (OperationException) throwable;
        }
        if (throwable == null) {
            return new OperationException(
                    ErrorDomain.APPLICATION, UNSTRUCTURED_CODE, "null exception");
        }

        String message = messageOf(throwable);

        if (isTimeout(throwable)) {
            return transport(ConnectivityCode.TIMED_OUT, message, throwable);
        }
        if (throwable instanceof UnknownHostException) {
            return transport(ConnectivityCode.CANNOT_FIND_HOST, message, throwable);
        }
        if (throwable instanceof ConnectException
                || throwable instanceof NoRouteToHostException
                || throwable instanceof PortUnreachableException) {
            return transport(ConnectivityCode.CANNOT_CONNECT_TO_HOST, message, throwable);
        }
        if (throwable instanceof SocketException
                || throwable instanceof ClosedChannelException
                || throwable instanceof EOFException) {
            return transport(ConnectivityCode.NETWORK_CONNECTION_LOST, message, throwable);
        }
        if (throwable instanceof SSLException) {
            return new OperationException(
                    ErrorDomain.CONNECTIVITY,
                    ConnectivityCode.SECURE_CONNECTION_FAILED.code(),
                    message,
                    throwable);
        }

        return new OperationException(
                ErrorDomain.APPLICATION, UNSTRUCTURED_CODE, message, throwable);
    }

    private static boolean isTimeout(Throwable t) {
        // SocketTimeoutException extends InterruptedIOException, not SocketException
        return t instanceof SocketTimeoutException
                || t instanceof TimeoutException
                || t instanceof HttpTimeoutException;
    }

    private static OperationException transport(
            ConnectivityCode code, String message, Throwable cause) {
        return new OperationException(ErrorDomain.TRANSPORT, code.code(), message, cause);
    }

    private static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return msg != null ? msg : t.getClass().getSimpleName();
    }
}
