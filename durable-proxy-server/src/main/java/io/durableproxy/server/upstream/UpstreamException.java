package io.durableproxy.server.upstream;

/**
 * Base exception for failures talking to an upstream before its response headers arrived.
 *
 * <p>Subtypes:
 * <ul>
 * <li>{@link UpstreamConnectException} - refused, unreachable, reset
 * <li>{@link UpstreamTimeoutException} - no response headers in time
 * </ul>
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
