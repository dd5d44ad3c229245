package io.durableproxy.server.upstream;

/**
 * Thrown when the upstream does not send response headers within the configured timeout.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
