package io.durableproxy.server.upstream;

/**
 * Thrown when the upstream cannot be reached or drops the connection before responding.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
