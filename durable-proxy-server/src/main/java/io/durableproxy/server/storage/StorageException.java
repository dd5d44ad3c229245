package io.durableproxy.server.storage;

/**
 * Failure talking to the append-only log. Surfaced to callers as {@code 502 STORAGE_ERROR}.
 */
public class StorageException extends Exception {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The addressed stream does not exist (or has expired).
     */
    public static class StreamNotFound extends StorageException {
        private static final long serialVersionUID = 1L;

        public StreamNotFound(String streamId) {
            super("stream not found: " + streamId);
        }
    }
}
