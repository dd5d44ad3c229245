package io.durableproxy.core;

/**
 * Base class for durable proxy protocol exceptions.
 *
 * <p>All framing errors are fatal for the byte stream they occur in: the frame format carries no
 * sync markers, so a reader cannot resynchronize after one.
 */
public abstract class DurableProxyException extends RuntimeException {

    protected DurableProxyException(String message) {
        super(message);
    }

    protected DurableProxyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a provided offset is invalid (malformed, contains forbidden characters).
     */
    public static class InvalidOffset extends DurableProxyException {
        public InvalidOffset(String message) {
            super(message);
        }
    }

    /**
     * Raised when a frame header carries a type byte outside {@code S D C A E}.
     */
    public static class UnknownFrameType extends DurableProxyException {
        private final int typeByte;

        public UnknownFrameType(int typeByte) {
            super(String.format("unknown frame type 0x%02x", typeByte & 0xff));
            this.typeByte = typeByte & 0xff;
        }

        public int typeByte() {
            return typeByte;
        }
    }

    /**
     * Raised when a frame is structurally valid but its payload cannot be interpreted,
     * or when a byte sequence ends inside a frame.
     */
    public static class MalformedFrame extends DurableProxyException {
        public MalformedFrame(String message) {
            super(message);
        }

        public MalformedFrame(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when buffered frame bytes exceed the configured limit.
     */
    public static class FrameBufferOverflow extends DurableProxyException {
        private final long limit;

        public FrameBufferOverflow(long limit) {
            super("frame buffer exceeded " + limit + " bytes");
            this.limit = limit;
        }

        public long limit() {
            return limit;
        }
    }

    /**
     * Raised when frames for one response arrive in an order the lifecycle does not allow.
     */
    public static class ProtocolViolation extends DurableProxyException {
        private final long responseId;

        public ProtocolViolation(long responseId, String message) {
            super("response " + responseId + ": " + message);
            this.responseId = responseId;
        }

        public long responseId() {
            return responseId;
        }
    }
}
