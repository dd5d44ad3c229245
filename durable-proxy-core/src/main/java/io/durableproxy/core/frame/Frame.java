package io.durableproxy.core.frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * One frame of the proxy wire format: a typed, response-tagged payload.
 *
 * @param type frame type
 * @param responseId unsigned 32-bit response id
 * @param payload frame payload (never null; empty for Complete and Abort)
 */
public record Frame(FrameType type, long responseId, byte[] payload) {

    private static final byte[] EMPTY = new byte[0];

    public Frame {
        Objects.requireNonNull(type, "type");
        if (responseId < 0 || responseId > FrameCodec.MAX_RESPONSE_ID) {
            throw new IllegalArgumentException("responseId out of range: " + responseId);
        }
        payload = payload == null ? EMPTY : payload;
    }

    public static Frame start(long responseId, StartPayload start) {
        return new Frame(FrameType.START, responseId, FramePayloads.encodeStart(start));
    }

    public static Frame data(long responseId, byte[] bytes) {
        return new Frame(FrameType.DATA, responseId, bytes);
    }

    public static Frame complete(long responseId) {
        return new Frame(FrameType.COMPLETE, responseId, EMPTY);
    }

    public static Frame abort(long responseId) {
        return new Frame(FrameType.ABORT, responseId, EMPTY);
    }

    public static Frame error(long responseId, ErrorPayload error) {
        return new Frame(FrameType.ERROR, responseId, FramePayloads.encodeError(error));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame other)) return false;
        return type == other.type && responseId == other.responseId && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, responseId) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[" + (char) type.code() + " id=" + responseId + " len=" + payload.length + "]";
    }
}
