package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary frame encoding.
 *
 * <p>Layout: 1 byte type, 4 byte big-endian unsigned response id, 4 byte big-endian payload length,
 * then the payload.
 */
public final class FrameCodec {
    private FrameCodec() {}

    public static final int HEADER_LENGTH = 9;
    public static final long MAX_RESPONSE_ID = 0xFFFFFFFFL;
    public static final int MAX_PAYLOAD_LENGTH = Integer.MAX_VALUE - HEADER_LENGTH;

    public static byte[] encode(Frame frame) {
        byte[] payload = frame.payload();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + payload.length);
        buf.put(frame.type().code());
        buf.putInt((int) frame.responseId());
        buf.putInt(payload.length);
        buf.put(payload);
        return buf.array();
    }

    /** Encodes several frames back to back. */
    public static byte[] encodeAll(List<Frame> frames) {
        int total = 0;
        for (Frame f : frames) total += HEADER_LENGTH + f.payload().length;
        ByteBuffer buf = ByteBuffer.allocate(total);
        for (Frame f : frames) buf.put(encode(f));
        return buf.array();
    }

    /**
     * Decodes a byte sequence that must consist of whole frames only.
     *
     * @throws DurableProxyException.MalformedFrame if the bytes end inside a frame
     * @throws DurableProxyException.UnknownFrameType on an unknown type byte
     */
    public static List<Frame> decodeAll(byte[] bytes) {
        FrameDecoder decoder = new FrameDecoder();
        List<Frame> frames = new ArrayList<>(decoder.push(bytes, 0, bytes.length));
        if (decoder.buffered() > 0) {
            throw new DurableProxyException.MalformedFrame(
                    "truncated frame: " + decoder.buffered() + " trailing bytes");
        }
        return frames;
    }

    static long readUnsignedInt(byte[] b, int off) {
        return ((long) (b[off] & 0xff) << 24)
                | ((long) (b[off + 1] & 0xff) << 16)
                | ((long) (b[off + 2] & 0xff) << 8)
                | ((long) (b[off + 3] & 0xff));
    }
}
