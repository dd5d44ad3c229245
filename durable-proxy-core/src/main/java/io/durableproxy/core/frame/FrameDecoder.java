package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Incremental frame decoder for arbitrarily chunked input.
 *
 * <p>Every complete frame in the buffer is returned from {@link #push}; a trailing partial frame is
 * kept for the next call. Any framing error poisons the decoder: once a frame boundary is lost,
 * no later byte can be trusted.
 *
 * <p>Not thread-safe.
 */
public final class FrameDecoder {

    private byte[] buf = new byte[4096];
    private int readPos;
    private int writePos;
    private RuntimeException failure;

    /**
     * Appends {@code len} bytes and returns the frames they complete, in wire order.
     */
    public List<Frame> push(byte[] chunk, int off, int len) {
        if (failure != null) {
            throw new IllegalStateException("decoder failed earlier", failure);
        }
        append(chunk, off, len);

        List<Frame> out = new ArrayList<>();
        try {
            while (writePos - readPos >= FrameCodec.HEADER_LENGTH) {
                FrameType type = FrameType.fromCode(buf[readPos]);
                long id = FrameCodec.readUnsignedInt(buf, readPos + 1);
                long length = FrameCodec.readUnsignedInt(buf, readPos + 5);
                if (length > FrameCodec.MAX_PAYLOAD_LENGTH) {
                    throw new DurableProxyException.MalformedFrame("frame length " + length + " too large");
                }
                int frameEnd = readPos + FrameCodec.HEADER_LENGTH + (int) length;
                if (frameEnd > writePos || frameEnd < 0) break;

                byte[] payload = Arrays.copyOfRange(buf, readPos + FrameCodec.HEADER_LENGTH, frameEnd);
                out.add(new Frame(type, id, payload));
                readPos = frameEnd;
            }
        } catch (DurableProxyException e) {
            failure = e;
            throw e;
        }

        if (readPos == writePos) {
            readPos = 0;
            writePos = 0;
        }
        return out;
    }

    public List<Frame> push(byte[] chunk) {
        return push(chunk, 0, chunk.length);
    }

    /** Bytes held for a frame that is not complete yet. */
    public int buffered() {
        return writePos - readPos;
    }

    /**
     * Declared payload length of the partial frame at the head of the buffer, or -1 while its header
     * is incomplete.
     */
    public long pendingFrameLength() {
        if (writePos - readPos < FrameCodec.HEADER_LENGTH) return -1;
        return FrameCodec.HEADER_LENGTH + FrameCodec.readUnsignedInt(buf, readPos + 5);
    }

    private void append(byte[] chunk, int off, int len) {
        if (len == 0) return;
        int live = writePos - readPos;
        if (buf.length - writePos < len) {
            if (buf.length - live >= len && readPos > 0) {
                System.arraycopy(buf, readPos, buf, 0, live);
            } else {
                int needed = live + len;
                int cap = Math.max(buf.length * 2, needed);
                if (cap < 0) throw new DurableProxyException.FrameBufferOverflow(Integer.MAX_VALUE);
                byte[] grown = new byte[cap];
                System.arraycopy(buf, readPos, grown, 0, live);
                buf = grown;
            }
            readPos = 0;
            writePos = live;
        }
        System.arraycopy(chunk, off, buf, writePos, len);
        writePos += len;
    }
}
