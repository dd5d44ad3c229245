package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;

/**
 * Frame types of the proxy wire format, keyed by their single ASCII type byte.
 */
public enum FrameType {
    /** Response start: JSON {@code {"status":..,"headers":{..}}}. */
    START('S'),
    /** A chunk of the upstream response body. */
    DATA('D'),
    /** The upstream body ended normally. */
    COMPLETE('C'),
    /** The response was cancelled by a client. */
    ABORT('A'),
    /** The upstream failed after the response started. */
    ERROR('E');

    private final byte code;

    FrameType(char code) {
        this.code = (byte) code;
    }

    public byte code() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ABORT || this == ERROR;
    }

    /**
     * @throws DurableProxyException.UnknownFrameType for any byte outside the five known types
     */
    public static FrameType fromCode(int b) {
        switch (b & 0xff) {
            case 'S': return START;
            case 'D': return DATA;
            case 'C': return COMPLETE;
            case 'A': return ABORT;
            case 'E': return ERROR;
            default: throw new DurableProxyException.UnknownFrameType(b);
        }
    }
}
