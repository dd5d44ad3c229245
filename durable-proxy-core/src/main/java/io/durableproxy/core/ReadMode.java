package io.durableproxy.core;

/**
 * How a stream read waits for data.
 */
public enum ReadMode {
    /** Return what is there now. */
    CATCH_UP(null),
    /** Hold the request open until data arrives or the timeout passes. */
    LONG_POLL(Protocol.LIVE_LONG_POLL),
    /** Server-sent events with data and control events. */
    SSE(Protocol.LIVE_SSE);

    private final String wireValue;

    ReadMode(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Value of the {@code live} query parameter, or {@code null} for catch-up reads. */
    public String wireValue() {
        return wireValue;
    }

    /**
     * @throws IllegalArgumentException for unknown live modes
     */
    public static ReadMode fromWire(String live) {
        if (live == null || live.isEmpty()) return CATCH_UP;
        if (Protocol.LIVE_LONG_POLL.equals(live)) return LONG_POLL;
        if (Protocol.LIVE_SSE.equals(live)) return SSE;
        throw new IllegalArgumentException("invalid live mode: " + live);
    }
}
