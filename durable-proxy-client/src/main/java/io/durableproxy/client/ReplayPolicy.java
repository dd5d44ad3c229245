package io.durableproxy.client;

/**
 * What the demuxer does with frames that do not fit a response's lifecycle: frames for an id it
 * never saw start, frames after a terminal frame, and repeated Starts.
 */
public enum ReplayPolicy {
    /** Drop the frame and keep reading. */
    LENIENT,
    /** Fail the demuxer with a protocol violation. */
    STRICT
}
