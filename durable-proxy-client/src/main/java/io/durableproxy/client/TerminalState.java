package io.durableproxy.client;

/**
 * How a proxied response ended.
 */
public enum TerminalState {
    COMPLETE,
    ABORTED,
    ERRORED
}
