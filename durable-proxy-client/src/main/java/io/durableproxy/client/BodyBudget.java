package io.durableproxy.client;

import io.durableproxy.core.DurableProxyException;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Byte allowance shared by a demuxer's parse buffer and every unread response body it feeds.
 */
final class BodyBudget {

    private final long limit;
    private final AtomicLong buffered = new AtomicLong();

    BodyBudget(long limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        this.limit = limit;
    }

    long limit() {
        return limit;
    }

    long buffered() {
        return buffered.get();
    }

    /**
     * Checks that {@code extra} more bytes fit next to what bodies already hold.
     */
    void check(long extra) {
        if (buffered.get() + extra > limit) throw new DurableProxyException.FrameBufferOverflow(limit);
    }

    void reserve(long bytes, long parseBuffered) {
        if (buffered.addAndGet(bytes) + parseBuffered > limit) {
            buffered.addAndGet(-bytes);
            throw new DurableProxyException.FrameBufferOverflow(limit);
        }
    }

    void release(long bytes) {
        buffered.addAndGet(-bytes);
    }
}
