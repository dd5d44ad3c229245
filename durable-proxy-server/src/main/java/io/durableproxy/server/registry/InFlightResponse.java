package io.durableproxy.server.registry;

import io.durableproxy.server.frames.ResponseFrameWriter;
import io.durableproxy.server.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A response whose upstream body is still being pumped into the stream.
 */
public final class InFlightResponse {

    private static final Logger LOG = LoggerFactory.getLogger(InFlightResponse.class);

    private final ResponseFrameWriter writer;
    private final Closeable upstream;
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final Object pumpLock = new Object();
    private Thread pumpThread;

    public InFlightResponse(ResponseFrameWriter writer, Closeable upstream) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
    }

    public String streamId() {
        return writer.streamId();
    }

    public long responseId() {
        return writer.responseId();
    }

    public ResponseFrameWriter writer() {
        return writer;
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Cancels the upstream call and appends an Abort frame. Idempotent; a response that already
     * finished is left as is.
     */
    public void abort() throws StorageException {
        if (!aborted.compareAndSet(false, true)) return;
        try {
            if (writer.abort()) {
                LOG.debug("Aborted response {} on stream {}", responseId(), streamId());
            }
        } finally {
            closeUpstream();
        }
    }

    /** Binds the thread copying the upstream body, so cancellation can wake it. */
    public void attachPump(Thread thread) {
        synchronized (pumpLock) {
            pumpThread = thread;
        }
    }

    /**
     * Unbinds the calling pump thread and clears any interrupt aimed at it. Once this returns, no
     * cancellation of this response can interrupt the thread, which may go on to pump another one.
     */
    public void detachPump() {
        synchronized (pumpLock) {
            pumpThread = null;
            Thread.interrupted();
        }
    }

    /**
     * Closes the upstream body and wakes a pump blocked reading it.
     */
    public void closeUpstream() {
        try {
            upstream.close();
        } catch (IOException e) {
            LOG.debug("Closing upstream for response {} failed", responseId(), e);
        }
        synchronized (pumpLock) {
            Thread t = pumpThread;
            if (t != null && t != Thread.currentThread()) t.interrupt();
        }
    }
}
