package io.durableproxy.server;

import io.durableproxy.core.ErrorCode;
import io.durableproxy.core.frame.ErrorPayload;
import io.durableproxy.server.frames.ResponseFrameWriter;
import io.durableproxy.server.registry.InFlightResponse;
import io.durableproxy.server.registry.SessionRegistry;
import io.durableproxy.server.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Copies one upstream body into Data frames and ends the response with Complete, or with an Error
 * frame when the upstream fails, stalls or grows too large.
 */
final class ResponsePump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ResponsePump.class);

    static final int CHUNK_SIZE = 64 * 1024;

    private final InFlightResponse response;
    private final InputStream body;
    private final SessionRegistry registry;
    private final ScheduledExecutorService timer;
    private final Duration idleTimeout;
    private final long maxResponseBytes;
    private final AtomicBoolean idle = new AtomicBoolean();

    private volatile long lastActivityNanos;

    ResponsePump(InFlightResponse response, InputStream body, SessionRegistry registry,
                 ScheduledExecutorService timer, Duration idleTimeout, long maxResponseBytes) {
        this.response = response;
        this.body = body;
        this.registry = registry;
        this.timer = timer;
        this.idleTimeout = idleTimeout;
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public void run() {
        ResponseFrameWriter writer = response.writer();
        response.attachPump(Thread.currentThread());
        ScheduledFuture<?> watchdog = scheduleWatchdog();
        try {
            pump(writer);
        } catch (StorageException.StreamNotFound e) {
            LOG.debug("Stream {} went away while pumping response {}", response.streamId(), response.responseId());
        } catch (StorageException e) {
            LOG.warn("Storage failed while pumping response {} on stream {}",
                    response.responseId(), response.streamId(), e);
            endWithStorageError(writer, e);
        } finally {
            if (watchdog != null) watchdog.cancel(false);
            response.detachPump();
            response.closeUpstream();
            registry.remove(response.streamId(), response.responseId());
        }
    }

    private void pump(ResponseFrameWriter writer) throws StorageException {
        byte[] buf = new byte[CHUNK_SIZE];
        long total = 0;
        lastActivityNanos = System.nanoTime();
        while (true) {
            int n;
            try {
                n = body.read(buf);
            } catch (IOException e) {
                Thread.interrupted(); // cancellation wakes the read by interrupting it
                if (idle.get()) {
                    fail(writer, ErrorCode.IDLE_TIMEOUT, "no data from upstream for " + idleTimeout.toSeconds() + "s");
                } else if (!response.isAborted()) {
                    LOG.warn("Upstream body failed for response {} on stream {}: {}",
                            response.responseId(), response.streamId(), e.toString());
                    fail(writer, ErrorCode.UPSTREAM_ERROR, "upstream failed: " + e.getMessage());
                }
                return;
            }
            if (n < 0) break;
            if (n == 0) continue;
            lastActivityNanos = System.nanoTime();
            total += n;
            if (total > maxResponseBytes) {
                fail(writer, ErrorCode.RESPONSE_TOO_LARGE, "upstream response exceeds " + maxResponseBytes + " bytes");
                return;
            }
            if (!writer.data(Arrays.copyOf(buf, n))) return; // aborted
        }
        // a closed body may read as EOF rather than failing
        Thread.interrupted();
        if (idle.get()) {
            fail(writer, ErrorCode.IDLE_TIMEOUT, "no data from upstream for " + idleTimeout.toSeconds() + "s");
            return;
        }
        if (response.isAborted()) return;
        if (writer.complete()) {
            LOG.debug("Completed response {} on stream {} ({} bytes)", response.responseId(), response.streamId(), total);
        }
    }

    private void endWithStorageError(ResponseFrameWriter writer, StorageException cause) {
        Thread.interrupted();
        try {
            fail(writer, ErrorCode.STORAGE_ERROR, "storage failed: " + cause.getMessage());
        } catch (StorageException e) {
            LOG.error("Response {} on stream {} could not be ended", response.responseId(), response.streamId(), e);
        }
    }

    private void fail(ResponseFrameWriter writer, ErrorCode code, String message) throws StorageException {
        writer.error(new ErrorPayload(message, code.name()));
    }

    private ScheduledFuture<?> scheduleWatchdog() {
        if (idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()) return null;
        long periodMillis = Math.max(50, Math.min(idleTimeout.toMillis() / 4, 5_000));
        return timer.scheduleAtFixedRate(this::checkIdle, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    private void checkIdle() {
        if (System.nanoTime() - lastActivityNanos < idleTimeout.toNanos()) return;
        if (idle.compareAndSet(false, true)) {
            LOG.debug("Response {} on stream {} idle, closing upstream", response.responseId(), response.streamId());
            response.closeUpstream();
        }
    }
}
