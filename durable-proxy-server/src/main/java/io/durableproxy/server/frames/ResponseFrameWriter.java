package io.durableproxy.server.frames;

import io.durableproxy.core.frame.ErrorPayload;
import io.durableproxy.core.frame.Frame;
import io.durableproxy.core.frame.FrameCodec;
import io.durableproxy.core.frame.FrameType;
import io.durableproxy.core.frame.StartPayload;
import io.durableproxy.server.storage.StorageException;
import io.durableproxy.server.storage.StreamStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Appends the frames of one response to its stream.
 *
 * <p>Enforces the response lifecycle: one Start, then Data, then exactly one terminal frame. Appends
 * are serialized, so a terminal frame written by an abort can never be followed by more Data from the
 * pump. Each frame is a single storage append, retried a bounded number of times when storage
 * fails. A terminal frame counts only once its append succeeded, so a failed Complete can still be
 * followed by an Error.
 */
public final class ResponseFrameWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseFrameWriter.class);

    public static final int APPEND_ATTEMPTS = 3;
    private static final long RETRY_BACKOFF_MILLIS = 25;

    private enum State { NEW, STARTED, TERMINATED }

    private final StreamStorage storage;
    private final String streamId;
    private final long responseId;

    private State state = State.NEW;
    private FrameType terminal;
    private long dataBytes;

    public ResponseFrameWriter(StreamStorage storage, String streamId, long responseId) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.responseId = responseId;
    }

    public String streamId() {
        return streamId;
    }

    public long responseId() {
        return responseId;
    }

    public synchronized void start(StartPayload start) throws StorageException {
        if (state != State.NEW) throw new IllegalStateException("response " + responseId + " already started");
        append(Frame.start(responseId, start));
        state = State.STARTED;
    }

    /**
     * @return {@code false} if the response already ended and the bytes were dropped
     */
    public synchronized boolean data(byte[] bytes) throws StorageException {
        if (state == State.TERMINATED) return false;
        requireStarted();
        if (bytes.length == 0) return true;
        append(Frame.data(responseId, bytes));
        dataBytes += bytes.length;
        return true;
    }

    /** @return {@code true} if this call wrote the terminal frame */
    public boolean complete() throws StorageException {
        return terminate(Frame.complete(responseId));
    }

    /** @return {@code true} if this call wrote the terminal frame */
    public boolean abort() throws StorageException {
        return terminate(Frame.abort(responseId));
    }

    /** @return {@code true} if this call wrote the terminal frame */
    public boolean error(ErrorPayload error) throws StorageException {
        return terminate(Frame.error(responseId, error));
    }

    public synchronized boolean isTerminated() {
        return state == State.TERMINATED;
    }

    /** Terminal frame type, or {@code null} while the response is open. */
    public synchronized FrameType terminalType() {
        return terminal;
    }

    public synchronized long dataBytes() {
        return dataBytes;
    }

    private synchronized boolean terminate(Frame frame) throws StorageException {
        if (state == State.TERMINATED) return false;
        requireStarted();
        append(frame);
        state = State.TERMINATED;
        terminal = frame.type();
        return true;
    }

    private void append(Frame frame) throws StorageException {
        byte[] bytes = FrameCodec.encode(frame);
        for (int attempt = 1; ; attempt++) {
            try {
                storage.append(streamId, bytes);
                return;
            } catch (StorageException.StreamNotFound e) {
                throw e;
            } catch (StorageException e) {
                if (attempt >= APPEND_ATTEMPTS || !pause(attempt)) throw e;
                LOG.debug("Append of {} frame for response {} on stream {} failed (attempt {}): {}",
                        frame.type(), responseId, streamId, attempt, e.getMessage());
            }
        }
    }

    private static boolean pause(int attempt) {
        try {
            Thread.sleep(RETRY_BACKOFF_MILLIS * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void requireStarted() {
        if (state == State.NEW) throw new IllegalStateException("response " + responseId + " not started");
    }
}
