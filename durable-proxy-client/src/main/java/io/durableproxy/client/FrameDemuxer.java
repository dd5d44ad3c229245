package io.durableproxy.client;

import io.durableproxy.core.DurableProxyException;
import io.durableproxy.core.frame.ErrorPayload;
import io.durableproxy.core.frame.Frame;
import io.durableproxy.core.frame.FrameDecoder;
import io.durableproxy.core.frame.FramePayloads;
import io.durableproxy.core.frame.FrameSequenceValidator;
import io.durableproxy.core.frame.StartPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Rebuilds logical responses from an interleaved frame byte stream.
 *
 * <p>{@link #push} is called by a single reader thread. Waiters, {@link #responses()} consumers and
 * {@link #close()}/{@link #error(Throwable)} may run on any thread.
 *
 * <p>Any framing failure, including a buffer overflow, is fatal for the demuxer: every open
 * response and every pending waiter fails with it.
 */
public final class FrameDemuxer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FrameDemuxer.class);

    public static final long DEFAULT_MAX_BUFFER_BYTES = 4L * 1024 * 1024;
    static final int RETAINED_TERMINATED = 256;

    private static final ProxyResponse END = new ProxyResponse(0, 0, Map.of(), null, ResponseAborter.UNSUPPORTED);

    private final BodyBudget budget;
    private final ReplayPolicy replayPolicy;
    private final ResponseAborter aborter;

    private final FrameDecoder decoder = new FrameDecoder();
    private final FrameSequenceValidator sequence = new FrameSequenceValidator();
    private final Map<Long, ProxyResponse> open = new HashMap<>();
    private final Map<Long, ProxyResponse> terminated = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, ProxyResponse> eldest) {
            return size() > RETAINED_TERMINATED;
        }
    };
    private final Map<Long, CompletableFuture<ProxyResponse>> pending = new HashMap<>();
    private final BlockingQueue<ProxyResponse> queue = new LinkedBlockingQueue<>();

    private Throwable terminalError;

    public FrameDemuxer() {
        this(DEFAULT_MAX_BUFFER_BYTES, ReplayPolicy.LENIENT, ResponseAborter.UNSUPPORTED);
    }

    public FrameDemuxer(long maxBufferBytes, ReplayPolicy replayPolicy, ResponseAborter aborter) {
        this.budget = new BodyBudget(maxBufferBytes);
        this.replayPolicy = Objects.requireNonNull(replayPolicy, "replayPolicy");
        this.aborter = Objects.requireNonNull(aborter, "aborter");
    }

    /**
     * Feeds a chunk of log bytes. Chunks may split frames anywhere.
     *
     * @throws DurableProxyException when the bytes cannot be framed; the demuxer is failed first
     */
    public void push(byte[] chunk) {
        push(chunk, 0, chunk.length);
    }

    public void push(byte[] chunk, int off, int len) {
        synchronized (this) {
            if (terminalError != null) {
                throw new IllegalStateException("demuxer is closed", terminalError);
            }
        }
        List<Frame> frames;
        try {
            budget.check((long) decoder.buffered() + len);
            frames = decoder.push(chunk, off, len);
        } catch (DurableProxyException e) {
            error(e);
            throw e;
        }
        try {
            for (Frame frame : frames) {
                handle(frame);
            }
        } catch (DurableProxyException e) {
            error(e);
            throw e;
        }
    }

    /**
     * Resolves when the Start frame for {@code responseId} arrives, or at once when that response
     * is already known. Each call returns its own future; cancelling it affects no other waiter.
     */
    public synchronized CompletableFuture<ProxyResponse> waitForResponse(long responseId) {
        if (terminalError != null) return CompletableFuture.failedFuture(terminalError);
        ProxyResponse known = open.get(responseId);
        if (known == null) known = terminated.get(responseId);
        if (known != null) return CompletableFuture.completedFuture(known);
        return pending.computeIfAbsent(responseId, id -> new CompletableFuture<>()).copy();
    }

    /**
     * Responses in Start order. The iterator blocks for the next one and ends once the demuxer is
     * closed or failed.
     */
    public Iterator<ProxyResponse> responses() {
        return new Iterator<>() {
            private ProxyResponse next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = queue.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                    if (next == END) queue.offer(END);
                }
                return next != END;
            }

            @Override
            public ProxyResponse next() {
                if (!hasNext()) throw new NoSuchElementException();
                ProxyResponse r = next;
                next = null;
                return r;
            }
        };
    }

    public synchronized boolean isClosed() {
        return terminalError != null;
    }

    /** Bytes currently held by the parse buffer and unread bodies. */
    public long bufferedBytes() {
        return budget.buffered() + decoder.buffered();
    }

    /**
     * Ends the demuxer. Open bodies end at what they have received so far; pending waiters fail.
     */
    @Override
    public void close() {
        List<ProxyResponse> stillOpen;
        synchronized (this) {
            if (terminalError != null) return;
            terminalError = new IOException("frame stream closed");
            stillOpen = new ArrayList<>(open.values());
            open.clear();
            terminated.clear();
            failPending(terminalError);
        }
        for (ProxyResponse r : stillOpen) {
            r.failed(new ResponseFailedException(r.responseId(), "frame stream closed before response ended", null));
        }
        queue.offer(END);
    }

    /**
     * Fails the demuxer: every open response and every pending waiter fails with {@code cause}.
     */
    public void error(Throwable cause) {
        List<ProxyResponse> stillOpen;
        synchronized (this) {
            if (terminalError != null) return;
            terminalError = cause;
            stillOpen = new ArrayList<>(open.values());
            open.clear();
            terminated.clear();
            failPending(cause);
        }
        LOG.debug("Demuxer failed with {} open responses", stillOpen.size(), cause);
        for (ProxyResponse r : stillOpen) {
            r.failed(new ResponseFailedException(r.responseId(), "frame stream failed: " + cause.getMessage(), cause));
        }
        queue.offer(END);
    }

    private void failPending(Throwable cause) {
        for (CompletableFuture<ProxyResponse> f : pending.values()) {
            f.completeExceptionally(cause);
        }
        pending.clear();
    }

    private void handle(Frame frame) {
        FrameSequenceValidator.Outcome outcome = sequence.check(frame);
        if (outcome != FrameSequenceValidator.Outcome.ACCEPTED) {
            if (replayPolicy == ReplayPolicy.STRICT) {
                throw new DurableProxyException.ProtocolViolation(frame.responseId(),
                        outcome + " for " + frame.type() + " frame");
            }
            LOG.debug("Dropping {} frame for response {} ({})", frame.type(), frame.responseId(), outcome);
            return;
        }

        long id = frame.responseId();
        switch (frame.type()) {
            case START -> onStart(id, FramePayloads.decodeStart(frame.payload()));
            case DATA -> onData(id, frame.payload());
            case COMPLETE -> {
                ProxyResponse r = finish(id);
                if (r != null) r.complete();
            }
            case ABORT -> {
                ProxyResponse r = finish(id);
                if (r != null) r.aborted();
            }
            case ERROR -> {
                ProxyResponse r = finish(id);
                ErrorPayload error = FramePayloads.decodeError(frame.payload());
                if (r != null) r.failed(new ResponseFailedException(id, error));
            }
        }
    }

    private void onStart(long id, StartPayload start) {
        ProxyResponse response = new ProxyResponse(id, start.status(), start.headers(),
                new ResponseBodyChannel(budget), aborter);
        CompletableFuture<ProxyResponse> waiter;
        synchronized (this) {
            open.put(id, response);
            waiter = pending.remove(id);
        }
        queue.offer(response);
        if (waiter != null) waiter.complete(response);
    }

    private void onData(long id, byte[] payload) {
        ProxyResponse r;
        synchronized (this) {
            r = open.get(id);
        }
        if (r == null || payload.length == 0) return;
        budget.reserve(payload.length, decoder.buffered());
        if (!r.channel().offer(payload)) {
            budget.release(payload.length);
        }
    }

    private synchronized ProxyResponse finish(long id) {
        ProxyResponse r = open.remove(id);
        if (r != null) terminated.put(id, r);
        return r;
    }
}
