package io.durableproxy.client;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Push-driven body stream: the demuxer offers Data payloads, the application reads them.
 *
 * <p>Reads block until bytes arrive or the response ends. A terminal failure is raised only after
 * the bytes received before it have been read.
 */
final class ResponseBodyChannel extends InputStream {

    private final BodyBudget budget;
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private int headPos;
    private boolean ended;
    private boolean closed;
    private IOException failure;

    ResponseBodyChannel(BodyBudget budget) {
        this.budget = budget;
    }

    /**
     * @return false when the reader already closed the stream and the bytes were discarded
     */
    synchronized boolean offer(byte[] bytes) {
        if (closed || ended) return false;
        if (bytes.length == 0) return true;
        chunks.addLast(bytes);
        notifyAll();
        return true;
    }

    synchronized void end() {
        if (ended) return;
        ended = true;
        notifyAll();
    }

    synchronized void fail(IOException e) {
        if (ended) return;
        ended = true;
        failure = e;
        notifyAll();
    }

    @Override
    public synchronized int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public synchronized int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) return 0;
        while (chunks.isEmpty()) {
            if (closed) throw new IOException("body stream closed");
            if (ended) {
                if (failure != null) throw failure;
                return -1;
            }
            try {
                wait();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while reading response body");
            }
        }
        byte[] head = chunks.peekFirst();
        int n = Math.min(len, head.length - headPos);
        System.arraycopy(head, headPos, b, off, n);
        headPos += n;
        if (headPos == head.length) {
            chunks.pollFirst();
            headPos = 0;
        }
        budget.release(n);
        return n;
    }

    @Override
    public synchronized int available() {
        int n = 0;
        for (byte[] c : chunks) n += c.length;
        return n - headPos;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        int left = available();
        chunks.clear();
        headPos = 0;
        budget.release(left);
        notifyAll();
    }
}
