package io.durableproxy.client;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * One upstream response reconstructed from the frame log.
 *
 * <p>Status and headers come from the Start frame. The body streams as Data frames arrive;
 * {@link #completion()} settles when the terminal frame is seen.
 */
public final class ProxyResponse {

    private final long responseId;
    private final int status;
    private final Map<String, String> headers;
    private final ResponseBodyChannel body;
    private final CompletableFuture<TerminalState> completion = new CompletableFuture<>();
    private final ResponseAborter aborter;
    private volatile TerminalState terminalState;

    ProxyResponse(long responseId, int status, Map<String, String> headers, ResponseBodyChannel body,
                  ResponseAborter aborter) {
        this.responseId = responseId;
        this.status = status;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body;
        this.aborter = aborter;
    }

    public long responseId() {
        return responseId;
    }

    public int status() {
        return status;
    }

    /** Upstream headers, keyed case-insensitively. */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    public InputStream body() {
        return body;
    }

    /** Reads the remaining body fully. Blocks until the response is terminal. */
    public byte[] readAllBytes() throws IOException {
        return body.readAllBytes();
    }

    public String bodyAsString() throws IOException {
        return new String(readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Completes with {@link TerminalState#COMPLETE} on a Complete frame; completes exceptionally with
     * {@link ResponseAbortedException} or {@link ResponseFailedException} otherwise.
     */
    public CompletableFuture<TerminalState> completion() {
        return completion;
    }

    /** The terminal state, once known. */
    public Optional<TerminalState> terminalState() {
        return Optional.ofNullable(terminalState);
    }

    /** Asks the proxy to stop this response. */
    public void abort() throws Exception {
        aborter.abort(responseId);
    }

    ResponseBodyChannel channel() {
        return body;
    }

    void complete() {
        if (!settle(TerminalState.COMPLETE)) return;
        body.end();
        completion.complete(TerminalState.COMPLETE);
    }

    void aborted() {
        if (!settle(TerminalState.ABORTED)) return;
        ResponseAbortedException e = new ResponseAbortedException(responseId);
        body.fail(e);
        completion.completeExceptionally(e);
    }

    void failed(IOException e) {
        if (!settle(TerminalState.ERRORED)) return;
        body.fail(e);
        completion.completeExceptionally(e);
    }

    private synchronized boolean settle(TerminalState state) {
        if (terminalState != null) return false;
        terminalState = state;
        return true;
    }

    @Override
    public String toString() {
        return "ProxyResponse{id=" + responseId + ", status=" + status + ", state=" + terminalState + "}";
    }
}
