package io.durableproxy.client;

import io.durableproxy.core.ErrorCode;
import io.durableproxy.core.Protocol;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Many proxied fetches multiplexed onto one durable stream.
 *
 * <p>The session connects lazily, tails the stream on one background thread and hands each fetch
 * the {@link ProxyResponse} whose Start frame carries its response id. An expired stream URL is
 * renewed in place, or by reconnecting when the proxy cannot renew it; reading resumes at the same
 * offset.
 *
 * <pre>{@code
 * try (DurableSession session = DurableSession.builder(URI.create("https://proxy.example.com/v1/proxy"), "chat-42")
 *         .serviceSecret(secret)
 *         .build()) {
 *     ProxyResponse r = session.fetch("https://api.example.com/v1/chat", options).get();
 *     r.body().transferTo(System.out);
 * }
 * }</pre>
 */
public final class DurableSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DurableSession.class);

    private final DurableProxyTransport transport;
    private final URI proxyUrl;
    private final String sessionId;
    private final String serviceSecret;
    private final String connectUrl;
    private final String renewUrl;
    private final Duration signedUrlTtl;
    private final RequestIdStore requestIds;
    private final String keyPrefix;
    private final ReadMode readMode;
    private final Duration pollDelay;
    private final int maxRetries;
    private final FrameDemuxer demuxer;

    private final Object lock = new Object();
    private volatile URI streamUrl;
    private volatile String streamId;
    private volatile boolean closed;
    private CompletableFuture<Void> connectTask;
    private StreamReader reader;

    private DurableSession(Builder b) {
        this.transport = b.transport != null ? b.transport : new JdkHttpTransport();
        this.proxyUrl = stripTrailingSlash(b.proxyUrl);
        this.sessionId = b.sessionId;
        this.serviceSecret = b.serviceSecret;
        this.connectUrl = b.connectUrl;
        this.renewUrl = b.renewUrl;
        this.signedUrlTtl = b.signedUrlTtl;
        this.requestIds = b.requestIds != null ? b.requestIds : new InMemoryRequestIdStore();
        this.keyPrefix = b.keyPrefix;
        this.readMode = b.readMode;
        this.pollDelay = b.pollDelay;
        this.maxRetries = b.maxRetries;
        this.demuxer = new FrameDemuxer(b.maxBufferBytes, b.replayPolicy, this::abort);
    }

    public static Builder builder(URI proxyUrl, String sessionId) {
        return new Builder(proxyUrl, sessionId);
    }

    public String sessionId() {
        return sessionId;
    }

    public Optional<URI> streamUrl() {
        return Optional.ofNullable(streamUrl);
    }

    public Optional<String> streamId() {
        return Optional.ofNullable(streamId);
    }

    /**
     * Connects the session to its stream, creating the stream on first use. Concurrent callers
     * share one attempt; calling again after success fetches a fresh stream URL.
     */
    public void connect() throws Exception {
        CompletableFuture<Void> task;
        boolean owner = false;
        synchronized (lock) {
            ensureOpen();
            if (connectTask == null) {
                connectTask = new CompletableFuture<>();
                owner = true;
            }
            task = connectTask;
        }
        if (owner) {
            try {
                doConnect();
                task.complete(null);
            } catch (Exception e) {
                task.completeExceptionally(e);
                throw e;
            } finally {
                synchronized (lock) {
                    connectTask = null;
                }
            }
        } else {
            await(task);
        }
        ensureReader();
    }

    /**
     * Sends one upstream call through the proxy onto this session's stream.
     *
     * <p>With a request id that was seen before, no new upstream call is made: the future resolves
     * with the response recorded for it. Cancelling the returned future affects only this caller.
     */
    public CompletableFuture<ProxyResponse> fetch(String upstreamUrl, FetchOptions options) throws Exception {
        Objects.requireNonNull(upstreamUrl, "upstreamUrl");
        FetchOptions opts = options != null ? options : FetchOptions.defaults();
        if (streamUrl == null) connect();
        ensureOpen();

        String key = opts.requestId() == null ? null
                : RequestIdStore.key(keyPrefix, proxyUrl.toString(), sessionId, opts.requestId());
        if (key != null) {
            Optional<RequestMapping> existing = requestIds.load(key);
            if (existing.isPresent()) {
                LOG.debug("Request {} maps to response {}; not re-sending", opts.requestId(), existing.get().responseId());
                ensureReader();
                return demuxer.waitForResponse(existing.get().responseId());
            }
        }

        Map<String, List<String>> headers = ProxyRequests.upstreamHeaders(upstreamUrl, opts, signedUrlTtl);
        headers.put(Protocol.H_USE_STREAM_URL, List.of(streamUrl.toString()));
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.post(
                ProxyRequests.withSecret(proxyUrl, serviceSecret), headers, opts.body()));
        if (!resp.isSuccess()) throw ProxyRequestException.fromResponse("append", resp);

        long responseId = ProxyRequests.responseId("append", resp);
        URI refreshed = ProxyRequests.location("append", proxyUrl, resp);
        streamUrl = refreshed;
        streamId = ProxyRequests.streamId(refreshed, resp);
        if (key != null) requestIds.save(key, new RequestMapping(null, responseId));

        ensureReader();
        return demuxer.waitForResponse(responseId);
    }

    /**
     * Responses on the stream in Start order, including ones started by other clients. Blocks for
     * the next one; ends when the session closes.
     */
    public Iterator<ProxyResponse> responses() throws Exception {
        if (streamUrl == null) connect();
        ensureReader();
        return demuxer.responses();
    }

    /** Aborts the latest in-flight response on the stream. */
    public void abort() throws Exception {
        URI url = streamUrl;
        if (url == null) return;
        ProxyRequests.abort(transport, url, null);
    }

    public void abort(long responseId) throws Exception {
        URI url = streamUrl;
        if (url == null) throw new IllegalStateException("session is not connected");
        ProxyRequests.abort(transport, url, responseId);
    }

    @Override
    public void close() {
        StreamReader r;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            r = reader;
            reader = null;
        }
        if (r != null) r.stop();
        demuxer.close();
        LOG.debug("Session {} closed", sessionId);
    }

    private void doConnect() throws Exception {
        URI url = Urls.withQuery(proxyUrl.resolve(proxyUrl.getRawPath() + "/" + Urls.encode(sessionId)),
                Map.of(Protocol.Q_ACTION, Protocol.ACTION_CONNECT));
        url = ProxyRequests.withSecret(url, serviceSecret);

        Map<String, List<String>> headers = new LinkedHashMap<>();
        if (connectUrl != null) headers.put(Protocol.H_UPSTREAM_URL, List.of(connectUrl));
        if (signedUrlTtl != null) {
            headers.put(Protocol.H_STREAM_SIGNED_URL_TTL, List.of(Long.toString(signedUrlTtl.getSeconds())));
        }
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.post(url, headers, null));
        if (!resp.isSuccess()) throw ProxyRequestException.fromResponse("connect", resp);

        URI location = ProxyRequests.location("connect", proxyUrl, resp);
        streamUrl = location;
        streamId = ProxyRequests.streamId(location, resp);
        LOG.debug("Session {} connected to stream {}", sessionId, streamId);
    }

    URI renewStreamUrl() throws Exception {
        URI expired = streamUrl;
        try {
            URI renewed = ProxyRequests.renew(transport, proxyUrl, expired, serviceSecret,
                    ProxyRequests.renewHeaders(renewUrl, null, signedUrlTtl));
            streamUrl = renewed;
            LOG.debug("Session {} renewed its stream URL", sessionId);
            return renewed;
        } catch (ProxyRequestException e) {
            if (ErrorCode.RENEWAL_REJECTED.name().equals(e.code())) throw e;
            LOG.debug("Session {} could not renew ({}); reconnecting", sessionId, e.getMessage());
        }
        connect();
        return streamUrl;
    }

    private void ensureReader() {
        synchronized (lock) {
            if (closed || streamUrl == null) return;
            if (reader != null && reader.isRunning()) return;
            if (demuxer.isClosed()) return;
            reader = new StreamReader(transport, new StreamReader.StreamUrlSource() {
                @Override
                public URI current() {
                    return streamUrl;
                }

                @Override
                public URI renew() throws Exception {
                    return renewStreamUrl();
                }
            }, demuxer, readMode, pollDelay, maxRetries);
            reader.start("durable-proxy-session-" + sessionId);
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("session is closed");
    }

    private static void await(CompletableFuture<Void> task) throws Exception {
        try {
            task.get();
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        }
    }

    private static URI stripTrailingSlash(URI uri) {
        String s = uri.toString();
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return URI.create(s);
    }

    public static final class Builder {
        private final URI proxyUrl;
        private final String sessionId;
        private DurableProxyTransport transport;
        private String serviceSecret;
        private String connectUrl;
        private String renewUrl;
        private Duration signedUrlTtl;
        private RequestIdStore requestIds;
        private String keyPrefix = ProxyRequests.DEFAULT_KEY_PREFIX;
        private ReadMode readMode = ReadMode.LONG_POLL;
        private Duration pollDelay = StreamReader.DEFAULT_POLL_DELAY;
        private int maxRetries = StreamReader.DEFAULT_MAX_RETRIES;
        private long maxBufferBytes = FrameDemuxer.DEFAULT_MAX_BUFFER_BYTES;
        private ReplayPolicy replayPolicy = ReplayPolicy.LENIENT;

        private Builder(URI proxyUrl, String sessionId) {
            this.proxyUrl = Objects.requireNonNull(proxyUrl, "proxyUrl");
            this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
            if (sessionId.isEmpty()) throw new IllegalArgumentException("sessionId must not be empty");
        }

        public Builder transport(DurableProxyTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder serviceSecret(String serviceSecret) {
            this.serviceSecret = serviceSecret;
            return this;
        }

        /** Connect handler the proxy calls before admitting the session. */
        public Builder connectUrl(String connectUrl) {
            this.connectUrl = connectUrl;
            return this;
        }

        /** Renew handler the proxy consults before re-signing an expired stream URL. */
        public Builder renewUrl(String renewUrl) {
            this.renewUrl = renewUrl;
            return this;
        }

        public Builder signedUrlTtl(Duration signedUrlTtl) {
            this.signedUrlTtl = signedUrlTtl;
            return this;
        }

        public Builder requestIdStore(RequestIdStore requestIds) {
            this.requestIds = requestIds;
            return this;
        }

        public Builder requestIdKeyPrefix(String keyPrefix) {
            this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
            return this;
        }

        public Builder readMode(ReadMode readMode) {
            if (readMode == ReadMode.CATCH_UP) throw new IllegalArgumentException("session reads need a live mode");
            this.readMode = Objects.requireNonNull(readMode, "readMode");
            return this;
        }

        public Builder pollDelay(Duration pollDelay) {
            this.pollDelay = Objects.requireNonNull(pollDelay, "pollDelay");
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder maxBufferBytes(long maxBufferBytes) {
            this.maxBufferBytes = maxBufferBytes;
            return this;
        }

        public Builder replayPolicy(ReplayPolicy replayPolicy) {
            this.replayPolicy = Objects.requireNonNull(replayPolicy, "replayPolicy");
            return this;
        }

        public DurableSession build() {
            return new DurableSession(this);
        }
    }
}
