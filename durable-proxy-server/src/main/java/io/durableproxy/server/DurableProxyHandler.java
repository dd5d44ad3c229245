package io.durableproxy.server;

import io.durableproxy.core.DurableProxyException;
import io.durableproxy.core.ErrorCode;
import io.durableproxy.core.ErrorEnvelope;
import io.durableproxy.core.Headers;
import io.durableproxy.core.Offset;
import io.durableproxy.core.Protocol;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.frame.StartPayload;
import io.durableproxy.server.auth.CapabilitySigner;
import io.durableproxy.server.auth.CapabilityToken;
import io.durableproxy.server.auth.ServiceAuthenticator;
import io.durableproxy.server.auth.Verdict;
import io.durableproxy.server.frames.ResponseFrameWriter;
import io.durableproxy.server.registry.InFlightResponse;
import io.durableproxy.server.registry.InMemorySessionRegistry;
import io.durableproxy.server.registry.ResponseIdScanner;
import io.durableproxy.server.registry.SessionRegistry;
import io.durableproxy.server.storage.ReadResult;
import io.durableproxy.server.storage.StorageException;
import io.durableproxy.server.storage.StreamStorage;
import io.durableproxy.server.upstream.UpstreamAllowlist;
import io.durableproxy.server.upstream.UpstreamConnectException;
import io.durableproxy.server.upstream.UpstreamException;
import io.durableproxy.server.upstream.UpstreamForwarder;
import io.durableproxy.server.upstream.UpstreamHeaders;
import io.durableproxy.server.upstream.UpstreamRequest;
import io.durableproxy.server.upstream.UpstreamResponse;
import io.durableproxy.server.upstream.UpstreamTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Framework-neutral HTTP handler for the durable proxy.
 *
 * <p>Forwards upstream calls, records each response as frames in a stream through
 * {@link StreamStorage}, and serves those streams back to holders of a capability URL.
 *
 * <p>Use {@link #builder(StreamStorage, String)} to create instances:
 * <pre>{@code
 * DurableProxyHandler handler = DurableProxyHandler.builder(storage, signingSecret)
 *     .allowlist(UpstreamAllowlist.of("https://api.openai.com/*"))
 *     .serviceSecret("s3cret")
 *     .urlTtl(Duration.ofDays(1))
 *     .build();
 * }</pre>
 *
 * <p>Call {@link #close()} to stop the pump threads the handler created itself.
 */
public final class DurableProxyHandler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DurableProxyHandler.class);

    public static final Duration DEFAULT_URL_TTL = Duration.ofDays(7);
    public static final Duration DEFAULT_STREAM_TTL = Duration.ofSeconds(86_400);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SSE_MAX_DURATION = Duration.ofSeconds(55);
    public static final long DEFAULT_MAX_RESPONSE_BYTES = 100L * 1024 * 1024;

    /** Upstream error bodies are passed through up to this size. */
    static final int MAX_ERROR_BODY = 64 * 1024;
    static final int MAX_CONNECT_BODY = 1024 * 1024;

    private static final Set<String> UPSTREAM_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");

    private static final String EXPOSED_HEADERS = String.join(", ",
            Protocol.H_LOCATION,
            Protocol.H_STREAM_ID,
            Protocol.H_STREAM_RESPONSE_ID,
            Protocol.H_UPSTREAM_CONTENT_TYPE,
            Protocol.H_UPSTREAM_STATUS,
            Protocol.H_STREAM_NEXT_OFFSET,
            Protocol.H_STREAM_UP_TO_DATE,
            Protocol.H_STREAM_CURSOR,
            Protocol.H_STREAM_SSE_DATA_ENCODING);

    private final StreamStorage storage;
    private final CapabilitySigner signer;
    private final ServiceAuthenticator serviceAuth;
    private final UpstreamAllowlist allowlist;
    private final UpstreamForwarder forwarder;
    private final SessionRegistry registry;
    private final Duration urlTtl;
    private final Duration streamTtl;
    private final Duration idleTimeout;
    private final Duration sseMaxDuration;
    private final long maxResponseBytes;
    private final URI publicOrigin;
    private final Clock clock;
    private final ExecutorService pumpExecutor;
    private final ScheduledExecutorService timer;
    private final boolean ownsPumpExecutor;
    private final boolean ownsTimer;

    public static Builder builder(StreamStorage storage, String signingSecret) {
        return new Builder(storage, signingSecret);
    }

    private DurableProxyHandler(Builder b) {
        this.storage = b.storage;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.signer = new CapabilitySigner(b.signingSecret, clock);
        this.serviceAuth = b.serviceSecret == null || b.serviceSecret.isEmpty()
                ? ServiceAuthenticator.disabled()
                : ServiceAuthenticator.withSecret(b.serviceSecret);
        this.allowlist = b.allowlist != null ? b.allowlist : UpstreamAllowlist.of(List.of());
        this.forwarder = b.forwarder != null ? b.forwarder : new UpstreamForwarder();
        this.registry = b.registry != null ? b.registry : new InMemorySessionRegistry();
        this.urlTtl = b.urlTtl != null ? b.urlTtl : DEFAULT_URL_TTL;
        this.streamTtl = b.streamTtl != null ? b.streamTtl : DEFAULT_STREAM_TTL;
        this.idleTimeout = b.idleTimeout != null ? b.idleTimeout : DEFAULT_IDLE_TIMEOUT;
        this.sseMaxDuration = b.sseMaxDuration != null ? b.sseMaxDuration : DEFAULT_SSE_MAX_DURATION;
        this.maxResponseBytes = b.maxResponseBytes > 0 ? b.maxResponseBytes : DEFAULT_MAX_RESPONSE_BYTES;
        this.publicOrigin = b.publicOrigin;
        this.ownsPumpExecutor = b.pumpExecutor == null;
        this.ownsTimer = b.timer == null;
        this.pumpExecutor = b.pumpExecutor != null ? b.pumpExecutor : ProxyExecutors.newPumpExecutor("durable-proxy-pump");
        this.timer = b.timer != null ? b.timer : ProxyExecutors.newTimer("durable-proxy-idle");
        if (this.allowlist.isEmpty()) {
            LOG.warn("Upstream allowlist is empty; every proxied request will be rejected");
        }
    }

    /**
     * Builder for {@link DurableProxyHandler}.
     */
    public static final class Builder {
        private final StreamStorage storage;
        private final String signingSecret;
        private String serviceSecret;
        private UpstreamAllowlist allowlist;
        private UpstreamForwarder forwarder;
        private SessionRegistry registry;
        private Duration urlTtl;
        private Duration streamTtl;
        private Duration idleTimeout;
        private Duration sseMaxDuration;
        private long maxResponseBytes;
        private URI publicOrigin;
        private Clock clock;
        private ExecutorService pumpExecutor;
        private ScheduledExecutorService timer;

        private Builder(StreamStorage storage, String signingSecret) {
            this.storage = Objects.requireNonNull(storage, "storage");
            this.signingSecret = Objects.requireNonNull(signingSecret, "signingSecret");
        }

        /** Upstream URLs that may be proxied. Default: none. */
        public Builder allowlist(UpstreamAllowlist allowlist) {
            this.allowlist = allowlist;
            return this;
        }

        public Builder allowlist(List<String> patterns) {
            this.allowlist = UpstreamAllowlist.of(patterns);
            return this;
        }

        /** Secret required to create streams, connect and delete. Default: not required. */
        public Builder serviceSecret(String serviceSecret) {
            this.serviceSecret = serviceSecret;
            return this;
        }

        public Builder forwarder(UpstreamForwarder forwarder) {
            this.forwarder = forwarder;
            return this;
        }

        public Builder registry(SessionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Lifetime of issued capability URLs. Default: 7 days. */
        public Builder urlTtl(Duration urlTtl) {
            this.urlTtl = urlTtl;
            return this;
        }

        /** Retention of newly created streams. Default: 1 day. */
        public Builder streamTtl(Duration streamTtl) {
            this.streamTtl = streamTtl;
            return this;
        }

        /** Upstream silence that fails a response with IDLE_TIMEOUT. Default: 5 minutes. */
        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        /** Maximum SSE connection duration. Default: 55 seconds. */
        public Builder sseMaxDuration(Duration sseMaxDuration) {
            this.sseMaxDuration = sseMaxDuration;
            return this;
        }

        /** Upstream body size that fails a response with RESPONSE_TOO_LARGE. Default: 100 MB. */
        public Builder maxResponseBytes(long maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
            return this;
        }

        /** Origin used in capability URLs. Default: derived from each request. */
        public Builder publicOrigin(URI publicOrigin) {
            this.publicOrigin = publicOrigin;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Executor for body pumps. The caller keeps ownership. */
        public Builder pumpExecutor(ExecutorService pumpExecutor) {
            this.pumpExecutor = pumpExecutor;
            return this;
        }

        public Builder timer(ScheduledExecutorService timer) {
            this.timer = timer;
            return this;
        }

        public DurableProxyHandler build() {
            return new DurableProxyHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        ServerResponse resp;
        try {
            resp = route(req);
        } catch (ProxyFailure f) {
            resp = render(f);
        } catch (Exception e) {
            LOG.error("Unhandled error for {} {}", req.method(), req.uri().getRawPath(), e);
            resp = error(500, ErrorCode.INTERNAL_ERROR, "internal error", null);
        }
        return withCors(resp);
    }

    @Override
    public void close() {
        if (ownsPumpExecutor) pumpExecutor.shutdownNow();
        if (ownsTimer) timer.shutdownNow();
    }

    private ServerResponse route(ServerRequest req) throws Exception {
        if (req.method() == HttpMethod.OPTIONS) return preflight();

        String rawPath = req.uri().getRawPath() == null ? "" : req.uri().getRawPath();
        String streamId;
        if (rawPath.equals(Protocol.PROXY_PATH) || rawPath.equals(Protocol.PROXY_PATH + "/")) {
            streamId = null;
        } else if (rawPath.startsWith(Protocol.PROXY_PATH + "/")) {
            String encoded = rawPath.substring(Protocol.PROXY_PATH.length() + 1);
            if (encoded.contains("/")) throw new ProxyFailure(404, ErrorCode.NOT_FOUND, "no such route");
            streamId = URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        } else {
            throw new ProxyFailure(404, ErrorCode.NOT_FOUND, "no such route");
        }

        Map<String, String> q = req.query();
        if (streamId == null) {
            if (req.method() == HttpMethod.POST) return handleCreateOrAppend(req, q, null);
            throw methodNotAllowed(req);
        }
        String action = q.get(Protocol.Q_ACTION);
        return switch (req.method()) {
            case POST -> {
                if (action == null) yield handleCreateOrAppend(req, q, streamId);
                if (Protocol.ACTION_CONNECT.equals(action)) yield handleConnect(req, q, streamId);
                if (Protocol.ACTION_RENEW.equals(action)) yield handleRenew(req, q, streamId);
                throw ProxyFailure.badRequest(ErrorCode.INVALID_ACTION, "unsupported action: " + action);
            }
            case PATCH -> {
                if (Protocol.ACTION_ABORT.equals(action)) yield handleAbort(q, streamId);
                throw ProxyFailure.badRequest(ErrorCode.INVALID_ACTION,
                        action == null ? "missing action" : "unsupported action: " + action);
            }
            case GET -> handleRead(req, q, streamId);
            case HEAD -> handleHead(q, streamId);
            case DELETE -> handleDelete(req, q, streamId);
            case PUT, OPTIONS -> throw methodNotAllowed(req);
        };
    }

    private ServerResponse handleCreateOrAppend(ServerRequest req, Map<String, String> q, String explicitId)
            throws InterruptedException {
        requireServiceAuth(q, req);

        String streamId;
        boolean reuse;
        Optional<String> useStreamUrl = req.header(Protocol.H_USE_STREAM_URL);
        if (useStreamUrl.isPresent()) {
            CapabilityToken token = CapabilityToken.fromUrl(useStreamUrl.get())
                    .orElseThrow(() -> ProxyFailure.badRequest(ErrorCode.MALFORMED_STREAM_URL, "malformed Use-Stream-URL"));
            if (explicitId != null && !explicitId.equals(token.streamId())) {
                throw ProxyFailure.badRequest(ErrorCode.MALFORMED_STREAM_URL, "Use-Stream-URL names a different stream");
            }
            if (signer.verifySignature(token) != Verdict.VALID) {
                throw ProxyFailure.unauthorized(ErrorCode.SIGNATURE_INVALID, "invalid stream URL signature", null);
            }
            streamId = token.streamId();
            if (!storageExists(streamId)) {
                throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
            }
            reuse = true;
        } else {
            streamId = explicitId != null ? explicitId : UUID.randomUUID().toString();
            reuse = false;
        }

        UpstreamRequest upstreamRequest = upstreamRequest(req);
        Duration ttl = requestedUrlTtl(req);

        UpstreamResponse upstream = forward(upstreamRequest);
        if (upstream.isRedirect()) {
            closeQuietly(upstream);
            throw ProxyFailure.badRequest(ErrorCode.REDIRECT_NOT_ALLOWED,
                    "upstream redirected (" + upstream.status() + "); redirects are not followed");
        }
        if (!upstream.isSuccess()) {
            LOG.warn("Upstream {} answered {}", upstreamRequest.url(), upstream.status());
            byte[] body = upstream.readErrorBody(MAX_ERROR_BODY);
            String contentType = Headers.firstValue(upstream.headers(), Protocol.H_CONTENT_TYPE).orElse(null);
            throw ProxyFailure.badGateway(ErrorCode.UPSTREAM_ERROR, "upstream returned " + upstream.status())
                    .withHeader(Protocol.H_UPSTREAM_STATUS, Integer.toString(upstream.status()))
                    .withRawBody(body, contentType);
        }

        boolean created;
        long responseId;
        ResponseFrameWriter writer;
        try {
            created = !reuse && storage.create(streamId, streamTtl);
            if (created) LOG.info("Created stream {}", streamId);
            responseId = registry.allocateResponseId(streamId, () -> ResponseIdScanner.highestResponseId(storage, streamId));
            writer = new ResponseFrameWriter(storage, streamId, responseId);
            writer.start(new StartPayload(upstream.status(), UpstreamHeaders.fromUpstream(upstream.headers())));
        } catch (StorageException e) {
            closeQuietly(upstream);
            throw storageFailure(streamId, e);
        }

        InFlightResponse inFlight = new InFlightResponse(writer, upstream);
        registry.register(inFlight);
        pumpExecutor.execute(new ResponsePump(inFlight, upstream.body(), registry, timer, idleTimeout, maxResponseBytes));
        LOG.debug("Response {} on stream {} started ({} {})", responseId, streamId,
                upstreamRequest.method(), upstreamRequest.url());

        ServerResponse resp = ServerResponse.empty(created ? 201 : 200)
                .header(Protocol.H_LOCATION, capabilityUrl(req, streamId, ttl).toString())
                .header(Protocol.H_STREAM_ID, streamId)
                .header(Protocol.H_STREAM_RESPONSE_ID, Long.toString(responseId))
                .noStore();
        Headers.firstValue(upstream.headers(), Protocol.H_CONTENT_TYPE)
                .ifPresent(ct -> resp.header(Protocol.H_UPSTREAM_CONTENT_TYPE, ct));
        return resp;
    }

    private ServerResponse handleConnect(ServerRequest req, Map<String, String> q, String streamId)
            throws InterruptedException {
        requireServiceAuth(q, req);
        Duration ttl = requestedUrlTtl(req);

        byte[] handlerBody = new byte[0];
        Map<String, String> handlerHeaders = new LinkedHashMap<>();
        Optional<String> connectUrl = req.header(Protocol.H_UPSTREAM_URL);
        if (connectUrl.isPresent()) {
            URI target = allowedUpstream(connectUrl.get());
            Map<String, String> headers = UpstreamHeaders.forUpstream(req.headers());
            headers.put(Protocol.H_STREAM_ID, streamId);
            UpstreamResponse answer = forward(new UpstreamRequest(target, "POST", headers, readBody(req)));
            if (!answer.isSuccess()) {
                closeQuietly(answer);
                LOG.debug("Connect handler {} rejected stream {} with {}", target, streamId, answer.status());
                throw ProxyFailure.unauthorized(ErrorCode.CONNECT_REJECTED,
                        "connect handler returned " + answer.status(), streamId);
            }
            try (InputStream in = answer.body()) {
                handlerBody = in.readNBytes(MAX_CONNECT_BODY);
            } catch (IOException e) {
                throw ProxyFailure.badGateway(ErrorCode.UPSTREAM_ERROR, "connect handler failed: " + e.getMessage());
            }
            Headers.firstValue(answer.headers(), Protocol.H_CONTENT_TYPE)
                    .ifPresent(v -> handlerHeaders.put(Protocol.H_CONTENT_TYPE, v));
            Headers.firstValue(answer.headers(), Protocol.H_STREAM_NEXT_OFFSET)
                    .ifPresent(v -> handlerHeaders.put(Protocol.H_STREAM_NEXT_OFFSET, v));
        }

        boolean created;
        try {
            created = storage.create(streamId, streamTtl);
        } catch (StorageException e) {
            throw storageFailure(streamId, e);
        }
        if (created) LOG.info("Created stream {} on connect", streamId);

        ServerResponse resp = new ServerResponse(created ? 201 : 200,
                handlerBody.length == 0 ? new ResponseBody.Empty() : new ResponseBody.Bytes(handlerBody))
                .header(Protocol.H_LOCATION, capabilityUrl(req, streamId, ttl).toString())
                .header(Protocol.H_STREAM_ID, streamId)
                .noStore();
        handlerHeaders.forEach(resp::header);
        return resp;
    }

    /**
     * Re-signs the URL of an existing stream. The presented URL may be expired but its signature must
     * hold; an optional {@code Upstream-URL} is asked whether the caller may still read.
     */
    private ServerResponse handleRenew(ServerRequest req, Map<String, String> q, String streamId)
            throws InterruptedException {
        requireServiceAuth(q, req);
        CapabilityToken token = CapabilityToken.of(streamId, q);
        if (!token.hasCredentials()) {
            throw ProxyFailure.unauthorized(ErrorCode.MISSING_SIGNATURE, "missing expires or signature", null);
        }
        if (signer.verifySignature(token) != Verdict.VALID) {
            throw ProxyFailure.unauthorized(ErrorCode.SIGNATURE_INVALID, "invalid signature", null);
        }
        if (!storageExists(streamId)) {
            throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
        }
        Duration ttl = requestedUrlTtl(req);

        Optional<String> renewUrl = req.header(Protocol.H_UPSTREAM_URL);
        if (renewUrl.isPresent()) {
            URI target = allowedUpstream(renewUrl.get());
            Map<String, String> headers = UpstreamHeaders.forUpstream(req.headers());
            headers.put(Protocol.H_STREAM_ID, streamId);
            UpstreamResponse answer = forward(new UpstreamRequest(target, "POST", headers, new byte[0]));
            closeQuietly(answer);
            if (!answer.isSuccess()) {
                LOG.debug("Renew handler {} refused stream {} with {}", target, streamId, answer.status());
                throw ProxyFailure.unauthorized(ErrorCode.RENEWAL_REJECTED,
                        "renew handler returned " + answer.status(), streamId);
            }
        }

        LOG.debug("Renewed stream URL for {}", streamId);
        return ServerResponse.empty(200)
                .header(Protocol.H_LOCATION, capabilityUrl(req, streamId, ttl).toString())
                .header(Protocol.H_STREAM_ID, streamId)
                .noStore();
    }

    private ServerResponse handleRead(ServerRequest req, Map<String, String> q, String streamId) throws Exception {
        requireReadAccess(q, streamId);

        if (QueryString.hasDuplicate(req.uri(), Protocol.Q_OFFSET)) {
            throw ProxyFailure.badRequest(ErrorCode.INVALID_OFFSET, "duplicate offset parameter");
        }
        Offset offset = parseOffset(q.get(Protocol.Q_OFFSET));
        ReadMode mode;
        try {
            mode = ReadMode.fromWire(q.get(Protocol.Q_LIVE));
        } catch (IllegalArgumentException e) {
            throw ProxyFailure.badRequest(ErrorCode.INVALID_LIVE_MODE, e.getMessage());
        }
        String cursor = q.get(Protocol.Q_CURSOR);

        if (mode == ReadMode.SSE) {
            if (!storageExists(streamId)) {
                throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
            }
            StreamSsePublisher pub = new StreamSsePublisher(storage, streamId, offset, cursor, sseMaxDuration, clock);
            return new ServerResponse(200, new ResponseBody.Sse(pub))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                    .header(Protocol.H_STREAM_SSE_DATA_ENCODING, Protocol.SSE_ENCODING_BASE64)
                    .header(Protocol.H_CACHE_CONTROL, "no-cache");
        }

        ReadResult out;
        try {
            out = storage.read(streamId, offset, mode, cursor);
        } catch (IllegalArgumentException e) {
            throw ProxyFailure.badRequest(ErrorCode.INVALID_OFFSET, e.getMessage());
        } catch (StorageException e) {
            throw storageFailure(streamId, e);
        }

        return switch (out.status()) {
            case NOT_FOUND -> throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
            case TIMEOUT -> readHeaders(ServerResponse.empty(204), out);
            case OK -> readHeaders(ServerResponse.bytes(200, out.body())
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM), out);
        };
    }

    private ServerResponse handleHead(Map<String, String> q, String streamId) {
        requireReadAccess(q, streamId);
        if (!storageExists(streamId)) {
            throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
        }
        return ServerResponse.empty(200)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM)
                .header(Protocol.H_STREAM_ID, streamId)
                .noStore();
    }

    private ServerResponse handleAbort(Map<String, String> q, String streamId) {
        CapabilityToken token = CapabilityToken.of(streamId, q);
        if (!token.hasCredentials()) {
            throw ProxyFailure.unauthorized(ErrorCode.MISSING_SIGNATURE, "missing expires or signature", null);
        }
        if (signer.verifySignature(token) != Verdict.VALID) {
            throw ProxyFailure.unauthorized(ErrorCode.SIGNATURE_INVALID, "invalid signature", null);
        }

        String rawResponse = q.get(Protocol.Q_RESPONSE);
        Optional<InFlightResponse> target;
        if (rawResponse == null) {
            target = registry.latest(streamId);
        } else {
            // ids that were never allocated, 0 included, simply find nothing
            long responseId = Headers.canonicalDecimal(rawResponse)
                    .orElseThrow(() -> ProxyFailure.badRequest(ErrorCode.INVALID_RESPONSE_ID,
                            "invalid response id: " + rawResponse));
            target = registry.find(streamId, responseId);
        }

        if (target.isPresent()) {
            try {
                target.get().abort();
            } catch (StorageException e) {
                LOG.warn("Could not record abort of response {} on stream {}", target.get().responseId(), streamId, e);
            }
        } else {
            LOG.debug("Abort on stream {} found nothing in flight", streamId);
        }
        return ServerResponse.empty(204).noStore();
    }

    private ServerResponse handleDelete(ServerRequest req, Map<String, String> q, String streamId) {
        requireServiceAuth(q, req);
        boolean deleted;
        try {
            deleted = storage.delete(streamId);
        } catch (StorageException e) {
            throw storageFailure(streamId, e);
        }
        Collection<InFlightResponse> orphans = registry.forget(streamId);
        orphans.forEach(InFlightResponse::closeUpstream);
        if (!deleted) throw new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
        LOG.info("Deleted stream {} ({} responses cancelled)", streamId, orphans.size());
        return ServerResponse.empty(204).noStore();
    }

    private ServerResponse preflight() {
        return ServerResponse.empty(204)
                .header("Access-Control-Allow-Methods", "GET, HEAD, POST, PATCH, DELETE, OPTIONS")
                .header("Access-Control-Allow-Headers", "*")
                .header("Access-Control-Max-Age", "86400");
    }

    // ---- request parsing ----

    private UpstreamRequest upstreamRequest(ServerRequest req) {
        String rawUrl = req.header(Protocol.H_UPSTREAM_URL)
                .filter(v -> !v.isBlank())
                .orElseThrow(() -> ProxyFailure.badRequest(ErrorCode.MISSING_UPSTREAM_URL, "missing Upstream-URL header"));
        String method = req.header(Protocol.H_UPSTREAM_METHOD)
                .map(m -> m.trim().toUpperCase(Locale.ROOT))
                .orElse("POST");
        if (!UPSTREAM_METHODS.contains(method)) {
            throw ProxyFailure.badRequest(ErrorCode.INVALID_UPSTREAM_METHOD, "unsupported Upstream-Method: " + method);
        }
        URI target = allowedUpstream(rawUrl);
        return new UpstreamRequest(target, method, UpstreamHeaders.forUpstream(req.headers()), readBody(req));
    }

    private URI allowedUpstream(String rawUrl) {
        URI target = UpstreamAllowlist.validateUpstreamUrl(rawUrl)
                .orElseThrow(() -> ProxyFailure.badRequest(ErrorCode.INVALID_UPSTREAM_URL, "invalid upstream URL"));
        if (!allowlist.isAllowed(target)) {
            LOG.debug("Rejected upstream {} (allowlist {})", target, allowlist);
            throw new ProxyFailure(403, ErrorCode.UPSTREAM_NOT_ALLOWED, "upstream URL is not allowed");
        }
        return target;
    }

    private Duration requestedUrlTtl(ServerRequest req) {
        Optional<String> raw = req.header(Protocol.H_STREAM_SIGNED_URL_TTL);
        if (raw.isEmpty()) return urlTtl;
        return Headers.canonicalDecimal(raw.get())
                .map(Duration::ofSeconds)
                .orElseThrow(() -> ProxyFailure.badRequest(ErrorCode.INVALID_TTL,
                        "Stream-Signed-URL-TTL must be a non-negative integer"));
    }

    private void requireServiceAuth(Map<String, String> q, ServerRequest req) {
        switch (serviceAuth.authenticate(q, req.headers())) {
            case OK -> { }
            case MISSING -> throw ProxyFailure.unauthorized(ErrorCode.MISSING_SECRET, "missing service secret", null);
            case INVALID -> throw ProxyFailure.unauthorized(ErrorCode.INVALID_SECRET, "invalid service secret", null);
        }
    }

    private void requireReadAccess(Map<String, String> q, String streamId) {
        CapabilityToken token = CapabilityToken.of(streamId, q);
        if (!token.hasCredentials()) {
            throw ProxyFailure.unauthorized(ErrorCode.MISSING_SIGNATURE, "missing expires or signature", null);
        }
        Verdict verdict = signer.verify(token);
        switch (verdict) {
            case VALID -> { }
            case SIGNATURE_INVALID -> throw ProxyFailure.unauthorized(ErrorCode.SIGNATURE_INVALID, "invalid signature", null);
            case SIGNATURE_EXPIRED -> throw ProxyFailure.unauthorized(ErrorCode.SIGNATURE_EXPIRED, "stream URL expired", streamId);
        }
    }

    private static Offset parseOffset(String raw) {
        if (raw == null) return Offset.beginning();
        try {
            return new Offset(raw);
        } catch (DurableProxyException.InvalidOffset e) {
            throw ProxyFailure.badRequest(ErrorCode.INVALID_OFFSET, e.getMessage());
        }
    }

    private static byte[] readBody(ServerRequest req) {
        if (req.body() == null) return new byte[0];
        try (InputStream in = req.body()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw ProxyFailure.badRequest(ErrorCode.INTERNAL_ERROR, "could not read request body");
        }
    }

    // ---- collaborators ----

    private UpstreamResponse forward(UpstreamRequest request) throws InterruptedException {
        try {
            return forwarder.forward(request);
        } catch (UpstreamTimeoutException e) {
            LOG.warn("Upstream {} timed out", request.url());
            throw ProxyFailure.badGateway(ErrorCode.UPSTREAM_TIMEOUT, e.getMessage());
        } catch (UpstreamConnectException e) {
            LOG.warn("Upstream {} unreachable: {}", request.url(), e.getMessage());
            throw ProxyFailure.badGateway(ErrorCode.UPSTREAM_ERROR, e.getMessage());
        } catch (UpstreamException e) {
            throw ProxyFailure.badGateway(ErrorCode.UPSTREAM_ERROR, e.getMessage());
        }
    }

    private boolean storageExists(String streamId) {
        try {
            return storage.exists(streamId);
        } catch (StorageException e) {
            throw storageFailure(streamId, e);
        }
    }

    private static ProxyFailure storageFailure(String streamId, StorageException e) {
        if (e instanceof StorageException.StreamNotFound) {
            return new ProxyFailure(404, ErrorCode.STREAM_NOT_FOUND, "stream not found", streamId);
        }
        LOG.warn("Storage failure on stream {}", streamId, e);
        return new ProxyFailure(502, ErrorCode.STORAGE_ERROR, "storage error: " + e.getMessage(), streamId);
    }

    private URI capabilityUrl(ServerRequest req, String streamId, Duration ttl) {
        return signer.issueUrl(origin(req), streamId, ttl);
    }

    private URI origin(ServerRequest req) {
        if (publicOrigin != null) return publicOrigin;
        String proto = req.header("X-Forwarded-Proto")
                .map(p -> p.split(",")[0].trim())
                .filter(p -> !p.isEmpty())
                .orElse(req.uri().getScheme() == null ? "http" : req.uri().getScheme());
        String host = req.header("Host").orElse(req.uri().getRawAuthority());
        return URI.create(proto + "://" + host);
    }

    // ---- responses ----

    private static ServerResponse readHeaders(ServerResponse resp, ReadResult out) {
        if (out.nextOffset() != null) resp.header(Protocol.H_STREAM_NEXT_OFFSET, out.nextOffset().value());
        if (out.upToDate()) resp.header(Protocol.H_STREAM_UP_TO_DATE, Protocol.BOOL_TRUE);
        if (out.cursor() != null) resp.header(Protocol.H_STREAM_CURSOR, out.cursor());
        return resp.noStore();
    }

    private static ServerResponse render(ProxyFailure f) {
        ServerResponse resp;
        if (f.rawBody() != null) {
            resp = ServerResponse.bytes(f.status(), f.rawBody()).noStore();
            if (f.rawContentType() != null) resp.header(Protocol.H_CONTENT_TYPE, f.rawContentType());
        } else {
            resp = error(f.status(), f.code(), f.getMessage(), f.streamId());
        }
        f.headers().forEach(resp::header);
        return resp;
    }

    private static ServerResponse error(int status, ErrorCode code, String message, String streamId) {
        return ServerResponse.bytes(status, ErrorEnvelope.of(code, message, streamId).toJson())
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .noStore();
    }

    private static ServerResponse withCors(ServerResponse resp) {
        return resp.header("Access-Control-Allow-Origin", "*")
                .header("Access-Control-Expose-Headers", EXPOSED_HEADERS);
    }

    private static ProxyFailure methodNotAllowed(ServerRequest req) {
        return new ProxyFailure(405, ErrorCode.METHOD_NOT_ALLOWED, req.method() + " not allowed here");
    }


    private static void closeQuietly(UpstreamResponse upstream) {
        try {
            upstream.close();
        } catch (IOException e) {
            LOG.debug("Closing upstream response failed", e);
        }
    }
}
