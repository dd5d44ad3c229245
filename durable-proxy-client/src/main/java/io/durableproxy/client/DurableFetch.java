package io.durableproxy.client;

import io.durableproxy.core.ReadMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-shot durable fetch: each call creates a stream holding one upstream response.
 *
 * <p>With a request id, the stream URL and response id are recorded; calling again with the same id
 * resumes that response from the start of its stream instead of calling the upstream again. An
 * expired stream URL is renewed first; if the recorded response still cannot be read back, the
 * mapping is dropped and a fresh call is made.
 */
public final class DurableFetch {

    private static final Logger LOG = LoggerFactory.getLogger(DurableFetch.class);

    static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(30);

    private final DurableProxyTransport transport;
    private final URI proxyUrl;
    private final String serviceSecret;
    private final String renewUrl;
    private final Duration signedUrlTtl;
    private final RequestIdStore requestIds;
    private final String keyPrefix;
    private final long maxBufferBytes;
    private final ReplayPolicy replayPolicy;
    private final Duration pollDelay;
    private final Duration startTimeout;

    private DurableFetch(Builder b) {
        this.transport = b.transport != null ? b.transport : new JdkHttpTransport();
        String s = b.proxyUrl.toString();
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        this.proxyUrl = URI.create(s);
        this.serviceSecret = b.serviceSecret;
        this.renewUrl = b.renewUrl;
        this.signedUrlTtl = b.signedUrlTtl;
        this.requestIds = b.requestIds != null ? b.requestIds : new InMemoryRequestIdStore();
        this.keyPrefix = b.keyPrefix;
        this.maxBufferBytes = b.maxBufferBytes;
        this.replayPolicy = b.replayPolicy;
        this.pollDelay = b.pollDelay;
        this.startTimeout = b.startTimeout;
    }

    public static Builder builder(URI proxyUrl) {
        return new Builder(proxyUrl);
    }

    /**
     * Calls {@code upstreamUrl} through the proxy and returns once the response has started.
     * The body keeps streaming in the background until the response is terminal.
     */
    public DurableResponse fetch(String upstreamUrl, FetchOptions options) throws Exception {
        Objects.requireNonNull(upstreamUrl, "upstreamUrl");
        FetchOptions opts = options != null ? options : FetchOptions.defaults();

        String key = opts.requestId() == null ? null
                : RequestIdStore.key(keyPrefix, proxyUrl.toString(), null, opts.requestId());
        if (key != null) {
            Optional<RequestMapping> existing = requestIds.load(key);
            if (existing.isPresent() && existing.get().streamUrl() != null) {
                URI streamUrl = URI.create(existing.get().streamUrl());
                try {
                    ProxyResponse resumed = read(streamUrl, existing.get().responseId(), key, opts);
                    LOG.debug("Resumed request {} from {}", opts.requestId(), streamUrl);
                    return new DurableResponse(streamUrl, ProxyRequests.streamId(streamUrl, null), true, resumed);
                } catch (Exception e) {
                    LOG.debug("Could not resume request {} ({}); sending it again", opts.requestId(), e.toString());
                    requestIds.remove(key);
                }
            }
        }

        Map<String, List<String>> headers = ProxyRequests.upstreamHeaders(upstreamUrl, opts, signedUrlTtl);
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.post(
                ProxyRequests.withSecret(proxyUrl, serviceSecret), headers, opts.body()));
        if (!resp.isSuccess()) throw ProxyRequestException.fromResponse("create", resp);

        long responseId = ProxyRequests.responseId("create", resp);
        URI streamUrl = ProxyRequests.location("create", proxyUrl, resp);
        if (key != null) requestIds.save(key, new RequestMapping(streamUrl.toString(), responseId));

        ProxyResponse fresh = read(streamUrl, responseId, key, opts);
        return new DurableResponse(streamUrl, ProxyRequests.streamId(streamUrl, resp), false, fresh);
    }

    /** Aborts one response on a stream returned by an earlier call. */
    public void abort(URI streamUrl, long responseId) throws Exception {
        ProxyRequests.abort(transport, streamUrl, responseId);
    }

    private ProxyResponse read(URI streamUrl, long responseId, String key, FetchOptions opts) throws Exception {
        AtomicReference<URI> current = new AtomicReference<>(streamUrl);
        FrameDemuxer demuxer = new FrameDemuxer(maxBufferBytes, replayPolicy,
                id -> ProxyRequests.abort(transport, current.get(), id));
        StreamReader reader = new StreamReader(transport, new StreamReader.StreamUrlSource() {
            @Override
            public URI current() {
                return current.get();
            }

            @Override
            public URI renew() throws Exception {
                URI renewed = ProxyRequests.renew(transport, proxyUrl, current.get(), serviceSecret,
                        ProxyRequests.renewHeaders(renewUrl, ProxyRequests.authorization(opts), signedUrlTtl));
                current.set(renewed);
                if (key != null) requestIds.save(key, new RequestMapping(renewed.toString(), responseId));
                LOG.debug("Renewed stream URL for response {}", responseId);
                return renewed;
            }
        }, demuxer, ReadMode.LONG_POLL, pollDelay, StreamReader.DEFAULT_MAX_RETRIES);
        reader.start("durable-proxy-fetch-" + responseId);

        ProxyResponse response;
        try {
            response = demuxer.waitForResponse(responseId).get(startTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            reader.stop();
            demuxer.close();
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        } catch (Exception e) {
            reader.stop();
            demuxer.close();
            throw e;
        }
        response.completion().whenComplete((state, failure) -> reader.stop());
        return response;
    }

    public static final class Builder {
        private final URI proxyUrl;
        private DurableProxyTransport transport;
        private String serviceSecret;
        private String renewUrl;
        private Duration signedUrlTtl;
        private RequestIdStore requestIds;
        private String keyPrefix = ProxyRequests.DEFAULT_KEY_PREFIX;
        private long maxBufferBytes = FrameDemuxer.DEFAULT_MAX_BUFFER_BYTES;
        private ReplayPolicy replayPolicy = ReplayPolicy.LENIENT;
        private Duration pollDelay = StreamReader.DEFAULT_POLL_DELAY;
        private Duration startTimeout = DEFAULT_START_TIMEOUT;

        private Builder(URI proxyUrl) {
            this.proxyUrl = Objects.requireNonNull(proxyUrl, "proxyUrl");
        }

        public Builder transport(DurableProxyTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder serviceSecret(String serviceSecret) {
            this.serviceSecret = serviceSecret;
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

        public Builder maxBufferBytes(long maxBufferBytes) {
            this.maxBufferBytes = maxBufferBytes;
            return this;
        }

        public Builder replayPolicy(ReplayPolicy replayPolicy) {
            this.replayPolicy = Objects.requireNonNull(replayPolicy, "replayPolicy");
            return this;
        }

        public Builder pollDelay(Duration pollDelay) {
            this.pollDelay = Objects.requireNonNull(pollDelay, "pollDelay");
            return this;
        }

        /** How long to wait for the response's Start frame. */
        public Builder startTimeout(Duration startTimeout) {
            this.startTimeout = Objects.requireNonNull(startTimeout, "startTimeout");
            return this;
        }

        public DurableFetch build() {
            return new DurableFetch(this);
        }
    }
}
