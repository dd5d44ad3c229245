package io.durableproxy.server.storage;

import io.durableproxy.core.Headers;
import io.durableproxy.core.Offset;
import io.durableproxy.core.Protocol;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link StreamStorage} backed by a remote Durable Streams server ({@code {baseUrl}/v1/streams/{id}}).
 */
public final class HttpStreamStorage implements StreamStorage {

    private static final Logger LOG = LoggerFactory.getLogger(HttpStreamStorage.class);

    private final URI baseUrl;
    private final HttpClient http;
    private final Duration requestTimeout;
    private final Duration longPollTimeout;
    private final String bearerToken;

    public static Builder builder(URI baseUrl) {
        return new Builder(baseUrl);
    }

    private HttpStreamStorage(Builder builder) {
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl");
        this.http = builder.http != null ? builder.http : HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(30);
        this.longPollTimeout = builder.longPollTimeout != null ? builder.longPollTimeout : Duration.ofSeconds(60);
        this.bearerToken = builder.bearerToken;
    }

    /**
     * Builder for {@link HttpStreamStorage}.
     */
    public static final class Builder {
        private final URI baseUrl;
        private HttpClient http;
        private Duration requestTimeout;
        private Duration longPollTimeout;
        private String bearerToken;

        private Builder(URI baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        }

        /** Sets the HTTP client. Default: a client that never follows redirects. */
        public Builder httpClient(HttpClient http) {
            this.http = http;
            return this;
        }

        /** Timeout for create/append/head/delete calls. Default: 30 seconds. */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /** Upper bound for a long-poll read, above the server's own hold time. Default: 60 seconds. */
        public Builder longPollTimeout(Duration longPollTimeout) {
            this.longPollTimeout = longPollTimeout;
            return this;
        }

        /** Bearer token sent to the storage server, if it requires one. */
        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public HttpStreamStorage build() {
            return new HttpStreamStorage(this);
        }
    }

    @Override
    public boolean create(String streamId, Duration ttl) throws StorageException {
        HttpRequest.Builder req = request(streamUrl(streamId), requestTimeout)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM)
                .PUT(HttpRequest.BodyPublishers.noBody());
        if (ttl != null) req.header(Protocol.H_STREAM_TTL, Long.toString(ttl.getSeconds()));

        HttpResponse<String> resp = send(req.build(), HttpResponse.BodyHandlers.ofString(), "create " + streamId);
        return switch (resp.statusCode()) {
            case 201 -> true;
            case 200, 204, 409 -> false;
            default -> throw unexpected("create", streamId, resp.statusCode(), resp.body());
        };
    }

    @Override
    public boolean exists(String streamId) throws StorageException {
        HttpRequest req = request(streamUrl(streamId), requestTimeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> resp = send(req, HttpResponse.BodyHandlers.discarding(), "head " + streamId);
        if (resp.statusCode() == 404) return false;
        if (resp.statusCode() / 100 == 2) return true;
        throw unexpected("head", streamId, resp.statusCode(), null);
    }

    @Override
    public Offset append(String streamId, byte[] bytes) throws StorageException {
        HttpRequest req = request(streamUrl(streamId), requestTimeout)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_OCTET_STREAM)
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
        HttpResponse<String> resp = send(req, HttpResponse.BodyHandlers.ofString(), "append " + streamId);
        if (resp.statusCode() == 404) throw new StorageException.StreamNotFound(streamId);
        if (resp.statusCode() / 100 != 2) throw unexpected("append", streamId, resp.statusCode(), resp.body());
        return Headers.firstValue(resp.headers().map(), Protocol.H_STREAM_NEXT_OFFSET)
                .map(Offset::new)
                .orElseThrow(() -> new StorageException("append response missing " + Protocol.H_STREAM_NEXT_OFFSET));
    }

    @Override
    public ReadResult read(String streamId, Offset offset, ReadMode mode, String cursor) throws StorageException {
        if (mode == ReadMode.SSE) throw new IllegalArgumentException("SSE reads are served by the handler");
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_OFFSET, offset == null ? Protocol.OFFSET_BEGINNING : offset.value());
        if (mode == ReadMode.LONG_POLL) q.put(Protocol.Q_LIVE, Protocol.LIVE_LONG_POLL);
        if (cursor != null) q.put(Protocol.Q_CURSOR, cursor);

        Duration timeout = mode == ReadMode.LONG_POLL ? longPollTimeout : requestTimeout;
        HttpRequest req = request(Urls.withQuery(streamUrl(streamId), q), timeout).GET().build();
        HttpResponse<byte[]> resp = send(req, HttpResponse.BodyHandlers.ofByteArray(), "read " + streamId);

        Map<String, List<String>> h = resp.headers().map();
        Offset next = Headers.firstValue(h, Protocol.H_STREAM_NEXT_OFFSET).map(Offset::new).orElse(offset);
        boolean upToDate = Headers.flag(h, Protocol.H_STREAM_UP_TO_DATE);
        String nextCursor = Headers.firstValue(h, Protocol.H_STREAM_CURSOR).orElse(null);

        return switch (resp.statusCode()) {
            case 200 -> new ReadResult(ReadResult.Status.OK, resp.body(), next, upToDate, nextCursor);
            case 204 -> new ReadResult(ReadResult.Status.TIMEOUT, null, next, true, nextCursor);
            case 404, 410 -> ReadResult.notFound();
            default -> throw unexpected("read", streamId, resp.statusCode(), null);
        };
    }

    @Override
    public boolean delete(String streamId) throws StorageException {
        HttpRequest req = request(streamUrl(streamId), requestTimeout).DELETE().build();
        HttpResponse<Void> resp = send(req, HttpResponse.BodyHandlers.discarding(), "delete " + streamId);
        if (resp.statusCode() == 404) return false;
        if (resp.statusCode() / 100 == 2) return true;
        throw unexpected("delete", streamId, resp.statusCode(), null);
    }

    private URI streamUrl(String streamId) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base + Protocol.STREAMS_PATH + "/" + Urls.encode(streamId));
    }

    private HttpRequest.Builder request(URI url, Duration timeout) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url).timeout(timeout);
        if (bearerToken != null) b.header(Protocol.H_AUTHORIZATION, "Bearer " + bearerToken);
        return b;
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler, String what)
            throws StorageException {
        try {
            return http.send(req, handler);
        } catch (IOException e) {
            LOG.warn("Storage call failed: {}", what, e);
            throw new StorageException("storage " + what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("interrupted during storage " + what, e);
        }
    }

    private static StorageException unexpected(String op, String streamId, int status, String body) {
        String detail = body == null || body.isEmpty() ? "" : ": " + body;
        return new StorageException("storage " + op + " " + streamId + " returned " + status + detail);
    }
}
