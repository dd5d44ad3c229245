package io.durableproxy.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link DurableProxyTransport} over {@link HttpClient}, pinned to HTTP/1.1 so long-polls and SSE
 * reads do not share one multiplexed connection with appends.
 */
public final class JdkHttpTransport implements DurableProxyTransport {
    private static final Logger LOG = LoggerFactory.getLogger(JdkHttpTransport.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http;

    public JdkHttpTransport() {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        TransportResponse<byte[]> resp = send(request, HttpResponse.BodyHandlers.ofByteArray());
        return resp.body() == null ? resp.withBody(new byte[0]) : resp;
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        return send(request, HttpResponse.BodyHandlers.ofInputStream());
    }

    private <T> TransportResponse<T> send(TransportRequest request, HttpResponse.BodyHandler<T> handler)
            throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), request.body() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));
        if (request.timeout() != null) builder.timeout(request.timeout());
        request.headers().forEach((name, values) -> values.forEach(v -> builder.header(name, v)));

        HttpResponse<T> resp = http.send(builder.build(), handler);
        LOG.debug("{} {} -> {}", request.method(), request.url().getRawPath(), resp.statusCode());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body());
    }
}
