package io.durableproxy.server.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * JDK {@link HttpClient}-based upstream caller.
 *
 * <p>Redirects are never followed: a 3xx is returned to the caller like any other status. The body
 * is returned as a stream so it can be pumped as it arrives.
 *
 * <p>Thread-safe.
 */
public final class UpstreamForwarder {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamForwarder.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final Duration responseTimeout;

    public UpstreamForwarder() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT);
    }

    public UpstreamForwarder(Duration connectTimeout, Duration responseTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1)
                .build(), responseTimeout);
    }

    /**
     * @param httpClient must be configured with {@link HttpClient.Redirect#NEVER}
     */
    public UpstreamForwarder(HttpClient httpClient, Duration responseTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (httpClient.followRedirects() != HttpClient.Redirect.NEVER) {
            throw new IllegalArgumentException("upstream client must not follow redirects");
        }
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout");
    }

    /**
     * Sends the request and returns once response headers arrive.
     *
     * @throws UpstreamConnectException if the upstream is unreachable or fails before responding
     * @throws UpstreamTimeoutException if no response headers arrive within the response timeout
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public UpstreamResponse forward(UpstreamRequest request) throws UpstreamException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(request.url())
                .timeout(responseTimeout)
                .method(request.method(), request.body().length == 0
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(request.body()));
        for (Map.Entry<String, String> e : request.headers().entrySet()) {
            try {
                builder.header(e.getKey(), e.getValue());
            } catch (IllegalArgumentException restricted) {
                LOG.debug("Not forwarding header {}: {}", e.getKey(), restricted.getMessage());
            }
        }

        LOG.debug("Forwarding {} {}", request.method(), request.url());

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("Connect timeout to " + request.url(), e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("Response timeout from " + request.url(), e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("Connection refused by " + request.url(), e);
        } catch (IOException e) {
            throw new UpstreamConnectException("Failed to reach " + request.url(), e);
        }

        LOG.debug("Upstream responded: {} {} -> {}", request.method(), request.url(), response.statusCode());
        return new UpstreamResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
