package io.durableproxy.client;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One call to the proxy as handed to a {@link DurableProxyTransport}.
 *
 * @param body    request body, or {@code null} for none
 * @param timeout per-request timeout, or {@code null} for the transport's default
 */
public record TransportRequest(
        String method,
        URI url,
        Map<String, List<String>> headers,
        byte[] body,
        Duration timeout
) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    static TransportRequest post(URI url, Map<String, List<String>> headers, byte[] body) {
        return new TransportRequest("POST", url, headers, body, null);
    }

    static TransportRequest read(URI url, Duration timeout) {
        return new TransportRequest("GET", url, null, null, timeout);
    }

    static TransportRequest patch(URI url) {
        return new TransportRequest("PATCH", url, null, null, null);
    }
}
