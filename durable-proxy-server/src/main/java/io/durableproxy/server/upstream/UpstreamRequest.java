package io.durableproxy.server.upstream;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A request to forward.
 *
 * @param url allowlisted target
 * @param method upstream method
 * @param headers headers already filtered for the upstream
 * @param body request body, empty when none
 */
public record UpstreamRequest(URI url, String method, Map<String, String> headers, byte[] body) {

    public UpstreamRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
