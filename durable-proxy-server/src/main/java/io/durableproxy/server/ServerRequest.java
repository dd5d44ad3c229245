package io.durableproxy.server;

import io.durableproxy.core.Headers;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A proxy request as an HTTP adapter hands it to {@link DurableProxyHandler}.
 *
 * @param uri full request URI including the query; its authority is used for {@code Location}
 *            when neither a public origin nor a {@code Host} header is available
 * @param body request body, or {@code null} when the request has none
 */
public record ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    /** Query parameters; the first occurrence wins. */
    public Map<String, String> query() {
        return QueryString.parse(uri);
    }
}
