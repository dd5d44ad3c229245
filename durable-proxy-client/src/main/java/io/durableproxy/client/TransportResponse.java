package io.durableproxy.client;

import io.durableproxy.core.Headers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status, headers and body of a proxy answer; {@code T} is {@code byte[]} or {@code InputStream}.
 */
public record TransportResponse<T>(int status, Map<String, List<String>> headers, T body) {
    public TransportResponse {
        if (headers == null) headers = Map.of();
    }

    public boolean isSuccess() {
        return status / 100 == 2;
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public boolean flag(String name) {
        return Headers.flag(headers, name);
    }

    /** The same status and headers around a different body. */
    <U> TransportResponse<U> withBody(U newBody) {
        return new TransportResponse<>(status, headers, newBody);
    }
}
