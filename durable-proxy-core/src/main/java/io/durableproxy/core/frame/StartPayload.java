package io.durableproxy.core.frame;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Start frame payload: upstream status plus the response headers worth relaying.
 */
@JsonPropertyOrder({"status", "headers"})
public record StartPayload(int status, Map<String, String> headers) {
    public StartPayload {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
