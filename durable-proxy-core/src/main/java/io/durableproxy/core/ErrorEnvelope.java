package io.durableproxy.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON error body returned by the proxy: {@code {"error":{"code":..,"message":..,"streamId":..}}}.
 */
public record ErrorEnvelope(Detail error) {

    public ErrorEnvelope {
        Objects.requireNonNull(error, "error");
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"code", "message", "streamId"})
    public record Detail(String code, String message, String streamId) {}

    public static ErrorEnvelope of(ErrorCode code, String message, String streamId) {
        return new ErrorEnvelope(new Detail(code.name(), message, streamId));
    }

    public byte[] toJson() {
        try {
            return Json.mapper().writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render error body", e);
        }
    }

    /**
     * Parses an error body, returning empty when the bytes are not a proxy error envelope.
     */
    public static Optional<Detail> parse(byte[] body) {
        if (body == null || body.length == 0) return Optional.empty();
        try {
            ErrorEnvelope env = Json.mapper().readValue(body, ErrorEnvelope.class);
            return Optional.ofNullable(env.error());
        } catch (IOException | RuntimeException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return new String(toJson(), StandardCharsets.UTF_8);
    }
}
