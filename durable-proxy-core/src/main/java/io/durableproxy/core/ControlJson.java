package io.durableproxy.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * SSE control event JSON: {@code {"streamNextOffset":..,"streamCursor":..,"upToDate":true}}.
 */
public final class ControlJson {
    private ControlJson() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"streamNextOffset", "streamCursor", "upToDate"})
    public record Control(
            String streamNextOffset,
            String streamCursor,
            @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean upToDate) {}

    public static Control parse(String json) {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        Control control;
        try {
            control = Json.mapper().readValue(json, Control.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid control event: " + e.getOriginalMessage(), e);
        }
        if (control.streamNextOffset() == null || control.streamNextOffset().isEmpty()) {
            throw new IllegalArgumentException("missing required field: streamNextOffset");
        }
        return control;
    }

    public static String render(String streamNextOffset, String streamCursor, boolean upToDate) {
        try {
            return Json.mapper().writeValueAsString(new Control(streamNextOffset, streamCursor, upToDate));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
