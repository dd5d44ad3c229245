package io.durableproxy.core.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.durableproxy.core.DurableProxyException;
import io.durableproxy.core.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON encoding of Start and Error frame payloads.
 */
public final class FramePayloads {
    private FramePayloads() {}

    public static byte[] encodeStart(StartPayload start) {
        try {
            return Json.mapper().writeValueAsBytes(start);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode start payload", e);
        }
    }

    /**
     * @throws DurableProxyException.MalformedFrame when the payload is not a start object
     */
    public static StartPayload decodeStart(byte[] payload) {
        JsonNode root;
        try {
            root = Json.mapper().readTree(payload);
        } catch (IOException e) {
            throw new DurableProxyException.MalformedFrame("start payload is not JSON", e);
        }
        if (root == null || !root.isObject() || !root.path("status").isInt()) {
            throw new DurableProxyException.MalformedFrame("start payload missing integer status");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        JsonNode h = root.path("headers");
        if (h.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = h.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getValue().isValueNode() && !e.getValue().isNull()) {
                    headers.put(e.getKey(), e.getValue().asText());
                }
            }
        }
        return new StartPayload(root.get("status").intValue(), headers);
    }

    public static byte[] encodeError(ErrorPayload error) {
        try {
            return Json.mapper().writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode error payload", e);
        }
    }

    /**
     * Decodes an Error payload. Non-JSON payloads become the message verbatim; a JSON object
     * without a message falls back to its code, then to the raw text.
     */
    public static ErrorPayload decodeError(byte[] payload) {
        String raw = new String(payload, StandardCharsets.UTF_8);
        JsonNode root;
        try {
            root = Json.mapper().readTree(payload);
        } catch (IOException e) {
            return new ErrorPayload(raw, null);
        }
        if (root == null || !root.isObject()) {
            return new ErrorPayload(raw, null);
        }
        String code = root.hasNonNull("code") ? root.get("code").asText() : null;
        String message = root.hasNonNull("message") ? root.get("message").asText() : null;
        if (message == null) message = code != null ? code : raw;
        return new ErrorPayload(message, code);
    }
}
