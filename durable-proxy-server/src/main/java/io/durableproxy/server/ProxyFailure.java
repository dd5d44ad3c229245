package io.durableproxy.server;

import io.durableproxy.core.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request that ends in a JSON error response. Thrown anywhere below {@link DurableProxyHandler#handle}
 * and rendered there.
 */
final class ProxyFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final ErrorCode code;
    private final String streamId;
    private final transient Map<String, String> headers = new LinkedHashMap<>();
    private transient byte[] rawBody;
    private transient String rawContentType;

    ProxyFailure(int status, ErrorCode code, String message) {
        this(status, code, message, null);
    }

    ProxyFailure(int status, ErrorCode code, String message, String streamId) {
        super(message);
        this.status = status;
        this.code = Objects.requireNonNull(code, "code");
        this.streamId = streamId;
    }

    static ProxyFailure badRequest(ErrorCode code, String message) {
        return new ProxyFailure(400, code, message);
    }

    static ProxyFailure unauthorized(ErrorCode code, String message, String streamId) {
        return new ProxyFailure(401, code, message, streamId);
    }

    static ProxyFailure badGateway(ErrorCode code, String message) {
        return new ProxyFailure(502, code, message);
    }

    ProxyFailure withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /** Replaces the JSON envelope with a pass-through body (upstream error responses). */
    ProxyFailure withRawBody(byte[] body, String contentType) {
        this.rawBody = body;
        this.rawContentType = contentType;
        return this;
    }

    int status() {
        return status;
    }

    ErrorCode code() {
        return code;
    }

    String streamId() {
        return streamId;
    }

    Map<String, String> headers() {
        return headers;
    }

    byte[] rawBody() {
        return rawBody;
    }

    String rawContentType() {
        return rawContentType;
    }
}
