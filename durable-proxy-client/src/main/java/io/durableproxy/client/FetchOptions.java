package io.durableproxy.client;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Options for one proxied upstream call.
 *
 * <p>An {@code Authorization} header is sent to the proxy as {@code Upstream-Authorization}, so it
 * reaches the upstream without authenticating against the proxy itself.
 */
public final class FetchOptions {

    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String requestId;

    private FetchOptions(Builder b) {
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
        this.requestId = b.requestId;
    }

    public static FetchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String method() {
        return method;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }

    /** Caller-chosen id that makes the call resumable; may be null. */
    public String requestId() {
        return requestId;
    }

    public static final class Builder {
        private String method = "POST";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private String requestId;

        public Builder method(String method) {
            this.method = method.toUpperCase(Locale.ROOT);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public FetchOptions build() {
            return new FetchOptions(this);
        }
    }
}
