package io.durableproxy.server;

import io.durableproxy.core.Protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What {@link DurableProxyHandler} answers; adapters copy status, headers and body to the wire.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    static ServerResponse empty(int status) {
        return new ServerResponse(status, new ResponseBody.Empty());
    }

    static ServerResponse bytes(int status, byte[] body) {
        return new ServerResponse(status, new ResponseBody.Bytes(body));
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /** Proxy answers carry capability URLs or live data, so none of them may be cached. */
    ServerResponse noStore() {
        return header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    /** First value of {@code name} (exact case), or {@code null}. */
    public String firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
