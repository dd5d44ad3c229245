package io.durableproxy.server.upstream;

import io.durableproxy.core.Headers;
import io.durableproxy.core.Protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Header rewriting between the client, the proxy and the upstream.
 */
public final class UpstreamHeaders {
    private UpstreamHeaders() {}

    /**
     * Hop-by-hop headers, plus those the proxy or the HTTP client manage itself. Never forwarded in
     * either direction.
     */
    static final Set<String> HOP_BY_HOP = Set.of(
            "connection",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "host",
            "authorization",
            "accept-encoding",
            "content-length");

    /** Proxy control headers; consumed here, never forwarded. */
    static final Set<String> PROXY_HEADERS = Set.of(
            "upstream-url",
            "upstream-authorization",
            "upstream-method",
            "use-stream-url",
            "stream-signed-url-ttl");

    /** Headers the JDK client refuses to set. */
    private static final Set<String> RESTRICTED = Set.of("expect", "date", "via", "warning", "from", "referer");

    /**
     * Headers to send upstream: client headers minus hop-by-hop and proxy headers, with multiple
     * values joined by {@code ", "} and {@code Upstream-Authorization} sent as {@code Authorization}.
     */
    public static Map<String, String> forUpstream(Map<String, List<String>> clientHeaders) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : clientHeaders.entrySet()) {
            if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) continue;
            String lower = e.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP.contains(lower) || PROXY_HEADERS.contains(lower) || RESTRICTED.contains(lower)) continue;
            out.put(e.getKey(), String.join(", ", e.getValue()));
        }
        Headers.firstValue(clientHeaders, Protocol.H_UPSTREAM_AUTHORIZATION)
                .ifPresent(auth -> out.put(Protocol.H_AUTHORIZATION, auth));
        return out;
    }

    /**
     * Upstream response headers as recorded in a Start frame: lower-case names, hop-by-hop removed,
     * multiple values joined.
     */
    public static Map<String, String> fromUpstream(Map<String, List<String>> upstreamHeaders) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : upstreamHeaders.entrySet()) {
            if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) continue;
            String lower = e.getKey().toLowerCase(Locale.ROOT);
            if (lower.startsWith(":") || HOP_BY_HOP.contains(lower)) continue;
            out.merge(lower, String.join(", ", e.getValue()), (a, b) -> a + ", " + b);
        }
        return out;
    }
}
