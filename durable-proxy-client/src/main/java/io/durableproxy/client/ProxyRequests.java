package io.durableproxy.client;

import io.durableproxy.core.Protocol;
import io.durableproxy.core.Urls;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request building shared by the session and fetch clients.
 */
final class ProxyRequests {

    static final String DEFAULT_KEY_PREFIX = "durable-proxy:";

    private ProxyRequests() {}

    static URI withSecret(URI url, String serviceSecret) {
        if (serviceSecret == null) return url;
        return Urls.withQuery(url, Map.of(Protocol.Q_SECRET, serviceSecret));
    }

    static Map<String, List<String>> upstreamHeaders(String upstreamUrl, FetchOptions options, Duration signedUrlTtl) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        out.put(Protocol.H_UPSTREAM_URL, List.of(upstreamUrl));
        out.put(Protocol.H_UPSTREAM_METHOD, List.of(options.method()));
        for (Map.Entry<String, String> e : options.headers().entrySet()) {
            String name = e.getKey();
            if (Protocol.H_AUTHORIZATION.equalsIgnoreCase(name)) {
                out.put(Protocol.H_UPSTREAM_AUTHORIZATION, List.of(e.getValue()));
            } else {
                out.put(name, List.of(e.getValue()));
            }
        }
        if (signedUrlTtl != null) {
            out.put(Protocol.H_STREAM_SIGNED_URL_TTL, List.of(Long.toString(signedUrlTtl.getSeconds())));
        }
        return out;
    }

    static String authorization(FetchOptions options) {
        for (Map.Entry<String, String> e : options.headers().entrySet()) {
            if (Protocol.H_AUTHORIZATION.equalsIgnoreCase(e.getKey())) return e.getValue();
        }
        return null;
    }

    static long responseId(String operation, TransportResponse<?> resp) {
        String raw = resp.header(Protocol.H_STREAM_RESPONSE_ID)
                .orElseThrow(() -> missing(operation, resp, Protocol.H_STREAM_RESPONSE_ID));
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ProxyRequestException(operation + " returned invalid "
                    + Protocol.H_STREAM_RESPONSE_ID + ": " + raw, resp.status(), null, null);
        }
    }

    static URI location(String operation, URI base, TransportResponse<?> resp) {
        String raw = resp.header(Protocol.H_LOCATION)
                .orElseThrow(() -> missing(operation, resp, Protocol.H_LOCATION));
        return base.resolve(raw);
    }

    static String streamId(URI streamUrl, TransportResponse<?> resp) {
        if (resp != null) {
            String header = resp.header(Protocol.H_STREAM_ID).orElse(null);
            if (header != null && !header.isEmpty()) return header;
        }
        String path = streamUrl.getRawPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        return URLDecoder.decode(last, StandardCharsets.UTF_8);
    }

    static void abort(DurableProxyTransport transport, URI streamUrl, Long responseId) throws Exception {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_ACTION, Protocol.ACTION_ABORT);
        if (responseId != null) q.put(Protocol.Q_RESPONSE, Long.toString(responseId));
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.patch(Urls.withQuery(streamUrl, q)));
        if (!resp.isSuccess()) throw ProxyRequestException.fromResponse("abort", resp);
    }

    /**
     * Exchanges a stream URL, expired or not, for a freshly signed one. The proxy checks only the
     * signature, so no upstream call is repeated.
     */
    static URI renew(DurableProxyTransport transport, URI proxyUrl, URI streamUrl, String serviceSecret,
                     Map<String, List<String>> headers) throws Exception {
        URI url = withSecret(Urls.withQuery(streamUrl, Map.of(Protocol.Q_ACTION, Protocol.ACTION_RENEW)), serviceSecret);
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.post(url, headers, null));
        if (!resp.isSuccess()) throw ProxyRequestException.fromResponse("renew", resp);
        return location("renew", proxyUrl, resp);
    }

    static Map<String, List<String>> renewHeaders(String renewUrl, String authorization, Duration signedUrlTtl) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (renewUrl != null) out.put(Protocol.H_UPSTREAM_URL, List.of(renewUrl));
        if (authorization != null) out.put(Protocol.H_UPSTREAM_AUTHORIZATION, List.of(authorization));
        if (signedUrlTtl != null) {
            out.put(Protocol.H_STREAM_SIGNED_URL_TTL, List.of(Long.toString(signedUrlTtl.getSeconds())));
        }
        return out;
    }

    private static ProxyRequestException missing(String operation, TransportResponse<?> resp, String header) {
        return new ProxyRequestException(operation + " response is missing " + header, resp.status(), null, null);
    }
}
