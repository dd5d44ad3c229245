package io.durableproxy.client;

import java.util.Optional;

/**
 * Persists request id mappings so a retried call resumes the original response instead of
 * invoking the upstream again.
 *
 * <p>Keys are opaque strings built by the clients from the proxy URL, the session id (if any) and
 * the request id.
 */
public interface RequestIdStore {

    Optional<RequestMapping> load(String key);

    void save(String key, RequestMapping mapping);

    void remove(String key);

    static String key(String prefix, String proxyUrl, String sessionId, String requestId) {
        StringBuilder sb = new StringBuilder(prefix).append(proxyUrl);
        if (sessionId != null) sb.append('|').append(sessionId);
        return sb.append('|').append(requestId).toString();
    }
}
