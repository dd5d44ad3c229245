package io.durableproxy.server.auth;

import io.durableproxy.core.Headers;
import io.durableproxy.core.Protocol;
import io.durableproxy.core.Urls;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The credential part of a capability URL.
 *
 * @param streamId stream the token grants access to
 * @param expires raw {@code expires} query value (Unix seconds)
 * @param signature raw {@code signature} query value
 */
public record CapabilityToken(String streamId, String expires, String signature) {

    public CapabilityToken {
        Objects.requireNonNull(streamId, "streamId");
    }

    /** Whether both query credentials were supplied. */
    public boolean hasCredentials() {
        return expires != null && !expires.isEmpty() && signature != null && !signature.isEmpty();
    }

    /**
     * Expiry in Unix seconds, or empty when the raw value is not a canonical non-negative integer.
     */
    public Optional<Long> expiresAt() {
        return Headers.canonicalDecimal(expires);
    }

    public static CapabilityToken of(String streamId, Map<String, String> query) {
        return new CapabilityToken(streamId, query.get(Protocol.Q_EXPIRES), query.get(Protocol.Q_SIGNATURE));
    }

    /**
     * Extracts a token from a full capability URL ({@code .../v1/proxy/{streamId}?expires=..&signature=..}).
     *
     * @return empty when the URL is not shaped like a capability URL
     */
    public static Optional<CapabilityToken> fromUrl(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (Exception e) {
            return Optional.empty();
        }
        String rawPath = uri.getRawPath();
        if (rawPath == null) return Optional.empty();
        String prefix = Protocol.PROXY_PATH + "/";
        int at = rawPath.indexOf(prefix);
        if (at < 0) return Optional.empty();
        String encodedId = rawPath.substring(at + prefix.length());
        if (encodedId.isEmpty() || encodedId.contains("/")) return Optional.empty();
        String streamId = URLDecoder.decode(encodedId, StandardCharsets.UTF_8);
        return Optional.of(new CapabilityToken(streamId,
                Urls.queryParam(uri, Protocol.Q_EXPIRES),
                Urls.queryParam(uri, Protocol.Q_SIGNATURE)));
    }
}
