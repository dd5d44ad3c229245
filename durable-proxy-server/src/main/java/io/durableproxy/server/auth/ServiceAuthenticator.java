package io.durableproxy.server.auth;

import io.durableproxy.core.Headers;
import io.durableproxy.core.Protocol;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the service secret that guards stream creation, connect and delete.
 *
 * <p>The secret is accepted from the {@code secret} query parameter or an
 * {@code Authorization: Bearer} header.
 */
public final class ServiceAuthenticator {

    public enum Result {
        OK,
        MISSING,
        INVALID
    }

    private static final String BEARER = "Bearer ";

    private final byte[] secret; // null when disabled

    private ServiceAuthenticator(String secret) {
        this.secret = secret == null ? null : secret.getBytes(StandardCharsets.UTF_8);
    }

    public static ServiceAuthenticator disabled() {
        return new ServiceAuthenticator(null);
    }

    public static ServiceAuthenticator withSecret(String secret) {
        if (secret == null || secret.isEmpty()) throw new IllegalArgumentException("secret must not be empty");
        return new ServiceAuthenticator(secret);
    }

    public boolean enabled() {
        return secret != null;
    }

    public Result authenticate(Map<String, String> query, Map<String, List<String>> headers) {
        if (secret == null) return Result.OK;
        Optional<String> presented = presentedSecret(query, headers);
        if (presented.isEmpty()) return Result.MISSING;
        byte[] actual = presented.get().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(secret, actual) ? Result.OK : Result.INVALID;
    }

    private static Optional<String> presentedSecret(Map<String, String> query, Map<String, List<String>> headers) {
        String fromQuery = query.get(Protocol.Q_SECRET);
        if (fromQuery != null && !fromQuery.isEmpty()) return Optional.of(fromQuery);
        return Headers.firstValue(headers, Protocol.H_AUTHORIZATION)
                .filter(v -> v.regionMatches(true, 0, BEARER, 0, BEARER.length()))
                .map(v -> v.substring(BEARER.length()).trim())
                .filter(v -> !v.isEmpty());
    }
}
