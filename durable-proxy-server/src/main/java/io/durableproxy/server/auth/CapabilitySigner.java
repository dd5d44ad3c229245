package io.durableproxy.server.auth;

import io.durableproxy.core.Protocol;
import io.durableproxy.core.Urls;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Issues and verifies capability URLs.
 *
 * <p>signature = base64url(HMAC-SHA256(secret, streamId + ":" + expiresAt)) without padding, where
 * {@code expiresAt} is in Unix seconds. Comparison is constant-time.
 *
 * <p>Thread-safe.
 */
public final class CapabilitySigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder BASE64URL = Base64.getUrlEncoder().withoutPadding();

    private final SecretKeySpec key;
    private final Clock clock;

    public CapabilitySigner(String secret) {
        this(secret, Clock.systemUTC());
    }

    public CapabilitySigner(String secret, Clock clock) {
        Objects.requireNonNull(secret, "secret");
        if (secret.isEmpty()) throw new IllegalArgumentException("secret must not be empty");
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String sign(String streamId, long expiresAt) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((streamId + ":" + expiresAt).getBytes(StandardCharsets.UTF_8));
            return BASE64URL.encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /** Issues a token valid for {@code ttl} from now. */
    public CapabilityToken issue(String streamId, Duration ttl) {
        long expiresAt = clock.instant().getEpochSecond() + ttl.getSeconds();
        return new CapabilityToken(streamId, Long.toString(expiresAt), sign(streamId, expiresAt));
    }

    /**
     * Builds {@code {origin}/v1/proxy/{streamId}?expires=..&signature=..}.
     */
    public URI capabilityUrl(URI origin, CapabilityToken token) {
        String base = stripTrailingSlash(origin.toString());
        return URI.create(base + Protocol.PROXY_PATH + "/" + Urls.encode(token.streamId())
                + "?" + Protocol.Q_EXPIRES + "=" + token.expires()
                + "&" + Protocol.Q_SIGNATURE + "=" + token.signature());
    }

    public URI issueUrl(URI origin, String streamId, Duration ttl) {
        return capabilityUrl(origin, issue(streamId, ttl));
    }

    /**
     * Full verification for read access: signature first, then expiry.
     */
    public Verdict verify(CapabilityToken token) {
        Verdict signature = verifySignature(token);
        if (!signature.isValid()) return signature;
        long expiresAt = token.expiresAt().orElseThrow();
        if (clock.instant().getEpochSecond() >= expiresAt) return Verdict.SIGNATURE_EXPIRED;
        return Verdict.VALID;
    }

    /**
     * Signature-only verification for write paths, where an expired but genuine URL still
     * identifies the stream.
     */
    public Verdict verifySignature(CapabilityToken token) {
        if (token == null || !token.hasCredentials()) return Verdict.SIGNATURE_INVALID;
        Optional<Long> expiresAt = token.expiresAt();
        if (expiresAt.isEmpty()) return Verdict.SIGNATURE_INVALID;

        byte[] expected = sign(token.streamId(), expiresAt.get()).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = token.signature().getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual) ? Verdict.VALID : Verdict.SIGNATURE_INVALID;
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
