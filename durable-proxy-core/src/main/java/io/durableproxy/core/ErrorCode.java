package io.durableproxy.core;

/**
 * Machine-readable error codes carried in proxy error bodies and Error frames.
 */
public enum ErrorCode {
    MISSING_UPSTREAM_URL,
    MISSING_UPSTREAM_METHOD,
    INVALID_UPSTREAM_METHOD,
    INVALID_UPSTREAM_URL,
    UPSTREAM_NOT_ALLOWED,
    REDIRECT_NOT_ALLOWED,
    UPSTREAM_ERROR,
    UPSTREAM_TIMEOUT,
    IDLE_TIMEOUT,
    RESPONSE_TOO_LARGE,
    MALFORMED_STREAM_URL,
    MISSING_SIGNATURE,
    SIGNATURE_INVALID,
    SIGNATURE_EXPIRED,
    MISSING_SECRET,
    INVALID_SECRET,
    STREAM_NOT_FOUND,
    STORAGE_ERROR,
    INVALID_ACTION,
    INVALID_RESPONSE_ID,
    INVALID_OFFSET,
    INVALID_LIVE_MODE,
    INVALID_TTL,
    CONNECT_REJECTED,
    RENEWAL_REJECTED,
    METHOD_NOT_ALLOWED,
    NOT_FOUND,
    INTERNAL_ERROR;

    /**
     * Resolves a wire code, or {@code null} when the code is unknown to this version.
     */
    public static ErrorCode fromWire(String code) {
        if (code == null) return null;
        for (ErrorCode c : values()) {
            if (c.name().equals(code)) return c;
        }
        return null;
    }
}
