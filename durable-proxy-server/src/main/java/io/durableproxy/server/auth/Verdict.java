package io.durableproxy.server.auth;

import io.durableproxy.core.ErrorCode;

/**
 * Outcome of capability verification. The signature is checked before expiry, so an expired verdict
 * always means the token was genuinely issued by this server.
 */
public enum Verdict {
    VALID(null),
    SIGNATURE_INVALID(ErrorCode.SIGNATURE_INVALID),
    SIGNATURE_EXPIRED(ErrorCode.SIGNATURE_EXPIRED);

    private final ErrorCode errorCode;

    Verdict(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    /** Error code to report, or {@code null} for {@link #VALID}. */
    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean isValid() {
        return this == VALID;
    }
}
