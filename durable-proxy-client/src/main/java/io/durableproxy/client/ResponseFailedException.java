package io.durableproxy.client;

import io.durableproxy.core.frame.ErrorPayload;

import java.io.IOException;

/**
 * Raised from a response body once an Error frame ends it, or when the whole session fails.
 */
public class ResponseFailedException extends IOException {

    private final long responseId;
    private final String code;

    public ResponseFailedException(long responseId, ErrorPayload error) {
        super(error.message() != null ? error.message() : error.code());
        this.responseId = responseId;
        this.code = error.code();
    }

    public ResponseFailedException(long responseId, String message, Throwable cause) {
        super(message, cause);
        this.responseId = responseId;
        this.code = null;
    }

    public long responseId() {
        return responseId;
    }

    /** Machine-readable code from the Error frame, may be null. */
    public String code() {
        return code;
    }
}
