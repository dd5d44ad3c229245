package io.durableproxy.client;

import java.io.IOException;

/**
 * Raised from a response body once an Abort frame ends it.
 */
public class ResponseAbortedException extends IOException {

    private final long responseId;

    public ResponseAbortedException(long responseId) {
        super("response " + responseId + " aborted by remote");
        this.responseId = responseId;
    }

    public long responseId() {
        return responseId;
    }
}
