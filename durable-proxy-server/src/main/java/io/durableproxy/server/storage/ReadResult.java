package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;

/**
 * Outcome of reading the log.
 *
 * @param status read status
 * @param body bytes from the requested offset (empty for {@link Status#TIMEOUT})
 * @param nextOffset offset to resume from
 * @param upToDate whether {@code nextOffset} is the current tail
 * @param cursor storage cursor for live reads, may be null
 */
public record ReadResult(Status status, byte[] body, Offset nextOffset, boolean upToDate, String cursor) {

    public enum Status {
        OK,
        /** A live read waited without new data. */
        TIMEOUT,
        NOT_FOUND
    }

    public ReadResult {
        body = body == null ? new byte[0] : body;
    }

    public static ReadResult notFound() {
        return new ReadResult(Status.NOT_FOUND, null, null, false, null);
    }
}
