package io.durableproxy.server;

import java.util.concurrent.Flow;

/**
 * Body of a {@link ServerResponse}. Adapters switch on the variant: nothing to write, a buffered
 * catch-up or error payload, or a live SSE read that they must drain until it completes.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {
        public int length() {
            return bytes.length;
        }
    }

    /** Frames of a {@code live=sse} read; completes when the read window closes or the stream is deleted. */
    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
