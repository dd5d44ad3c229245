package io.durableproxy.client;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Where the response for a caller-chosen request id lives.
 *
 * @param streamUrl capability URL of the stream; null for session mappings, whose stream is implied
 * @param responseId id of the response on that stream
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestMapping(String streamUrl, long responseId) {
    public RequestMapping {
        if (responseId < 1) throw new IllegalArgumentException("responseId must be >= 1");
    }
}
