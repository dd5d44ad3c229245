package io.durableproxy.client;

import java.net.URI;

/**
 * Result of a {@link DurableFetch} call.
 *
 * @param streamUrl capability URL of the stream holding the response
 * @param streamId id of that stream
 * @param wasResumed true when an earlier call with the same request id was picked up
 * @param response the response itself
 */
public record DurableResponse(URI streamUrl, String streamId, boolean wasResumed, ProxyResponse response) {
}
