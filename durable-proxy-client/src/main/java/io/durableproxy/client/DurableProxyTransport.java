package io.durableproxy.client;

import java.io.InputStream;

/**
 * Blocking HTTP seam used by the session and fetch clients.
 */
public interface DurableProxyTransport {
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
