package io.durableproxy.core;

/**
 * Durable proxy protocol constants (paths, query keys, header names, and well-known values).
 *
 * <p>This module contains no HTTP client/server bindings. It only models protocol-level concerns
 * that are shared across proxy clients and servers.
 */
public final class Protocol {
    private Protocol() {}

    /** Base path of the proxy endpoints. */
    public static final String PROXY_PATH = "/v1/proxy";

    /** Base path of the backing stream storage service. */
    public static final String STREAMS_PATH = "/v1/streams";

    // Query parameter keys
    public static final String Q_OFFSET = "offset";
    public static final String Q_LIVE = "live";
    public static final String Q_CURSOR = "cursor";
    public static final String Q_EXPIRES = "expires";
    public static final String Q_SIGNATURE = "signature";
    public static final String Q_ACTION = "action";
    public static final String Q_RESPONSE = "response";
    public static final String Q_SECRET = "secret";

    // actions
    public static final String ACTION_ABORT = "abort";
    public static final String ACTION_CONNECT = "connect";
    public static final String ACTION_RENEW = "renew";

    // live modes
    public static final String LIVE_LONG_POLL = "long-poll";
    public static final String LIVE_SSE = "sse";

    // Proxy request headers
    public static final String H_UPSTREAM_URL = "Upstream-URL";
    public static final String H_UPSTREAM_METHOD = "Upstream-Method";
    public static final String H_UPSTREAM_AUTHORIZATION = "Upstream-Authorization";
    public static final String H_USE_STREAM_URL = "Use-Stream-URL";
    public static final String H_STREAM_SIGNED_URL_TTL = "Stream-Signed-URL-TTL";

    // Proxy response headers
    public static final String H_STREAM_ID = "Stream-Id";
    public static final String H_STREAM_RESPONSE_ID = "Stream-Response-Id";
    public static final String H_UPSTREAM_CONTENT_TYPE = "Upstream-Content-Type";
    public static final String H_UPSTREAM_STATUS = "Upstream-Status";
    public static final String H_STREAM_SSE_DATA_ENCODING = "Stream-SSE-Data-Encoding";

    // Stream storage headers
    public static final String H_STREAM_NEXT_OFFSET = "Stream-Next-Offset";
    public static final String H_STREAM_UP_TO_DATE = "Stream-Up-To-Date";
    public static final String H_STREAM_CURSOR = "Stream-Cursor";
    public static final String H_STREAM_TTL = "Stream-TTL";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_LOCATION = "Location";
    public static final String H_CACHE_CONTROL = "Cache-Control";

    // Content types
    public static final String CT_OCTET_STREAM = "application/octet-stream";
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";

    /** SSE data payloads carry base64-encoded frame bytes. */
    public static final String SSE_ENCODING_BASE64 = "base64";
    public static final String SSE_EVENT_DATA = "data";
    public static final String SSE_EVENT_CONTROL = "control";

    /** Sentinel offset that represents "from the start of the stream". */
    public static final String OFFSET_BEGINNING = "-1";

    /** Canonical boolean textual value used by the protocol for true. */
    public static final String BOOL_TRUE = "true";
}
