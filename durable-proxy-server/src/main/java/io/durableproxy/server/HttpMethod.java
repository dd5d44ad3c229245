package io.durableproxy.server;

/**
 * HTTP methods routed by {@link DurableProxyHandler}.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS
}
