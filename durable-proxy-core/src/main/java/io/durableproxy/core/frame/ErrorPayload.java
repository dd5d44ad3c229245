package io.durableproxy.core.frame;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error frame payload.
 *
 * @param message human readable failure
 * @param code machine-readable code, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String message, String code) {}
