package io.durableproxy.client;

import io.durableproxy.core.DurableProxyException;
import io.durableproxy.core.ErrorCode;
import io.durableproxy.core.ErrorEnvelope;

import java.nio.charset.StandardCharsets;

/**
 * Non-2xx answer from the proxy.
 *
 * <p>{@link #renewable()} is true only for an expired capability URL: the caller can reconnect and
 * resume at the same offset. Every other failure is final for the request that caused it.
 */
public class ProxyRequestException extends DurableProxyException {

    private final int status;
    private final String code;
    private final String streamId;

    public ProxyRequestException(String message, int status, String code, String streamId) {
        super(message);
        this.status = status;
        this.code = code;
        this.streamId = streamId;
    }

    static ProxyRequestException fromResponse(String operation, TransportResponse<byte[]> resp) {
        return ErrorEnvelope.parse(resp.body())
                .map(d -> new ProxyRequestException(
                        operation + " failed: " + resp.status() + " " + d.code()
                                + (d.message() == null ? "" : " (" + d.message() + ")"),
                        resp.status(), d.code(), d.streamId()))
                .orElseGet(() -> new ProxyRequestException(
                        operation + " failed: " + resp.status() + snippet(resp.body()),
                        resp.status(), null, null));
    }

    public int status() {
        return status;
    }

    /** Wire error code, or {@code null} when the body was not a proxy error envelope. */
    public String code() {
        return code;
    }

    public String streamId() {
        return streamId;
    }

    public boolean renewable() {
        return status == 401 && ErrorCode.SIGNATURE_EXPIRED.name().equals(code);
    }

    /** Storage hiccups and gateway errors that a reader may retry without side effects. */
    public boolean isTransient() {
        if (ErrorCode.STORAGE_ERROR.name().equals(code)) return true;
        return status >= 500 && code == null;
    }

    private static String snippet(byte[] body) {
        if (body == null || body.length == 0) return "";
        String text = new String(body, 0, Math.min(body.length, 200), StandardCharsets.UTF_8);
        return ": " + text;
    }
}
