package io.durableproxy.server.upstream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upstream status and headers, with the body left unread. Closing the response cancels the body.
 */
public final class UpstreamResponse implements Closeable {

    private final int status;
    private final Map<String, List<String>> headers;
    private final InputStream body;

    public UpstreamResponse(int status, Map<String, List<String>> headers, InputStream body) {
        this.status = status;
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body == null ? InputStream.nullInputStream() : body;
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }

    /**
     * Reads at most {@code max} bytes of the body and closes it.
     */
    public byte[] readErrorBody(int max) {
        try (InputStream in = body) {
            return in.readNBytes(max);
        } catch (IOException e) {
            return new byte[0];
        }
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
