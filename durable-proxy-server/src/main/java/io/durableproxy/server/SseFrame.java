package io.durableproxy.server;

import io.durableproxy.core.ControlJson;
import io.durableproxy.core.Protocol;

import java.util.Base64;
import java.util.Objects;

/**
 * One event on a proxy SSE read: either a {@code data} event carrying base64 frame bytes or a
 * {@code control} event carrying the next offset.
 */
public record SseFrame(String event, String data) {
    public static final String EVENT_DATA = Protocol.SSE_EVENT_DATA;
    public static final String EVENT_CONTROL = Protocol.SSE_EVENT_CONTROL;

    public SseFrame {
        Objects.requireNonNull(event, "event");
        data = data == null ? "" : data;
    }

    static SseFrame frames(byte[] frameBytes) {
        return new SseFrame(EVENT_DATA, Base64.getEncoder().encodeToString(frameBytes));
    }

    static SseFrame control(String nextOffset, String cursor, boolean upToDate) {
        return new SseFrame(EVENT_CONTROL, ControlJson.render(nextOffset, cursor, upToDate));
    }

    /** The event block as written to the wire, terminated by a blank line. */
    public String render() {
        StringBuilder sb = new StringBuilder(data.length() + event.length() + 16);
        sb.append("event: ").append(event).append('\n');
        int from = 0;
        while (true) {
            int nl = data.indexOf('\n', from);
            String line = nl < 0 ? data.substring(from) : data.substring(from, nl);
            if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);
            sb.append("data: ").append(line).append('\n');
            if (nl < 0) break;
            from = nl + 1;
        }
        return sb.append('\n').toString();
    }
}
