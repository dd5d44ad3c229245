package io.durableproxy.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads the {@code data} and {@code control} events of a proxy SSE read.
 *
 * <p>Only the {@code event} and {@code data} fields are interpreted; comments and other fields
 * are skipped. Multiple {@code data} lines are joined with {@code \n}.
 */
public final class SseParser implements AutoCloseable {

    public record Event(String name, String data) {}

    private static final String DEFAULT_EVENT = "message";

    private final BufferedReader reader;

    public SseParser(InputStream body) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
    }

    /** Blocks until the next complete event; returns {@code null} at end of stream. */
    public Event next() throws IOException {
        String name = null;
        StringBuilder data = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (name != null || data != null) break;
                continue;
            }
            if (line.charAt(0) == ':') continue;

            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) value = value.substring(1);

            if ("event".equals(field)) {
                name = value;
            } else if ("data".equals(field)) {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
        }
        if (name == null && data == null) return null;
        return new Event(name == null ? DEFAULT_EVENT : name, data == null ? "" : data.toString());
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
