package io.durableproxy.core;

import java.util.Objects;

/**
 * Position in a stream's byte log as issued by storage in {@code Stream-Next-Offset}.
 *
 * <p>Values are opaque and compare lexicographically. {@code -1} means the start of the log.
 */
public record Offset(String value) implements Comparable<Offset> {
    private static final String RESERVED = ",&=?";

    public Offset {
        Objects.requireNonNull(value, "offset");
        if (value.isEmpty()) {
            throw new DurableProxyException.InvalidOffset("offset must not be empty");
        }
        if (value.chars().anyMatch(c -> RESERVED.indexOf(c) >= 0)) {
            throw new DurableProxyException.InvalidOffset("offset must not contain any of " + RESERVED);
        }
    }

    public static Offset beginning() {
        return new Offset(Protocol.OFFSET_BEGINNING);
    }

    public boolean isBeginning() {
        return Protocol.OFFSET_BEGINNING.equals(value);
    }

    @Override
    public int compareTo(Offset other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
