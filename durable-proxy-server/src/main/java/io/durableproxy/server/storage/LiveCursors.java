package io.durableproxy.server.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues {@code Stream-Cursor} values for live reads.
 *
 * <p>A cursor is the number of 20 second windows since 2024-10-09. A client that echoes a cursor at
 * or ahead of the current window gets one pushed further ahead by random jitter, so a shared cache
 * never hands the same live response back to it. Issued cursors never go backwards.
 */
final class LiveCursors {

    private static final long EPOCH_SECONDS = 1_728_432_000L;
    private static final Duration WINDOW = Duration.ofSeconds(20);
    private static final int MAX_JITTER_SECONDS = 3600;

    private final Clock clock;
    private final AtomicLong highest = new AtomicLong(-1);

    LiveCursors(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    String next(String echoed) {
        long window = Math.max(0, clock.instant().getEpochSecond() - EPOCH_SECONDS) / WINDOW.getSeconds();
        long client = parse(echoed);
        long candidate = window;
        if (client >= window) {
            long jitter = Math.max(1, (1 + ThreadLocalRandom.current().nextInt(MAX_JITTER_SECONDS)) / WINDOW.getSeconds());
            candidate = client + jitter;
        }
        return Long.toString(highest.accumulateAndGet(candidate, Math::max));
    }

    private static long parse(String cursor) {
        if (cursor == null) return -1;
        try {
            return Long.parseLong(cursor);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
