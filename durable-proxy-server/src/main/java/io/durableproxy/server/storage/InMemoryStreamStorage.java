package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link StreamStorage}.
 *
 * <p>Good for unit tests, examples and single-process deployments where losing the log on restart is
 * acceptable. Offsets are fixed-width base36 byte positions.
 */
public final class InMemoryStreamStorage implements StreamStorage {

    private static final int DEFAULT_MAX_CHUNK = 64 * 1024;
    private static final Duration DEFAULT_LONG_POLL_TIMEOUT = Duration.ofSeconds(25);
    private static final int OFFSET_RADIX = 36;
    private static final int OFFSET_WIDTH = 13;

    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();
    private final LiveCursors cursors;
    private final Duration longPollTimeout;
    private final int maxChunkSize;
    private final Clock clock;

    public InMemoryStreamStorage() {
        this(DEFAULT_LONG_POLL_TIMEOUT, DEFAULT_MAX_CHUNK, Clock.systemUTC());
    }

    public InMemoryStreamStorage(Duration longPollTimeout) {
        this(longPollTimeout, DEFAULT_MAX_CHUNK, Clock.systemUTC());
    }

    public InMemoryStreamStorage(Duration longPollTimeout, int maxChunkSize, Clock clock) {
        this.longPollTimeout = Objects.requireNonNull(longPollTimeout, "longPollTimeout");
        if (maxChunkSize <= 0) throw new IllegalArgumentException("maxChunkSize must be > 0");
        this.maxChunkSize = maxChunkSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cursors = new LiveCursors(clock);
    }

    @Override
    public boolean create(String streamId, Duration ttl) {
        Objects.requireNonNull(streamId, "streamId");
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        boolean[] created = new boolean[1];
        streams.compute(streamId, (id, existing) -> {
            if (existing != null && !existing.isExpired(now)) return existing;
            created[0] = true;
            return new StreamState(expiresAt);
        });
        return created[0];
    }

    @Override
    public boolean exists(String streamId) {
        return live(streamId) != null;
    }

    @Override
    public Offset append(String streamId, byte[] bytes) throws StorageException {
        StreamState s = live(streamId);
        if (s == null) throw new StorageException.StreamNotFound(streamId);
        return s.append(bytes);
    }

    @Override
    public ReadResult read(String streamId, Offset offset, ReadMode mode, String cursor) throws StorageException {
        if (mode == ReadMode.SSE) throw new IllegalArgumentException("SSE reads are served by the handler");
        StreamState s = live(streamId);
        if (s == null) return ReadResult.notFound();

        long pos = decodeStart(offset);
        if (mode == ReadMode.CATCH_UP) {
            return s.read(pos, maxChunkSize, null);
        }

        boolean ready;
        try {
            ready = s.await(pos, longPollTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("interrupted while waiting for data", e);
        }
        String next = cursors.next(cursor);
        if (!ready) {
            return new ReadResult(ReadResult.Status.TIMEOUT, null, s.tail(), true, next);
        }
        return s.read(pos, maxChunkSize, next);
    }

    @Override
    public boolean delete(String streamId) {
        StreamState removed = streams.remove(streamId);
        if (removed != null) removed.wakeAll();
        return removed != null;
    }

    private StreamState live(String streamId) {
        StreamState s = streams.get(streamId);
        if (s == null) return null;
        if (s.isExpired(clock.instant())) {
            streams.remove(streamId, s);
            return null;
        }
        return s;
    }

    private static long decodeStart(Offset off) {
        if (off == null || off.isBeginning()) return 0;
        try {
            return Long.parseUnsignedLong(off.value(), OFFSET_RADIX);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid offset: " + off.value(), e);
        }
    }

    // fixed width so offsets sort as strings
    static Offset offsetAt(long position) {
        String digits = Long.toString(position, OFFSET_RADIX);
        return new Offset("0".repeat(OFFSET_WIDTH - digits.length()) + digits);
    }

    private static final class StreamState {
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition dataArrived = lock.newCondition();
        private final Instant expiresAt;
        private byte[] log = new byte[1024];
        private int size;

        StreamState(Instant expiresAt) {
            this.expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && !expiresAt.isAfter(now);
        }

        Offset append(byte[] bytes) {
            lock.lock();
            try {
                if (size + bytes.length > log.length) {
                    log = Arrays.copyOf(log, Math.max(log.length * 2, size + bytes.length));
                }
                System.arraycopy(bytes, 0, log, size, bytes.length);
                size += bytes.length;
                dataArrived.signalAll();
                return offsetAt(size);
            } finally {
                lock.unlock();
            }
        }

        Offset tail() {
            lock.lock();
            try {
                return offsetAt(size);
            } finally {
                lock.unlock();
            }
        }

        ReadResult read(long pos, int limit, String cursor) {
            lock.lock();
            try {
                int start = (int) Math.min(pos, size);
                int end = (int) Math.min((long) start + limit, size);
                byte[] body = Arrays.copyOfRange(log, start, end);
                return new ReadResult(ReadResult.Status.OK, body, offsetAt(end), end == size, cursor);
            } finally {
                lock.unlock();
            }
        }

        boolean await(long pos, Duration timeout) throws InterruptedException {
            lock.lock();
            try {
                if (pos < size) return true;
                long nanos = timeout.toNanos();
                while (nanos > 0) {
                    nanos = dataArrived.awaitNanos(nanos);
                    if (pos < size) return true;
                }
                return false;
            } finally {
                lock.unlock();
            }
        }

        void wakeAll() {
            lock.lock();
            try {
                dataArrived.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
