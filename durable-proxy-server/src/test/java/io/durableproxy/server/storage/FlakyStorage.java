package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.frame.FrameType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory storage whose appends of chosen frame types fail a set number of times.
 */
public final class FlakyStorage implements StreamStorage {

    private final StreamStorage delegate;
    private final Map<FrameType, AtomicInteger> failures = new EnumMap<>(FrameType.class);
    private final AtomicInteger failed = new AtomicInteger();

    public FlakyStorage(StreamStorage delegate) {
        this.delegate = delegate;
        for (FrameType type : FrameType.values()) failures.put(type, new AtomicInteger());
    }

    /** The next {@code times} appends of a {@code type} frame throw {@link StorageException}. */
    public FlakyStorage failAppends(FrameType type, int times) {
        failures.get(type).set(times);
        return this;
    }

    public int failedAppends() {
        return failed.get();
    }

    @Override
    public boolean create(String streamId, Duration ttl) throws StorageException {
        return delegate.create(streamId, ttl);
    }

    @Override
    public boolean exists(String streamId) throws StorageException {
        return delegate.exists(streamId);
    }

    @Override
    public Offset append(String streamId, byte[] bytes) throws StorageException {
        AtomicInteger remaining = failures.get(FrameType.fromCode(bytes[0]));
        if (remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            failed.incrementAndGet();
            throw new StorageException("injected append failure");
        }
        return delegate.append(streamId, bytes);
    }

    @Override
    public ReadResult read(String streamId, Offset offset, ReadMode mode, String cursor) throws StorageException {
        return delegate.read(streamId, offset, mode, cursor);
    }

    @Override
    public boolean delete(String streamId) throws StorageException {
        return delegate.delete(streamId);
    }
}
