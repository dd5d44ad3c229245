package io.durableproxy.server.registry;

import io.durableproxy.core.frame.FrameCodec;
import io.durableproxy.server.storage.StorageException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process {@link SessionRegistry}.
 */
public final class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, StreamEntry> streams = new ConcurrentHashMap<>();

    @Override
    public long allocateResponseId(String streamId, CounterSeed seed) throws StorageException {
        StreamEntry entry = streams.get(streamId);
        if (entry == null) {
            long highest = seed.highestResponseId();
            entry = streams.computeIfAbsent(streamId, id -> new StreamEntry(highest));
        }
        long id = entry.counter.incrementAndGet();
        if (id > FrameCodec.MAX_RESPONSE_ID) {
            throw new IllegalStateException("response ids exhausted for stream " + streamId);
        }
        return id;
    }

    @Override
    public void register(InFlightResponse response) {
        entry(response.streamId()).inFlight.put(response.responseId(), response);
    }

    @Override
    public Optional<InFlightResponse> find(String streamId, long responseId) {
        StreamEntry entry = streams.get(streamId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.inFlight.get(responseId));
    }

    @Override
    public Optional<InFlightResponse> latest(String streamId) {
        StreamEntry entry = streams.get(streamId);
        if (entry == null) return Optional.empty();
        Map.Entry<Long, InFlightResponse> last = entry.inFlight.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public void remove(String streamId, long responseId) {
        StreamEntry entry = streams.get(streamId);
        if (entry != null) entry.inFlight.remove(responseId);
    }

    @Override
    public Collection<InFlightResponse> forget(String streamId) {
        StreamEntry removed = streams.remove(streamId);
        return removed == null ? List.of() : List.copyOf(removed.inFlight.values());
    }

    private StreamEntry entry(String streamId) {
        return streams.computeIfAbsent(streamId, id -> new StreamEntry(0));
    }

    private static final class StreamEntry {
        final AtomicLong counter;
        final ConcurrentSkipListMap<Long, InFlightResponse> inFlight = new ConcurrentSkipListMap<>();

        StreamEntry(long highest) {
            this.counter = new AtomicLong(highest);
        }
    }
}
