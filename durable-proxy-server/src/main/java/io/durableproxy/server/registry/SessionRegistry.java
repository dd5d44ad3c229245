package io.durableproxy.server.registry;

import io.durableproxy.server.storage.StorageException;

import java.util.Collection;
import java.util.Optional;

/**
 * Per-process view of streams: the response-id counter and the responses still in flight.
 *
 * <p>Implementations must be thread-safe; {@link #allocateResponseId} in particular may be called
 * concurrently for the same stream.
 */
public interface SessionRegistry {

    /**
     * Seeds a stream's counter the first time this process sees it.
     */
    @FunctionalInterface
    interface CounterSeed {
        /** @return the highest response id already in the stream's log, or 0 */
        long highestResponseId() throws StorageException;
    }

    /**
     * Returns the next response id for {@code streamId}: strictly greater than every id handed out
     * before and than {@code seed}.
     */
    long allocateResponseId(String streamId, CounterSeed seed) throws StorageException;

    void register(InFlightResponse response);

    Optional<InFlightResponse> find(String streamId, long responseId);

    /** The in-flight response with the highest id on the stream. */
    Optional<InFlightResponse> latest(String streamId);

    /** Drops a finished response. */
    void remove(String streamId, long responseId);

    /**
     * Forgets the stream and its counter.
     *
     * @return the responses that were still in flight, for the caller to cancel
     */
    Collection<InFlightResponse> forget(String streamId);
}
