package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;

import java.time.Duration;

/**
 * Append-only log collaborator.
 *
 * <p>Each {@link #append} must be atomic: concurrent appends may interleave with each other but never
 * split one call's bytes. Implementations must be thread-safe.
 */
public interface StreamStorage {

    /**
     * Creates a stream.
     *
     * @param ttl retention period, or null for the storage default
     * @return {@code true} if created, {@code false} if it already existed
     */
    boolean create(String streamId, Duration ttl) throws StorageException;

    boolean exists(String streamId) throws StorageException;

    /**
     * Appends bytes and returns the new tail offset.
     *
     * @throws StorageException.StreamNotFound if the stream does not exist
     */
    Offset append(String streamId, byte[] bytes) throws StorageException;

    /**
     * Reads from {@code offset}.
     *
     * @param mode {@link ReadMode#CATCH_UP} or {@link ReadMode#LONG_POLL}
     * @param cursor cursor echoed by the reader, may be null
     */
    ReadResult read(String streamId, Offset offset, ReadMode mode, String cursor) throws StorageException;

    /**
     * @return {@code true} if a stream was deleted
     */
    boolean delete(String streamId) throws StorageException;
}
