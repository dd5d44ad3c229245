package io.durableproxy.server.registry;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.frame.Frame;
import io.durableproxy.core.frame.FrameDecoder;
import io.durableproxy.server.storage.ReadResult;
import io.durableproxy.server.storage.StorageException;
import io.durableproxy.server.storage.StreamStorage;

/**
 * Finds the highest response id already written to a stream, so a process that did not create the
 * stream never reuses an id.
 */
public final class ResponseIdScanner {
    private ResponseIdScanner() {}

    public static long highestResponseId(StreamStorage storage, String streamId) throws StorageException {
        FrameDecoder decoder = new FrameDecoder();
        Offset offset = Offset.beginning();
        long highest = 0;
        while (true) {
            ReadResult result = storage.read(streamId, offset, ReadMode.CATCH_UP, null);
            if (result.status() != ReadResult.Status.OK) return highest;
            for (Frame frame : decoder.push(result.body())) {
                highest = Math.max(highest, frame.responseId());
            }
            if (result.upToDate() || result.body().length == 0 || result.nextOffset() == null) return highest;
            offset = result.nextOffset();
        }
    }
}
