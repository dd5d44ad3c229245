package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Tracks per-response frame ordering: exactly one Start, then Data, then exactly one terminal frame.
 *
 * <p>Frames of different responses may interleave freely. Not thread-safe.
 */
public final class FrameSequenceValidator {

    public enum Outcome {
        ACCEPTED,
        /** Data or terminal frame for a response that never started. */
        UNKNOWN_RESPONSE,
        /** Second Start for a response id that is still open. */
        DUPLICATE_START,
        /** Any frame for a response that already ended. */
        AFTER_TERMINAL
    }

    private final Map<Long, FrameType> open = new HashMap<>();
    private final Set<Long> terminated = new HashSet<>();

    /**
     * Classifies {@code frame} and, when accepted, records the transition.
     */
    public Outcome check(Frame frame) {
        long id = frame.responseId();
        if (terminated.contains(id)) return Outcome.AFTER_TERMINAL;

        switch (frame.type()) {
            case START:
                if (open.containsKey(id)) return Outcome.DUPLICATE_START;
                open.put(id, FrameType.START);
                return Outcome.ACCEPTED;
            case DATA:
                if (!open.containsKey(id)) return Outcome.UNKNOWN_RESPONSE;
                open.put(id, FrameType.DATA);
                return Outcome.ACCEPTED;
            case COMPLETE:
            case ABORT:
            case ERROR:
                if (open.remove(id) == null) return Outcome.UNKNOWN_RESPONSE;
                terminated.add(id);
                return Outcome.ACCEPTED;
            default:
                throw new IllegalStateException("unhandled frame type " + frame.type());
        }
    }

    /**
     * Like {@link #check} but throws on anything other than {@link Outcome#ACCEPTED}.
     */
    public void require(Frame frame) {
        Outcome outcome = check(frame);
        if (outcome != Outcome.ACCEPTED) {
            throw new DurableProxyException.ProtocolViolation(frame.responseId(),
                    describe(outcome, frame.type()));
        }
    }

    public boolean isOpen(long responseId) {
        return open.containsKey(responseId);
    }

    public boolean isTerminated(long responseId) {
        return terminated.contains(responseId);
    }

    static String describe(Outcome outcome, FrameType type) {
        return switch (outcome) {
            case UNKNOWN_RESPONSE -> type + " frame before START";
            case DUPLICATE_START -> "duplicate START";
            case AFTER_TERMINAL -> type + " frame after terminal frame";
            case ACCEPTED -> "accepted";
        };
    }
}
