package io.durableproxy.server;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;
import io.durableproxy.server.storage.ReadResult;
import io.durableproxy.server.storage.StreamStorage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SSE publisher over long-poll storage reads. Frame bytes go out base64-encoded in "data" events,
 * each followed by a "control" event carrying the next offset. Completes after a max duration or
 * when the stream disappears.
 */
final class StreamSsePublisher implements Flow.Publisher<SseFrame> {

    private final StreamStorage storage;
    private final String streamId;
    private final Offset start;
    private final String clientCursor;
    private final Duration maxDuration;
    private final Clock clock;

    StreamSsePublisher(StreamStorage storage, String streamId, Offset start, String clientCursor,
                       Duration maxDuration, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.start = Objects.requireNonNull(start, "start");
        this.clientCursor = clientCursor;
        this.maxDuration = Objects.requireNonNull(maxDuration, "maxDuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        Sub sub = new Sub(subscriber);
        subscriber.onSubscribe(sub);
        Thread t = new Thread(sub, "durable-proxy-sse-" + streamId);
        t.setDaemon(true);
        t.start();
    }

    private final class Sub implements Flow.Subscription, Runnable {
        private final Flow.Subscriber<? super SseFrame> sub;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicLong demand = new AtomicLong();
        private final Object signal = new Object();
        private Offset offset = start;
        private String cursor = clientCursor;
        private Offset lastControlOffset;

        Sub(Flow.Subscriber<? super SseFrame> sub) {
            this.sub = sub;
        }

        @Override
        public void request(long n) {
            if (n <= 0) return;
            demand.accumulateAndGet(n, (a, b) -> a + b < 0 ? Long.MAX_VALUE : a + b);
            wake();
        }

        @Override
        public void cancel() {
            cancelled.set(true);
            wake();
        }

        private void wake() {
            synchronized (signal) {
                signal.notifyAll();
            }
        }

        /** Blocks until a data and a control event can both be delivered; false once the read is over. */
        private boolean awaitDemand(Instant started) throws InterruptedException {
            synchronized (signal) {
                while (!cancelled.get() && demand.get() < 2) {
                    long left = maxDuration.minus(Duration.between(started, clock.instant())).toMillis();
                    if (left <= 0) return false;
                    signal.wait(left);
                }
            }
            return !cancelled.get();
        }

        @Override
        public void run() {
            Instant started = clock.instant();
            try {
                while (!cancelled.get() && Duration.between(started, clock.instant()).compareTo(maxDuration) < 0) {
                    if (!awaitDemand(started)) break;

                    ReadMode mode = lastControlOffset == null ? ReadMode.CATCH_UP : ReadMode.LONG_POLL;
                    ReadResult out = storage.read(streamId, offset, mode, cursor);
                    if (out.status() == ReadResult.Status.NOT_FOUND) break;
                    if (out.cursor() != null) cursor = out.cursor();

                    Offset next = out.nextOffset();
                    if (out.body().length == 0) {
                        if (!next.equals(lastControlOffset)) {
                            emit(SseFrame.control(next.value(), cursor, true));
                            lastControlOffset = next;
                        }
                        offset = next;
                        continue;
                    }

                    emit(SseFrame.frames(out.body()));
                    emit(SseFrame.control(next.value(), cursor, out.upToDate()));
                    lastControlOffset = next;
                    offset = next;
                }
                sub.onComplete();
            } catch (Throwable t) {
                sub.onError(t);
            }
        }

        private void emit(SseFrame frame) {
            sub.onNext(frame);
            demand.decrementAndGet();
        }
    }
}
