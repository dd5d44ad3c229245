package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStreamStorageTest {

    private final InMemoryStreamStorage storage = new InMemoryStreamStorage(Duration.ofMillis(200));

    @Test
    void createIsIdempotent() {
        assertThat(storage.create("s", null)).isTrue();
        assertThat(storage.create("s", null)).isFalse();
        assertThat(storage.exists("s")).isTrue();
        assertThat(storage.exists("other")).isFalse();
    }

    @Test
    void appendsAreReadBackFromAnyOffset() throws Exception {
        storage.create("s", null);
        Offset first = storage.append("s", bytes("hello"));
        Offset second = storage.append("s", bytes(" world"));

        assertThat(second).isGreaterThan(first);

        ReadResult all = storage.read("s", Offset.beginning(), ReadMode.CATCH_UP, null);
        assertThat(all.status()).isEqualTo(ReadResult.Status.OK);
        assertThat(new String(all.body(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        assertThat(all.nextOffset()).isEqualTo(second);
        assertThat(all.upToDate()).isTrue();

        ReadResult tail = storage.read("s", first, ReadMode.CATCH_UP, null);
        assertThat(new String(tail.body(), StandardCharsets.UTF_8)).isEqualTo(" world");
    }

    @Test
    void chunkedReadsReportNotUpToDate() throws Exception {
        InMemoryStreamStorage small = new InMemoryStreamStorage(Duration.ofMillis(100), 4, Clock.systemUTC());
        small.create("s", null);
        small.append("s", bytes("0123456789"));

        ReadResult first = small.read("s", Offset.beginning(), ReadMode.CATCH_UP, null);
        assertThat(first.body()).hasSize(4);
        assertThat(first.upToDate()).isFalse();

        ReadResult next = small.read("s", first.nextOffset(), ReadMode.CATCH_UP, null);
        assertThat(new String(next.body(), StandardCharsets.UTF_8)).isEqualTo("4567");
    }

    @Test
    void appendToMissingStreamFails() {
        assertThatThrownBy(() -> storage.append("missing", bytes("x")))
                .isInstanceOf(StorageException.StreamNotFound.class);
    }

    @Test
    void longPollTimesOutAtTail() throws Exception {
        storage.create("s", null);
        Offset tail = storage.append("s", bytes("x"));

        ReadResult out = storage.read("s", tail, ReadMode.LONG_POLL, null);

        assertThat(out.status()).isEqualTo(ReadResult.Status.TIMEOUT);
        assertThat(out.nextOffset()).isEqualTo(tail);
        assertThat(out.upToDate()).isTrue();
        assertThat(out.cursor()).isNotNull();
    }

    @Test
    void longPollWakesOnAppend() throws Exception {
        InMemoryStreamStorage slow = new InMemoryStreamStorage(Duration.ofSeconds(5));
        slow.create("s", null);
        Offset tail = slow.append("s", bytes("a"));

        CompletableFuture<ReadResult> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return slow.read("s", tail, ReadMode.LONG_POLL, null);
            } catch (StorageException e) {
                throw new RuntimeException(e);
            }
        });
        Thread.sleep(50);
        slow.append("s", bytes("b"));

        ReadResult out = waiting.get(2, TimeUnit.SECONDS);
        assertThat(out.status()).isEqualTo(ReadResult.Status.OK);
        assertThat(new String(out.body(), StandardCharsets.UTF_8)).isEqualTo("b");
    }

    @Test
    void readOfMissingOrDeletedStreamIsNotFound() throws Exception {
        assertThat(storage.read("nope", Offset.beginning(), ReadMode.CATCH_UP, null).status())
                .isEqualTo(ReadResult.Status.NOT_FOUND);

        storage.create("s", null);
        assertThat(storage.delete("s")).isTrue();
        assertThat(storage.delete("s")).isFalse();
        assertThat(storage.read("s", Offset.beginning(), ReadMode.CATCH_UP, null).status())
                .isEqualTo(ReadResult.Status.NOT_FOUND);
    }

    @Test
    void garbageOffsetIsRejected() {
        storage.create("s", null);

        assertThatThrownBy(() -> storage.read("s", new Offset("zz!"), ReadMode.CATCH_UP, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
