package io.durableproxy.server.storage;

import io.durableproxy.core.Offset;
import io.durableproxy.core.ReadMode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpStreamStorageTest {

    private MockWebServer server;
    private HttpStreamStorage storage;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        storage = HttpStreamStorage.builder(server.url("/").uri())
                .bearerToken("storage-token")
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void createPutsWithTtl() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThat(storage.create("abc", Duration.ofSeconds(86400))).isTrue();
        assertThat(storage.create("abc", null)).isFalse();

        RecordedRequest put = server.takeRequest();
        assertThat(put.getMethod()).isEqualTo("PUT");
        assertThat(put.getPath()).isEqualTo("/v1/streams/abc");
        assertThat(put.getHeader("Stream-TTL")).isEqualTo("86400");
        assertThat(put.getHeader("Authorization")).isEqualTo("Bearer storage-token");
    }

    @Test
    void appendReturnsNextOffset() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204).addHeader("Stream-Next-Offset", "0000000000005"));

        Offset next = storage.append("abc", "hello".getBytes(StandardCharsets.UTF_8));

        assertThat(next.value()).isEqualTo("0000000000005");
        RecordedRequest post = server.takeRequest();
        assertThat(post.getMethod()).isEqualTo("POST");
        assertThat(post.getBody().readUtf8()).isEqualTo("hello");
    }

    @Test
    void appendToMissingStreamIsStreamNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> storage.append("gone", new byte[]{1}))
                .isInstanceOf(StorageException.StreamNotFound.class);
    }

    @Test
    void longPollReadForwardsOffsetAndCursor() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Stream-Next-Offset", "0000000000009")
                .addHeader("Stream-Up-To-Date", "true")
                .addHeader("Stream-Cursor", "42")
                .setBody("frames"));

        ReadResult out = storage.read("abc", new Offset("0000000000003"), ReadMode.LONG_POLL, "41");

        assertThat(out.status()).isEqualTo(ReadResult.Status.OK);
        assertThat(new String(out.body(), StandardCharsets.UTF_8)).isEqualTo("frames");
        assertThat(out.nextOffset().value()).isEqualTo("0000000000009");
        assertThat(out.upToDate()).isTrue();
        assertThat(out.cursor()).isEqualTo("42");

        RecordedRequest get = server.takeRequest();
        assertThat(get.getRequestUrl().queryParameter("offset")).isEqualTo("0000000000003");
        assertThat(get.getRequestUrl().queryParameter("live")).isEqualTo("long-poll");
        assertThat(get.getRequestUrl().queryParameter("cursor")).isEqualTo("41");
    }

    @Test
    void noContentIsTimeoutAndMissingIsNotFound() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204).addHeader("Stream-Next-Offset", "0000000000009"));
        server.enqueue(new MockResponse().setResponseCode(404));

        ReadResult timeout = storage.read("abc", Offset.beginning(), ReadMode.LONG_POLL, null);
        assertThat(timeout.status()).isEqualTo(ReadResult.Status.TIMEOUT);
        assertThat(timeout.nextOffset().value()).isEqualTo("0000000000009");

        assertThat(storage.read("abc", Offset.beginning(), ReadMode.CATCH_UP, null).status())
                .isEqualTo(ReadResult.Status.NOT_FOUND);
    }

    @Test
    void serverErrorsSurfaceAsStorageException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("disk full"));

        assertThatThrownBy(() -> storage.append("abc", new byte[]{1}))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("500")
                .hasMessageContaining("disk full");
    }

    @Test
    void existsAndDeleteMapStatuses() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(204));

        assertThat(storage.exists("abc")).isTrue();
        assertThat(storage.exists("abc")).isFalse();
        assertThat(storage.delete("abc")).isTrue();
    }
}
