package io.durableproxy.client;

import io.durableproxy.server.DurableProxyHandler;
import io.durableproxy.server.storage.InMemoryStreamStorage;
import io.durableproxy.server.upstream.UpstreamAllowlist;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurableFetchTest {

    private static final URI PROXY = URI.create("http://proxy.local/v1/proxy/");

    private MockWebServer upstream;
    private DurableSessionTest.MutableClock clock;
    private DurableProxyHandler handler;
    private HandlerTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new MockWebServer();
        upstream.start();
        clock = new DurableSessionTest.MutableClock(Instant.now());
        handler = DurableProxyHandler.builder(new InMemoryStreamStorage(Duration.ofMillis(100)), "fetch-secret")
                .allowlist(UpstreamAllowlist.of("http://" + upstream.getHostName() + ":*"))
                .clock(clock)
                .build();
        transport = new HandlerTransport(handler);
    }

    @AfterEach
    void tearDown() throws Exception {
        handler.close();
        upstream.shutdown();
    }

    @Test
    void freshFetchStreamsTheUpstreamResponse() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(201)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true}"));

        DurableResponse r = fetcher(new InMemoryRequestIdStore()).fetch(upstream.url("/v1/items").toString(),
                FetchOptions.builder().body("{}").build());

        assertThat(r.wasResumed()).isFalse();
        assertThat(r.streamId()).isNotBlank();
        assertThat(r.streamUrl().getQuery()).contains("signature=");
        assertThat(r.response().responseId()).isEqualTo(1);
        assertThat(r.response().status()).isEqualTo(201);
        assertThat(r.response().header("Content-Type")).contains("application/json");
        assertThat(r.response().bodyAsString()).isEqualTo("{\"ok\":true}");
        assertThat(r.response().completion().get(5, TimeUnit.SECONDS)).isEqualTo(TerminalState.COMPLETE);
    }

    @Test
    void repeatedRequestIdReplaysInsteadOfCallingUpstream() throws Exception {
        upstream.enqueue(new MockResponse().setBody("generated once"));
        DurableFetch fetch = fetcher(new InMemoryRequestIdStore());
        FetchOptions options = FetchOptions.builder().requestId("req-1").body("prompt").build();

        DurableResponse first = fetch.fetch(upstream.url("/gen").toString(), options);
        assertThat(first.response().bodyAsString()).isEqualTo("generated once");
        DurableResponse second = fetch.fetch(upstream.url("/gen").toString(), options);

        assertThat(second.wasResumed()).isTrue();
        assertThat(second.streamUrl()).isEqualTo(first.streamUrl());
        assertThat(second.streamId()).isEqualTo(first.streamId());
        assertThat(second.response().bodyAsString()).isEqualTo("generated once");
        assertThat(upstream.getRequestCount()).isEqualTo(1);
    }

    @Test
    void expiredStoredMappingIsRenewedInsteadOfCallingUpstream() throws Exception {
        upstream.enqueue(new MockResponse().setBody("generated once"));
        RequestIdStore store = new InMemoryRequestIdStore();
        DurableFetch fetch = fetcherBuilder(store).signedUrlTtl(Duration.ofSeconds(60)).build();
        FetchOptions options = FetchOptions.builder().requestId("req-3").build();
        String key = RequestIdStore.key(ProxyRequests.DEFAULT_KEY_PREFIX, "http://proxy.local/v1/proxy", null, "req-3");

        DurableResponse first = fetch.fetch(upstream.url("/gen").toString(), options);
        assertThat(first.response().completion().get(5, TimeUnit.SECONDS)).isEqualTo(TerminalState.COMPLETE);
        clock.advance(Duration.ofSeconds(120));
        DurableResponse second = fetch.fetch(upstream.url("/gen").toString(), options);

        assertThat(second.wasResumed()).isTrue();
        assertThat(second.response().bodyAsString()).isEqualTo("generated once");
        assertThat(upstream.getRequestCount()).isEqualTo(1);
        assertThat(store.load(key)).hasValueSatisfying(m -> {
            assertThat(m.streamUrl()).isNotEqualTo(first.streamUrl().toString());
            assertThat(m.streamUrl()).contains("/" + first.streamId() + "?");
            assertThat(m.responseId()).isEqualTo(1);
        });
    }

    @Test
    void refusedRenewalFallsBackToFreshRequest() throws Exception {
        upstream.enqueue(new MockResponse().setBody("generated once"));
        upstream.enqueue(new MockResponse().setResponseCode(403));
        upstream.enqueue(new MockResponse().setBody("generated twice"));
        DurableFetch fetch = fetcherBuilder(new InMemoryRequestIdStore())
                .signedUrlTtl(Duration.ofSeconds(60))
                .renewUrl(upstream.url("/renew").toString())
                .build();
        FetchOptions options = FetchOptions.builder().requestId("req-4").header("Authorization", "Bearer user").build();

        DurableResponse first = fetch.fetch(upstream.url("/gen").toString(), options);
        assertThat(first.response().completion().get(5, TimeUnit.SECONDS)).isEqualTo(TerminalState.COMPLETE);
        clock.advance(Duration.ofSeconds(120));
        DurableResponse second = fetch.fetch(upstream.url("/gen").toString(), options);

        assertThat(second.wasResumed()).isFalse();
        assertThat(second.response().bodyAsString()).isEqualTo("generated twice");
        upstream.takeRequest(5, TimeUnit.SECONDS);
        RecordedRequest renew = upstream.takeRequest(5, TimeUnit.SECONDS);
        assertThat(renew.getPath()).isEqualTo("/renew");
        assertThat(renew.getHeader("Stream-Id")).isEqualTo(first.streamId());
        assertThat(renew.getHeader("Authorization")).isEqualTo("Bearer user");
    }

    @Test
    void unreadableStoredMappingFallsBackToFreshRequest() throws Exception {
        upstream.enqueue(new MockResponse().setBody("second try"));
        RequestIdStore store = new InMemoryRequestIdStore();
        String key = RequestIdStore.key(ProxyRequests.DEFAULT_KEY_PREFIX, "http://proxy.local/v1/proxy", null, "req-2");
        store.save(key, new RequestMapping("http://proxy.local/v1/proxy/gone?expires=9999999999&signature=bogus", 1));

        DurableResponse r = fetcher(store).fetch(upstream.url("/gen").toString(),
                FetchOptions.builder().requestId("req-2").build());

        assertThat(r.wasResumed()).isFalse();
        assertThat(r.response().bodyAsString()).isEqualTo("second try");
        assertThat(store.load(key)).hasValueSatisfying(m -> {
            assertThat(m.streamUrl()).isEqualTo(r.streamUrl().toString());
            assertThat(m.responseId()).isEqualTo(1);
        });
    }

    @Test
    void upstreamFailureIsReportedAsBadGateway() {
        upstream.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> fetcher(new InMemoryRequestIdStore()).fetch(upstream.url("/gen").toString(), null))
                .isInstanceOfSatisfying(ProxyRequestException.class, e -> assertThat(e.status()).isEqualTo(502));
    }

    @Test
    void disallowedUpstreamIsRejected() {
        assertThatThrownBy(() -> fetcher(new InMemoryRequestIdStore()).fetch("http://elsewhere.invalid/x", null))
                .isInstanceOfSatisfying(ProxyRequestException.class, e -> {
                    assertThat(e.status()).isEqualTo(403);
                    assertThat(e.code()).isEqualTo("UPSTREAM_NOT_ALLOWED");
                });
        assertThat(upstream.getRequestCount()).isZero();
    }

    @Test
    void abortEndsAnInFlightResponse() throws Exception {
        upstream.enqueue(new MockResponse().setBody("a long long answer").throttleBody(1, 100, TimeUnit.MILLISECONDS));
        DurableFetch fetch = fetcher(new InMemoryRequestIdStore());

        DurableResponse r = fetch.fetch(upstream.url("/slow").toString(), null);
        fetch.abort(r.streamUrl(), r.response().responseId());

        assertThatThrownBy(() -> r.response().completion().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ResponseAbortedException.class);
    }

    private DurableFetch fetcher(RequestIdStore store) {
        return fetcherBuilder(store).build();
    }

    private DurableFetch.Builder fetcherBuilder(RequestIdStore store) {
        return DurableFetch.builder(PROXY)
                .transport(transport)
                .requestIdStore(store)
                .pollDelay(Duration.ofMillis(10))
                .startTimeout(Duration.ofSeconds(5));
    }
}
