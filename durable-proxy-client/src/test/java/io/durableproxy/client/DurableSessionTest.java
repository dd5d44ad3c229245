package io.durableproxy.client;

import io.durableproxy.core.ReadMode;
import io.durableproxy.server.DurableProxyHandler;
import io.durableproxy.server.storage.InMemoryStreamStorage;
import io.durableproxy.server.upstream.UpstreamAllowlist;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurableSessionTest {

    private static final URI PROXY = URI.create("http://proxy.local/v1/proxy");

    private MockWebServer upstream;
    private MutableClock clock;
    private InMemoryStreamStorage storage;
    private DurableProxyHandler handler;
    private HandlerTransport transport;
    private DurableSession session;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new MockWebServer();
        upstream.start();
        clock = new MutableClock(Instant.now());
        storage = new InMemoryStreamStorage(Duration.ofMillis(100));
        handler = DurableProxyHandler.builder(storage, "session-secret")
                .allowlist(UpstreamAllowlist.of("http://" + upstream.getHostName() + ":*"))
                .serviceSecret("svc")
                .clock(clock)
                .build();
        transport = new HandlerTransport(handler);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (session != null) session.close();
        handler.close();
        upstream.shutdown();
    }

    @Test
    void connectBindsSessionToItsStream() throws Exception {
        session = sessionBuilder("chat-1").build();

        session.connect();

        assertThat(session.streamId()).contains("chat-1");
        assertThat(session.streamUrl()).hasValueSatisfying(u ->
                assertThat(u.toString()).startsWith("http://proxy.local/v1/proxy/chat-1?expires="));
    }

    @Test
    void fetchesOnOneSessionGetIncreasingResponseIds() throws Exception {
        for (int i = 0; i < 3; i++) {
            upstream.enqueue(new MockResponse().setBody("reply-" + i));
        }
        session = sessionBuilder("chat-2").build();

        List<CompletableFuture<ProxyResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(session.fetch(upstream.url("/v1/chat").toString(),
                    FetchOptions.builder().body("{\"n\":" + i + "}").build()));
        }

        for (int i = 0; i < 3; i++) {
            ProxyResponse r = futures.get(i).get(5, TimeUnit.SECONDS);
            assertThat(r.responseId()).isEqualTo(i + 1);
            assertThat(r.bodyAsString()).isEqualTo("reply-" + i);
        }
    }

    @Test
    void concurrentFetchesGetDistinctIncreasingResponseIds() throws Exception {
        upstream.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setBody("echo:" + request.getBody().readUtf8());
            }
        });
        session = sessionBuilder("chat-12").build();
        session.connect();
        int callers = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<ProxyResponse>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String body = "call-" + i;
                futures.add(pool.submit(() -> {
                    go.await();
                    return session.fetch(upstream.url("/echo").toString(),
                            FetchOptions.builder().body(body).build()).get(10, TimeUnit.SECONDS);
                }));
            }
            go.countDown();

            List<ProxyResponse> responses = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                ProxyResponse r = futures.get(i).get(15, TimeUnit.SECONDS);
                assertThat(r.bodyAsString()).isEqualTo("echo:call-" + i);
                responses.add(r);
            }
            assertThat(responses).extracting(ProxyResponse::responseId)
                    .containsExactlyInAnyOrderElementsOf(LongStream.rangeClosed(1, callers).boxed()
                            .collect(Collectors.toList()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentConnectsShareOneConnectCall() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(204).setHeadersDelay(500, TimeUnit.MILLISECONDS));
        session = sessionBuilder("chat-13").connectUrl(upstream.url("/connect").toString()).build();
        int callers = 6;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<URI>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<URI> connect = () -> {
                    go.await();
                    session.connect();
                    return session.streamUrl().orElseThrow();
                };
                futures.add(pool.submit(connect));
            }
            go.countDown();

            for (Future<URI> f : futures) {
                assertThat(f.get(10, TimeUnit.SECONDS).toString()).contains("/chat-13?expires=");
            }
            assertThat(upstream.getRequestCount()).isEqualTo(1);
            assertThat(upstream.takeRequest().getPath()).isEqualTo("/connect");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void authorizationIsForwardedAsUpstreamAuthorization() throws Exception {
        upstream.enqueue(new MockResponse().setBody("ok"));
        session = sessionBuilder("chat-3").build();

        ProxyResponse r = session.fetch(upstream.url("/v1/chat").toString(), FetchOptions.builder()
                .method("put")
                .header("Authorization", "Bearer sk-upstream")
                .header("Content-Type", "application/json")
                .body("{}")
                .build()).get(5, TimeUnit.SECONDS);

        assertThat(r.bodyAsString()).isEqualTo("ok");
        RecordedRequest recorded = upstream.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("PUT");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-upstream");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{}");
    }

    @Test
    void knownRequestIdResumesWithoutCallingUpstreamAgain() throws Exception {
        upstream.enqueue(new MockResponse().setBody("once"));
        RequestIdStore store = new InMemoryRequestIdStore();
        session = sessionBuilder("chat-4").requestIdStore(store).build();
        FetchOptions options = FetchOptions.builder().requestId("msg-1").build();

        ProxyResponse first = session.fetch(upstream.url("/v1/chat").toString(), options).get(5, TimeUnit.SECONDS);
        assertThat(first.bodyAsString()).isEqualTo("once");
        ProxyResponse again = session.fetch(upstream.url("/v1/chat").toString(), options).get(5, TimeUnit.SECONDS);

        assertThat(again.responseId()).isEqualTo(first.responseId());
        assertThat(upstream.getRequestCount()).isEqualTo(1);
    }

    @Test
    void abortStopsOnlyTheTargetedResponse() throws Exception {
        upstream.enqueue(new MockResponse().setBody("slow-slow-slow").throttleBody(1, 100, TimeUnit.MILLISECONDS));
        upstream.enqueue(new MockResponse().setBody("fast"));
        session = sessionBuilder("chat-5").build();

        ProxyResponse slow = session.fetch(upstream.url("/slow").toString(), null).get(5, TimeUnit.SECONDS);
        ProxyResponse fast = session.fetch(upstream.url("/fast").toString(), null).get(5, TimeUnit.SECONDS);
        slow.abort();

        assertThatThrownBy(() -> slow.completion().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ResponseAbortedException.class);
        assertThat(fast.completion().get(5, TimeUnit.SECONDS)).isEqualTo(TerminalState.COMPLETE);
        assertThat(fast.bodyAsString()).isEqualTo("fast");
    }

    @Test
    void expiredStreamUrlIsRenewedAndReadingResumes() throws Exception {
        upstream.enqueue(new MockResponse().setBody("before"));
        upstream.enqueue(new MockResponse().setBody("after"));
        session = sessionBuilder("chat-6").signedUrlTtl(Duration.ofSeconds(60)).build();

        ProxyResponse first = session.fetch(upstream.url("/a").toString(), null).get(5, TimeUnit.SECONDS);
        assertThat(first.bodyAsString()).isEqualTo("before");
        URI original = session.streamUrl().orElseThrow();

        clock.advance(Duration.ofSeconds(120));
        ProxyResponse second = session.fetch(upstream.url("/b").toString(), null).get(5, TimeUnit.SECONDS);

        assertThat(second.bodyAsString()).isEqualTo("after");
        assertThat(second.responseId()).isEqualTo(2);
        assertThat(session.streamUrl()).isPresent().get().isNotEqualTo(original);
    }

    @Test
    void expiredStreamUrlIsRenewedWithoutReconnecting() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(204));
        session = sessionBuilder("chat-14")
                .connectUrl(upstream.url("/connect").toString())
                .signedUrlTtl(Duration.ofSeconds(60))
                .build();
        session.connect();
        URI original = session.streamUrl().orElseThrow();

        clock.advance(Duration.ofSeconds(120));
        URI renewed = session.renewStreamUrl();

        assertThat(renewed).isNotEqualTo(original);
        assertThat(session.streamUrl()).contains(renewed);
        assertThat(upstream.getRequestCount()).isEqualTo(1);
        TransportResponse<byte[]> read = transport.sendBytes(
                TransportRequest.read(URI.create(renewed + "&offset=-1"), Duration.ofSeconds(5)));
        assertThat(read.status()).isEqualTo(200);
    }

    @Test
    void renewalFallsBackToConnectWhenStreamIsGone() throws Exception {
        session = sessionBuilder("chat-15").build();
        session.connect();
        storage.delete("chat-15");

        URI renewed = session.renewStreamUrl();

        assertThat(renewed.toString()).contains("/chat-15?expires=");
        assertThat(storage.exists("chat-15")).isTrue();
    }

    @Test
    void rejectedRenewalDoesNotReconnect() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(403));
        session = sessionBuilder("chat-16").renewUrl(upstream.url("/renew").toString()).build();
        session.connect();
        URI original = session.streamUrl().orElseThrow();

        assertThatThrownBy(session::renewStreamUrl)
                .isInstanceOfSatisfying(ProxyRequestException.class, e -> {
                    assertThat(e.status()).isEqualTo(401);
                    assertThat(e.code()).isEqualTo("RENEWAL_REJECTED");
                });
        assertThat(session.streamUrl()).contains(original);
        assertThat(upstream.takeRequest(5, TimeUnit.SECONDS).getHeader("Stream-Id")).isEqualTo("chat-16");
    }

    @Test
    void rejectedConnectSurfacesProxyError() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(403));
        session = sessionBuilder("chat-7").connectUrl(upstream.url("/connect").toString()).build();

        assertThatThrownBy(session::connect)
                .isInstanceOfSatisfying(ProxyRequestException.class, e -> {
                    assertThat(e.status()).isEqualTo(401);
                    assertThat(e.code()).isEqualTo("CONNECT_REJECTED");
                    assertThat(e.streamId()).isEqualTo("chat-7");
                    assertThat(e.renewable()).isFalse();
                });
    }

    @Test
    void wrongServiceSecretIsNotRetried() {
        session = DurableSession.builder(PROXY, "chat-8").transport(transport).serviceSecret("nope").build();

        assertThatThrownBy(session::connect)
                .isInstanceOfSatisfying(ProxyRequestException.class,
                        e -> assertThat(e.code()).isEqualTo("INVALID_SECRET"));
        assertThat(transport.requestCount()).isEqualTo(1);
    }

    @Test
    void responsesIteratesStartsFromAnyWriter() throws Exception {
        upstream.enqueue(new MockResponse().setBody("one"));
        upstream.enqueue(new MockResponse().setBody("two"));
        session = sessionBuilder("chat-9").build();
        Iterator<ProxyResponse> responses = session.responses();

        session.fetch(upstream.url("/1").toString(), null);
        session.fetch(upstream.url("/2").toString(), null);

        assertThat(responses.next().responseId()).isEqualTo(1);
        assertThat(responses.next().responseId()).isEqualTo(2);
        session.close();
        assertThat(responses.hasNext()).isFalse();
    }

    @Test
    void sseReadModeDeliversResponses() throws Exception {
        upstream.enqueue(new MockResponse().setBody("via sse"));
        session = sessionBuilder("chat-10").readMode(ReadMode.SSE).build();

        ProxyResponse r = session.fetch(upstream.url("/sse").toString(), null).get(5, TimeUnit.SECONDS);

        assertThat(r.bodyAsString()).isEqualTo("via sse");
    }

    @Test
    void closeRejectsPendingWaiters() throws Exception {
        RequestIdStore store = new InMemoryRequestIdStore();
        store.save(RequestIdStore.key(ProxyRequests.DEFAULT_KEY_PREFIX, PROXY.toString(), "chat-11", "ghost"),
                new RequestMapping(null, 99));
        session = sessionBuilder("chat-11").requestIdStore(store).build();
        CompletableFuture<ProxyResponse> never = session.fetch(upstream.url("/x").toString(),
                FetchOptions.builder().requestId("ghost").build());
        assertThat(never).isNotDone();

        session.close();

        assertThat(never).failsWithin(Duration.ofSeconds(5));
        assertThat(upstream.getRequestCount()).isZero();
        assertThatThrownBy(() -> session.fetch(upstream.url("/x").toString(), null))
                .isInstanceOf(IllegalStateException.class);
    }

    private DurableSession.Builder sessionBuilder(String sessionId) {
        return DurableSession.builder(PROXY, sessionId)
                .transport(transport)
                .serviceSecret("svc")
                .pollDelay(Duration.ofMillis(10));
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
