package io.durableproxy.runner;

import io.durableproxy.server.DurableProxyHandler;
import io.durableproxy.server.HttpMethod;
import io.durableproxy.server.ResponseBody;
import io.durableproxy.server.ServerRequest;
import io.durableproxy.server.ServerResponse;
import io.durableproxy.server.SseFrame;
import io.durableproxy.server.storage.HttpStreamStorage;
import io.durableproxy.server.storage.InMemoryStreamStorage;
import io.durableproxy.server.storage.StreamStorage;
import io.durableproxy.server.upstream.UpstreamForwarder;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

/**
 * Standalone durable proxy: a {@link DurableProxyHandler} served by Javalin.
 */
public final class ProxyServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyServer.class);
    private static final long SSE_GRACE_SECONDS = 15;

    private final ProxyServerConfig config;
    private final DurableProxyHandler handler;
    private Javalin app;

    public ProxyServer(ProxyServerConfig config) {
        this.config = config;
        this.handler = DurableProxyHandler.builder(storage(config), config.secret())
                .serviceSecret(config.serviceSecret())
                .allowlist(config.allowlist())
                .forwarder(new UpstreamForwarder(config.upstreamConnectTimeout(), config.upstreamResponseTimeout()))
                .urlTtl(config.urlTtl())
                .streamTtl(config.streamTtl())
                .idleTimeout(config.idleTimeout())
                .sseMaxDuration(config.sseMaxDuration())
                .maxResponseBytes(config.maxResponseBytes())
                .publicOrigin(config.publicOrigin())
                .build();
    }

    public static void main(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ProxyServerConfig config = configPath.toFile().exists()
                ? ConfigLoader.load(configPath)
                : ConfigLoader.fromEnvironment(System::getenv);
        ProxyServer server = new ProxyServer(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "durable-proxy-shutdown"));
        server.start();
    }

    /** Starts listening and returns the bound port. */
    public synchronized int start() {
        if (app != null) throw new IllegalStateException("already started");
        app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        app.get("/*", this::handle);
        app.head("/*", this::handle);
        app.post("/*", this::handle);
        app.patch("/*", this::handle);
        app.delete("/*", this::handle);
        app.options("/*", this::handle);
        app.start(config.host(), config.port());
        LOG.info("Durable proxy listening on http://{}:{} (storage: {}, {} allowlist pattern(s))",
                config.host(), app.port(), config.inMemoryStorage() ? "memory" : config.storageUrl(),
                config.allowlist().size());
        return app.port();
    }

    @Override
    public synchronized void close() {
        if (app != null) {
            app.stop();
            app = null;
        }
        handler.close();
    }

    private void handle(Context ctx) throws IOException {
        ServerRequest request = new ServerRequest(
                HttpMethod.valueOf(ctx.method().name()),
                URI.create(ctx.fullUrl()),
                toHeaders(ctx),
                bodyOrNull(ctx));

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.res().addHeader(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        } else if (response.body() instanceof ResponseBody.Sse sse) {
            writeSse(ctx, sse.publisher());
        }
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = ctx.req().getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            List<String> values = new ArrayList<>();
            Enumeration<String> v = ctx.req().getHeaders(name);
            while (v.hasMoreElements()) values.add(v.nextElement());
            headers.put(name, values);
        }
        return headers;
    }

    private static InputStream bodyOrNull(Context ctx) {
        boolean chunked = ctx.header("Transfer-Encoding") != null;
        if (ctx.req().getContentLengthLong() <= 0 && !chunked) return null;
        return ctx.bodyInputStream();
    }

    private void writeSse(Context ctx, Flow.Publisher<SseFrame> publisher) throws IOException {
        OutputStream out = ctx.res().getOutputStream();
        CountDownLatch done = new CountDownLatch(1);

        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    LOG.debug("SSE client went away: {}", e.getMessage());
                    subscription.cancel();
                    done.countDown();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                LOG.warn("SSE stream failed", throwable);
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });

        try {
            done.await(config.sseMaxDuration().getSeconds() + SSE_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static StreamStorage storage(ProxyServerConfig config) {
        if (config.inMemoryStorage()) {
            LOG.warn("Using in-memory storage; streams are lost on restart");
            return new InMemoryStreamStorage(config.longPollTimeout());
        }
        return HttpStreamStorage.builder(config.storageUrl())
                .bearerToken(config.storageToken())
                .longPollTimeout(config.longPollTimeout().plusSeconds(5))
                .build();
    }
}
