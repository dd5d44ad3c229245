package io.durableproxy.client;

import io.durableproxy.server.DurableProxyHandler;
import io.durableproxy.server.HttpMethod;
import io.durableproxy.server.ResponseBody;
import io.durableproxy.server.ServerRequest;
import io.durableproxy.server.ServerResponse;
import io.durableproxy.server.SseFrame;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls a {@link DurableProxyHandler} in-process, the way an HTTP adapter would.
 */
final class HandlerTransport implements DurableProxyTransport {

    private final DurableProxyHandler handler;
    private final AtomicInteger requests = new AtomicInteger();

    HandlerTransport(DurableProxyHandler handler) {
        this.handler = handler;
    }

    int requestCount() {
        return requests.get();
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        ServerResponse resp = call(request);
        byte[] body = resp.body() instanceof ResponseBody.Bytes b ? b.bytes() : new byte[0];
        return new TransportResponse<>(resp.status(), resp.headers(), body);
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        ServerResponse resp = call(request);
        if (resp.body() instanceof ResponseBody.Sse sse) {
            return new TransportResponse<>(resp.status(), resp.headers(), pipe(sse.publisher()));
        }
        byte[] body = resp.body() instanceof ResponseBody.Bytes b ? b.bytes() : new byte[0];
        return new TransportResponse<>(resp.status(), resp.headers(), new ByteArrayInputStream(body));
    }

    private ServerResponse call(TransportRequest request) throws InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException();
        requests.incrementAndGet();
        Map<String, List<String>> headers = new LinkedHashMap<>();
        request.headers().forEach((name, values) -> {
            List<String> list = new ArrayList<>();
            values.forEach(list::add);
            headers.put(name, list);
        });
        InputStream body = request.body() == null ? null : new ByteArrayInputStream(request.body());
        HttpMethod method = HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT));
        ServerResponse resp = handler.handle(new ServerRequest(method, request.url(), headers, body));
        if (Thread.interrupted()) throw new InterruptedException();
        return resp;
    }

    private static InputStream pipe(Flow.Publisher<SseFrame> publisher) throws IOException {
        PipedInputStream in = new PipedInputStream(64 * 1024);
        PipedOutputStream out = new PipedOutputStream(in);
        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription s) {
                subscription = s;
                s.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    subscription.cancel();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                closeQuietly(out);
            }

            @Override
            public void onComplete() {
                closeQuietly(out);
            }
        });
        return in;
    }

    private static void closeQuietly(PipedOutputStream out) {
        try {
            out.close();
        } catch (IOException ignored) {
            // reader went away
        }
    }
}
