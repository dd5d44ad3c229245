package io.durableproxy.client;

import io.durableproxy.core.ControlJson;
import io.durableproxy.core.DurableProxyException;
import io.durableproxy.core.Protocol;
import io.durableproxy.core.ReadMode;
import io.durableproxy.core.SseParser;
import io.durableproxy.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Background read loop that tails a proxy stream into a {@link FrameDemuxer}.
 *
 * <p>Expired capability URLs are renewed through {@link StreamUrlSource#renew()} and the read
 * resumes at the same offset. Transient storage failures are retried with backoff; anything else
 * fails the demuxer and stops the loop.
 *
 * <p>This class is not intended to be used directly by clients.
 */
final class StreamReader implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(StreamReader.class);

    static final Duration DEFAULT_POLL_DELAY = Duration.ofMillis(75);
    static final int DEFAULT_MAX_RETRIES = 3;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(100);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(90);

    /**
     * Supplies the capability URL to read from and renews it on expiry.
     */
    interface StreamUrlSource {
        URI current();

        URI renew() throws Exception;
    }

    private final DurableProxyTransport transport;
    private final StreamUrlSource urls;
    private final FrameDemuxer demuxer;
    private final ReadMode mode;
    private final Duration pollDelay;
    private final int maxRetries;

    private volatile boolean stopped;
    private volatile Thread thread;
    private volatile InputStream liveBody;
    private String offset = Protocol.OFFSET_BEGINNING;
    private String cursor;

    StreamReader(DurableProxyTransport transport, StreamUrlSource urls, FrameDemuxer demuxer,
                 ReadMode mode, Duration pollDelay, int maxRetries) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.urls = Objects.requireNonNull(urls, "urls");
        this.demuxer = Objects.requireNonNull(demuxer, "demuxer");
        if (mode == ReadMode.CATCH_UP) throw new IllegalArgumentException("reader needs a live mode");
        this.mode = mode;
        this.pollDelay = pollDelay;
        this.maxRetries = maxRetries;
    }

    Thread start(String name) {
        Thread t = new Thread(this, name);
        t.setDaemon(true);
        thread = t;
        t.start();
        return t;
    }

    boolean isRunning() {
        Thread t = thread;
        return t != null && t.isAlive() && !stopped;
    }

    /** Stops the loop, interrupting a long poll in flight. */
    void stop() {
        stopped = true;
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) t.interrupt();
        InputStream body = liveBody;
        if (body != null) {
            try {
                body.close();
            } catch (IOException e) {
                LOG.debug("Closing SSE body failed", e);
            }
        }
    }

    @Override
    public void run() {
        int failures = 0;
        while (!stopped && !demuxer.isClosed()) {
            try {
                boolean upToDate = mode == ReadMode.SSE ? readSse() : readLongPoll();
                failures = 0;
                if (upToDate && !pollDelay.isZero()) Thread.sleep(pollDelay.toMillis());
            } catch (InterruptedException e) {
                if (stopped) return;
                Thread.currentThread().interrupt();
                demuxer.error(e);
                return;
            } catch (ProxyRequestException e) {
                if (e.renewable()) {
                    LOG.debug("Stream URL expired for {}; renewing", e.streamId());
                    if (!renew()) return;
                    continue;
                }
                if (e.isTransient() && failures < maxRetries) {
                    failures++;
                    LOG.debug("Transient read failure ({}), retry {}/{}", e.getMessage(), failures, maxRetries);
                    if (!backoff(failures)) return;
                    continue;
                }
                fail(e);
                return;
            } catch (DurableProxyException e) {
                // push() already failed the demuxer
                LOG.debug("Frame stream broken: {}", e.getMessage());
                return;
            } catch (Exception e) {
                if (stopped) return;
                if (failures < maxRetries) {
                    failures++;
                    LOG.debug("Read failed ({}), retry {}/{}", e.toString(), failures, maxRetries);
                    if (!backoff(failures)) return;
                    continue;
                }
                fail(e);
                return;
            }
        }
    }

    private boolean readLongPoll() throws Exception {
        URI url = Urls.withQuery(urls.current(), query(Protocol.LIVE_LONG_POLL));
        TransportResponse<byte[]> resp = transport.sendBytes(TransportRequest.read(url, READ_TIMEOUT));
        if (resp.status() != 200 && resp.status() != 204) {
            throw ProxyRequestException.fromResponse("read", resp);
        }
        byte[] body = resp.body();
        if (resp.status() == 200 && body != null && body.length > 0 && !stopped) {
            demuxer.push(body);
        }
        resp.header(Protocol.H_STREAM_NEXT_OFFSET).ifPresent(v -> offset = v);
        resp.header(Protocol.H_STREAM_CURSOR).ifPresent(v -> cursor = v);
        return resp.flag(Protocol.H_STREAM_UP_TO_DATE);
    }

    private boolean readSse() throws Exception {
        URI url = Urls.withQuery(urls.current(), query(Protocol.LIVE_SSE));
        TransportResponse<InputStream> resp = transport.sendStream(TransportRequest.read(url, null));
        if (resp.status() != 200) {
            byte[] body;
            try (InputStream in = resp.body()) {
                body = in == null ? new byte[0] : in.readAllBytes();
            }
            throw ProxyRequestException.fromResponse("read", resp.withBody(body));
        }
        boolean upToDate = false;
        liveBody = resp.body();
        try (SseParser parser = new SseParser(resp.body())) {
            SseParser.Event event;
            while (!stopped && (event = parser.next()) != null) {
                if (Protocol.SSE_EVENT_DATA.equals(event.name())) {
                    if (!event.data().isEmpty()) demuxer.push(Base64.getDecoder().decode(event.data()));
                } else if (Protocol.SSE_EVENT_CONTROL.equals(event.name())) {
                    ControlJson.Control control = ControlJson.parse(event.data());
                    offset = control.streamNextOffset();
                    if (control.streamCursor() != null) cursor = control.streamCursor();
                    upToDate = control.upToDate();
                }
            }
        } finally {
            liveBody = null;
        }
        return upToDate;
    }

    private Map<String, String> query(String live) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_OFFSET, offset);
        q.put(Protocol.Q_LIVE, live);
        if (cursor != null) q.put(Protocol.Q_CURSOR, cursor);
        return q;
    }

    private boolean renew() {
        try {
            urls.renew();
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    private boolean backoff(int attempt) {
        try {
            Thread.sleep(RETRY_BACKOFF.toMillis() << (attempt - 1));
            return true;
        } catch (InterruptedException e) {
            if (!stopped) demuxer.error(e);
            return false;
        }
    }

    private void fail(Exception e) {
        if (stopped) return;
        LOG.debug("Read loop stopping: {}", e.toString());
        demuxer.error(e);
    }
}
