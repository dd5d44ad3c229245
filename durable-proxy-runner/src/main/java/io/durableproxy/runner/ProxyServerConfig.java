package io.durableproxy.runner;

import io.durableproxy.server.DurableProxyHandler;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the standalone proxy server.
 *
 * @param storageUrl base URL of a remote Durable Streams server, or {@code null} for in-memory storage
 */
public record ProxyServerConfig(
        String host,
        int port,
        URI publicOrigin,
        String secret,
        String serviceSecret,
        List<String> allowlist,
        Duration urlTtl,
        Duration streamTtl,
        Duration idleTimeout,
        Duration sseMaxDuration,
        long maxResponseBytes,
        Duration upstreamConnectTimeout,
        Duration upstreamResponseTimeout,
        URI storageUrl,
        String storageToken,
        Duration longPollTimeout) {

    public ProxyServerConfig {
        allowlist = List.copyOf(allowlist);
    }

    public boolean inMemoryStorage() {
        return storageUrl == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ProxyServerConfig}. Everything but {@code secret} has a default.
     */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 4440;
        private URI publicOrigin;
        private String secret;
        private String serviceSecret;
        private final List<String> allowlist = new ArrayList<>();
        private Duration urlTtl = DurableProxyHandler.DEFAULT_URL_TTL;
        private Duration streamTtl = DurableProxyHandler.DEFAULT_STREAM_TTL;
        private Duration idleTimeout = DurableProxyHandler.DEFAULT_IDLE_TIMEOUT;
        private Duration sseMaxDuration = DurableProxyHandler.DEFAULT_SSE_MAX_DURATION;
        private long maxResponseBytes = DurableProxyHandler.DEFAULT_MAX_RESPONSE_BYTES;
        private Duration upstreamConnectTimeout = Duration.ofSeconds(10);
        private Duration upstreamResponseTimeout = Duration.ofSeconds(60);
        private URI storageUrl;
        private String storageToken;
        private Duration longPollTimeout = Duration.ofSeconds(25);

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new ConfigLoadException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder publicOrigin(URI publicOrigin) {
            this.publicOrigin = publicOrigin;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder serviceSecret(String serviceSecret) {
            this.serviceSecret = serviceSecret;
            return this;
        }

        /** Replaces the allowlist. */
        public Builder allowlist(List<String> patterns) {
            allowlist.clear();
            allowlist.addAll(patterns);
            return this;
        }

        public Builder urlTtl(Duration urlTtl) {
            this.urlTtl = urlTtl;
            return this;
        }

        public Builder streamTtl(Duration streamTtl) {
            this.streamTtl = streamTtl;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder sseMaxDuration(Duration sseMaxDuration) {
            this.sseMaxDuration = sseMaxDuration;
            return this;
        }

        public Builder maxResponseBytes(long maxResponseBytes) {
            this.maxResponseBytes = maxResponseBytes;
            return this;
        }

        public Builder upstreamConnectTimeout(Duration upstreamConnectTimeout) {
            this.upstreamConnectTimeout = upstreamConnectTimeout;
            return this;
        }

        public Builder upstreamResponseTimeout(Duration upstreamResponseTimeout) {
            this.upstreamResponseTimeout = upstreamResponseTimeout;
            return this;
        }

        public Builder storageUrl(URI storageUrl) {
            this.storageUrl = storageUrl;
            return this;
        }

        public Builder storageToken(String storageToken) {
            this.storageToken = storageToken;
            return this;
        }

        public Builder longPollTimeout(Duration longPollTimeout) {
            this.longPollTimeout = longPollTimeout;
            return this;
        }

        public ProxyServerConfig build() {
            if (secret == null || secret.isBlank()) {
                throw new ConfigLoadException("Missing required key proxy.secret (or DURABLE_PROXY_SECRET)");
            }
            return new ProxyServerConfig(host, port, publicOrigin, secret, serviceSecret, allowlist, urlTtl, streamTtl,
                    idleTimeout, sseMaxDuration, maxResponseBytes, upstreamConnectTimeout, upstreamResponseTimeout,
                    storageUrl, storageToken, longPollTimeout);
        }
    }
}
