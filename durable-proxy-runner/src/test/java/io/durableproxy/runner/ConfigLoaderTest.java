package io.durableproxy.runner;

import io.durableproxy.server.DurableProxyHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @TempDir
    Path dir;

    @Test
    void fullConfigMapsEveryKey() throws Exception {
        ProxyServerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

        assertThat(config.host()).isEqualTo("127.0.0.1");
        assertThat(config.port()).isEqualTo(8081);
        assertThat(config.publicOrigin()).isEqualTo(URI.create("https://proxy.example.com"));
        assertThat(config.secret()).isEqualTo("s3cret");
        assertThat(config.serviceSecret()).isEqualTo("svc");
        assertThat(config.allowlist()).containsExactly("https://api.example.com/*", "http://localhost:*");
        assertThat(config.urlTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(config.streamTtl()).isEqualTo(Duration.ofHours(2));
        assertThat(config.idleTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(config.sseMaxDuration()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.maxResponseBytes()).isEqualTo(2048);
        assertThat(config.upstreamConnectTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.upstreamResponseTimeout()).isEqualTo(Duration.ofSeconds(4));
        assertThat(config.storageUrl()).isEqualTo(URI.create("http://streams.internal:4437"));
        assertThat(config.storageToken()).isEqualTo("storage-token");
        assertThat(config.longPollTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.inMemoryStorage()).isFalse();
    }

    @Test
    void minimalConfigGetsDefaults() throws Exception {
        ProxyServerConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), NO_ENV::get);

        assertThat(config.secret()).isEqualTo("only-this");
        assertThat(config.port()).isEqualTo(4440);
        assertThat(config.serviceSecret()).isNull();
        assertThat(config.allowlist()).isEmpty();
        assertThat(config.urlTtl()).isEqualTo(DurableProxyHandler.DEFAULT_URL_TTL);
        assertThat(config.maxResponseBytes()).isEqualTo(DurableProxyHandler.DEFAULT_MAX_RESPONSE_BYTES);
        assertThat(config.inMemoryStorage()).isTrue();
    }

    @Test
    void environmentOverridesYaml() throws Exception {
        Map<String, String> env = Map.of(
                "DURABLE_PROXY_PORT", "9999",
                "DURABLE_PROXY_SECRET", "from-env",
                "DURABLE_PROXY_ALLOWLIST", " https://a.example/* , https://b.example/*,",
                "DURABLE_PROXY_STORAGE_URL", "memory",
                "DURABLE_PROXY_IDLE_TIMEOUT_MS", "250",
                "DURABLE_PROXY_SERVICE_SECRET", "   ");

        ProxyServerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

        assertThat(config.port()).isEqualTo(9999);
        assertThat(config.secret()).isEqualTo("from-env");
        assertThat(config.allowlist()).containsExactly("https://a.example/*", "https://b.example/*");
        assertThat(config.inMemoryStorage()).isTrue();
        assertThat(config.idleTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.serviceSecret()).isEqualTo("svc");
    }

    @Test
    void missingSecretIsRejected() throws Exception {
        assertThatThrownBy(() -> ConfigLoader.load(fixture("config/no-secret.yaml"), NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("proxy.secret");
    }

    @Test
    void secretFromEnvironmentAloneIsEnough() {
        ProxyServerConfig config = ConfigLoader.fromEnvironment(Map.of("DURABLE_PROXY_SECRET", "x")::get);

        assertThat(config.secret()).isEqualTo("x");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(dir.resolve("nope.yaml"), NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void invalidYamlIsRejected() throws Exception {
        Path file = dir.resolve("bad.yaml");
        Files.write(file, "proxy: [unclosed".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    void nonNumericEnvironmentValueIsRejected() throws Exception {
        Map<String, String> env = Map.of("DURABLE_PROXY_MAX_RESPONSE_BYTES", "lots");

        assertThatThrownBy(() -> ConfigLoader.load(fixture("config/minimal-config.yaml"), env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("DURABLE_PROXY_MAX_RESPONSE_BYTES");
    }

    @Test
    void relativeStorageUrlIsRejected() {
        Map<String, String> env = Map.of("DURABLE_PROXY_SECRET", "x", "DURABLE_PROXY_STORAGE_URL", "streams/v1");

        assertThatThrownBy(() -> ConfigLoader.fromEnvironment(env::get))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("storage.url");
    }

    @Test
    void configFlagSelectsPath() {
        assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/proxy.yaml"}))
                .isEqualTo(Path.of("/etc/proxy.yaml"));
        assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("durable-proxy.yaml"));
        assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
