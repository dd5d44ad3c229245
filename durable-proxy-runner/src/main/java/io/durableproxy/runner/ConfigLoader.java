package io.durableproxy.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads {@link ProxyServerConfig} from a YAML file, then overlays {@code DURABLE_PROXY_*}
 * environment variables.
 *
 * <p>An environment variable counts as set only when it is defined and not blank. Durations are
 * given in seconds for TTLs and in milliseconds for timeouts, as the key names say.
 *
 * <pre>
 * server:
 *   port: 4440
 *   public-origin: https://proxy.example.com
 * proxy:
 *   secret: change-me
 *   service-secret: also-change-me
 *   allowlist:
 *     - https://api.example.com/*
 *   url-ttl-seconds: 604800
 *   stream-ttl-seconds: 86400
 *   idle-timeout-ms: 300000
 *   sse-max-duration-ms: 55000
 *   max-response-bytes: 104857600
 * upstream:
 *   connect-timeout-ms: 10000
 *   response-timeout-ms: 60000
 * storage:
 *   url: memory
 *   token:
 *   long-poll-timeout-ms: 25000
 * </pre>
 */
public final class ConfigLoader {

    static final String ENV_PREFIX = "DURABLE_PROXY_";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "durable-proxy.yaml";
    private static final String MEMORY_STORAGE = "memory";

    private ConfigLoader() {
    }

    public static ProxyServerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file at {@code configPath}, with {@code envLookup} standing in for the process
     * environment.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or lacks a required key
     */
    public static ProxyServerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        return build(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
    }

    /**
     * Builds a configuration from the environment alone.
     */
    public static ProxyServerConfig fromEnvironment(Function<String, String> envLookup) {
        return build(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Resolves the config file from {@code --config <path>}, defaulting to
     * {@code durable-proxy.yaml} in the working directory.
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ProxyServerConfig build(JsonNode root, Function<String, String> envLookup) {
        ProxyServerConfig.Builder b = ProxyServerConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) b.host(server.get("host").asText());
        if (server.has("port")) b.port(server.get("port").asInt());
        if (hasText(server, "public-origin")) b.publicOrigin(uri("server.public-origin", server.get("public-origin").asText()));

        JsonNode proxy = root.path("proxy");
        if (proxy.has("secret")) b.secret(proxy.get("secret").asText());
        if (hasText(proxy, "service-secret")) b.serviceSecret(proxy.get("service-secret").asText());
        if (proxy.has("allowlist")) b.allowlist(patterns(proxy.get("allowlist")));
        if (proxy.has("url-ttl-seconds")) b.urlTtl(Duration.ofSeconds(proxy.get("url-ttl-seconds").asLong()));
        if (proxy.has("stream-ttl-seconds")) b.streamTtl(Duration.ofSeconds(proxy.get("stream-ttl-seconds").asLong()));
        if (proxy.has("idle-timeout-ms")) b.idleTimeout(Duration.ofMillis(proxy.get("idle-timeout-ms").asLong()));
        if (proxy.has("sse-max-duration-ms")) {
            b.sseMaxDuration(Duration.ofMillis(proxy.get("sse-max-duration-ms").asLong()));
        }
        if (proxy.has("max-response-bytes")) b.maxResponseBytes(proxy.get("max-response-bytes").asLong());

        JsonNode upstream = root.path("upstream");
        if (upstream.has("connect-timeout-ms")) {
            b.upstreamConnectTimeout(Duration.ofMillis(upstream.get("connect-timeout-ms").asLong()));
        }
        if (upstream.has("response-timeout-ms")) {
            b.upstreamResponseTimeout(Duration.ofMillis(upstream.get("response-timeout-ms").asLong()));
        }

        JsonNode storage = root.path("storage");
        if (hasText(storage, "url")) b.storageUrl(storageUrl(storage.get("url").asText()));
        if (hasText(storage, "token")) b.storageToken(storage.get("token").asText());
        if (storage.has("long-poll-timeout-ms")) {
            b.longPollTimeout(Duration.ofMillis(storage.get("long-poll-timeout-ms").asLong()));
        }

        applyEnvOverrides(b, envLookup);
        return b.build();
    }

    private static void applyEnvOverrides(ProxyServerConfig.Builder b, Function<String, String> env) {
        envString(env, "HOST", b::host);
        envLong(env, "PORT", v -> b.port(Math.toIntExact(v)));
        envString(env, "PUBLIC_ORIGIN", v -> b.publicOrigin(uri(ENV_PREFIX + "PUBLIC_ORIGIN", v)));
        envString(env, "SECRET", b::secret);
        envString(env, "SERVICE_SECRET", b::serviceSecret);
        envString(env, "ALLOWLIST", v -> b.allowlist(Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList())));
        envLong(env, "URL_TTL_SECONDS", v -> b.urlTtl(Duration.ofSeconds(v)));
        envLong(env, "STREAM_TTL_SECONDS", v -> b.streamTtl(Duration.ofSeconds(v)));
        envLong(env, "IDLE_TIMEOUT_MS", v -> b.idleTimeout(Duration.ofMillis(v)));
        envLong(env, "SSE_MAX_DURATION_MS", v -> b.sseMaxDuration(Duration.ofMillis(v)));
        envLong(env, "MAX_RESPONSE_BYTES", b::maxResponseBytes);
        envLong(env, "UPSTREAM_CONNECT_TIMEOUT_MS", v -> b.upstreamConnectTimeout(Duration.ofMillis(v)));
        envLong(env, "UPSTREAM_RESPONSE_TIMEOUT_MS", v -> b.upstreamResponseTimeout(Duration.ofMillis(v)));
        envString(env, "STORAGE_URL", v -> b.storageUrl(storageUrl(v)));
        envString(env, "STORAGE_TOKEN", b::storageToken);
        envLong(env, "LONG_POLL_TIMEOUT_MS", v -> b.longPollTimeout(Duration.ofMillis(v)));
    }

    // --- env helpers ---

    private static String env(Function<String, String> lookup, String name) {
        String value = lookup.apply(ENV_PREFIX + name);
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private static void envString(Function<String, String> lookup, String name, Consumer<String> setter) {
        String value = env(lookup, name);
        if (value != null) setter.accept(value);
    }

    private static void envLong(Function<String, String> lookup, String name, Consumer<Long> setter) {
        String value = env(lookup, name);
        if (value == null) return;
        try {
            setter.accept(Long.parseLong(value));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigLoadException(ENV_PREFIX + name + " must be an integer, got '" + value + "'", e);
        }
    }

    // --- YAML helpers ---

    private static boolean hasText(JsonNode node, String field) {
        return node.hasNonNull(field) && !node.get(field).asText().isBlank();
    }

    private static List<String> patterns(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> out.add(n.asText()));
        } else if (!node.isNull()) {
            out.add(node.asText());
        }
        return out;
    }

    private static URI storageUrl(String value) {
        if (MEMORY_STORAGE.equalsIgnoreCase(value)) return null;
        return uri("storage.url", value);
    }

    private static URI uri(String key, String value) {
        try {
            URI uri = URI.create(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigLoadException(key + " must be an absolute URL, got '" + value + "'");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(key + " is not a valid URL: '" + value + "'", e);
        }
    }
}
