package io.durableproxy.server.upstream;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamHeadersTest {

    @Test
    void upstreamAuthorizationReplacesProxyAuthorization() {
        Map<String, List<String>> in = new LinkedHashMap<>();
        in.put("Authorization", List.of("Bearer proxy-secret"));
        in.put("Upstream-Authorization", List.of("Bearer sk-upstream"));
        in.put("Upstream-URL", List.of("https://api.example.com"));
        in.put("Upstream-Method", List.of("POST"));
        in.put("Use-Stream-URL", List.of("https://proxy/v1/proxy/s?expires=1&signature=x"));
        in.put("Content-Type", List.of("application/json"));

        Map<String, String> out = UpstreamHeaders.forUpstream(in);

        assertThat(out).containsEntry("Authorization", "Bearer sk-upstream")
                .containsEntry("Content-Type", "application/json")
                .doesNotContainKeys("Upstream-Authorization", "Upstream-URL", "Upstream-Method", "Use-Stream-URL");
        assertThat(out.values()).doesNotContain("Bearer proxy-secret");
    }

    @Test
    void hopByHopHeadersAreDroppedAndValuesJoined() {
        Map<String, List<String>> in = new LinkedHashMap<>();
        in.put("Connection", List.of("keep-alive"));
        in.put("Host", List.of("proxy.local"));
        in.put("Content-Length", List.of("12"));
        in.put("Accept-Encoding", List.of("gzip"));
        in.put("Accept", List.of("text/event-stream", "application/json"));

        Map<String, String> out = UpstreamHeaders.forUpstream(in);

        assertThat(out).containsOnlyKeys("Accept");
        assertThat(out.get("Accept")).isEqualTo("text/event-stream, application/json");
    }

    @Test
    void responseHeadersAreLowerCasedWithoutHopByHop() {
        Map<String, List<String>> in = new LinkedHashMap<>();
        in.put("Content-Type", List.of("text/event-stream"));
        in.put("Transfer-Encoding", List.of("chunked"));
        in.put("X-Request-Id", List.of("abc"));
        in.put(":status", List.of("200"));

        assertThat(UpstreamHeaders.fromUpstream(in))
                .containsExactly(Map.entry("content-type", "text/event-stream"), Map.entry("x-request-id", "abc"));
    }
}
