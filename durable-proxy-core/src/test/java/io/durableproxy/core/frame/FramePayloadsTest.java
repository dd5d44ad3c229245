package io.durableproxy.core.frame;

import io.durableproxy.core.DurableProxyException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FramePayloadsTest {

    @Test
    void startPayloadCarriesStatusAndHeaders() {
        byte[] json = FramePayloads.encodeStart(new StartPayload(206, Map.of("content-type", "text/plain")));

        StartPayload decoded = FramePayloads.decodeStart(json);

        assertThat(decoded.status()).isEqualTo(206);
        assertThat(decoded.headers()).containsEntry("content-type", "text/plain");
    }

    @Test
    void startPayloadWithoutStatusIsMalformed() {
        assertThatThrownBy(() -> FramePayloads.decodeStart("{\"headers\":{}}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DurableProxyException.MalformedFrame.class);
        assertThatThrownBy(() -> FramePayloads.decodeStart("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(DurableProxyException.MalformedFrame.class);
    }

    @Test
    void errorPayloadFallsBackToCodeThenRawText() {
        assertThat(FramePayloads.decodeError("{\"message\":\"m\",\"code\":\"C\"}".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(new ErrorPayload("m", "C"));
        assertThat(FramePayloads.decodeError("{\"code\":\"IDLE_TIMEOUT\"}".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(new ErrorPayload("IDLE_TIMEOUT", "IDLE_TIMEOUT"));
        assertThat(FramePayloads.decodeError("{}".getBytes(StandardCharsets.UTF_8)).message())
                .isEqualTo("{}");
        assertThat(FramePayloads.decodeError("socket hang up".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(new ErrorPayload("socket hang up", null));
    }
}
