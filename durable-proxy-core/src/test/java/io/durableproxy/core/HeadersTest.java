package io.durableproxy.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeadersTest {

    @Test
    void lookupIgnoresCase() {
        Map<String, List<String>> headers = Map.of("stream-up-to-date", List.of(" TRUE "), "Location", List.of("/a", "/b"));

        assertThat(Headers.firstValue(headers, "LOCATION")).contains("/a");
        assertThat(Headers.flag(headers, Protocol.H_STREAM_UP_TO_DATE)).isTrue();
        assertThat(Headers.flag(headers, "Missing")).isFalse();
        assertThat(Headers.firstValue(null, "Location")).isEmpty();
    }

    @Test
    void canonicalDecimalRejectsSignsAndLeadingZeros() {
        assertThat(Headers.canonicalDecimal("0")).contains(0L);
        assertThat(Headers.canonicalDecimal("3600")).contains(3600L);
        assertThat(Headers.canonicalDecimal("007")).isEmpty();
        assertThat(Headers.canonicalDecimal("-1")).isEmpty();
        assertThat(Headers.canonicalDecimal("+1")).isEmpty();
        assertThat(Headers.canonicalDecimal("1e3")).isEmpty();
        assertThat(Headers.canonicalDecimal("99999999999999999999")).isEmpty();
        assertThat(Headers.canonicalDecimal(null)).isEmpty();
    }

    @Test
    void offsetRejectsQueryDelimiters() {
        assertThat(Offset.beginning().isBeginning()).isTrue();
        assertThat(new Offset("0000000000001")).isGreaterThan(new Offset("0000000000000"));
        assertThatThrownBy(() -> new Offset("1&live=sse")).isInstanceOf(DurableProxyException.InvalidOffset.class);
        assertThatThrownBy(() -> new Offset("")).isInstanceOf(DurableProxyException.InvalidOffset.class);
    }
}
