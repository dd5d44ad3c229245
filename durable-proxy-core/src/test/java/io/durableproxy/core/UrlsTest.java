package io.durableproxy.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlsTest {

    private static final URI SIGNED = URI.create("http://proxy/v1/proxy/abc?expires=100&signature=sig_-x");

    @Test
    void withQueryKeepsExistingParamsAndSortsNewOnes() {
        URI url = Urls.withQuery(SIGNED, Map.of("offset", "-1", "live", "long-poll"));

        assertThat(url.toString())
                .isEqualTo("http://proxy/v1/proxy/abc?expires=100&signature=sig_-x&live=long-poll&offset=-1");
    }

    @Test
    void withQueryReplacesExistingKey() {
        URI once = Urls.withQuery(SIGNED, Map.of("offset", "a"));
        URI twice = Urls.withQuery(once, Map.of("offset", "b"));

        assertThat(Urls.queryParam(twice, "offset")).isEqualTo("b");
        assertThat(twice.getRawQuery()).containsOnlyOnce("offset=");
    }

    @Test
    void withoutParamsDropsNamedKeys() {
        URI url = URI.create("http://proxy/v1/proxy/s?action=connect&secret=x&tenant=t1");

        assertThat(Urls.withoutParams(url, List.of("action", "secret")).toString())
                .isEqualTo("http://proxy/v1/proxy/s?tenant=t1");
        assertThat(Urls.withoutQuery(url).toString()).isEqualTo("http://proxy/v1/proxy/s");
    }

    @Test
    void queryParamDecodesValue() {
        URI url = Urls.withQuery(URI.create("http://h/p"), Map.of("cursor", "a b&c"));

        assertThat(Urls.queryParam(url, "cursor")).isEqualTo("a b&c");
        assertThat(Urls.queryParam(url, "missing")).isNull();
    }
}
