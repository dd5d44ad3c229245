package io.durableproxy.server;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query parsing for proxy URLs. Capability parameters must not be smuggled in twice, so callers
 * can ask for every value of a key as well as the first.
 */
public final class QueryString {
    private QueryString() {}

    /** First value of each parameter; a key without {@code =} maps to the empty string. */
    public static Map<String, String> parse(URI uri) {
        Map<String, List<String>> all = parseAll(uri);
        if (all.isEmpty()) return Map.of();
        Map<String, String> first = new LinkedHashMap<>();
        all.forEach((k, v) -> first.put(k, v.get(0)));
        return first;
    }

    public static boolean hasDuplicate(URI uri, String key) {
        if (uri == null || key == null) return false;
        List<String> values = parseAll(uri).get(key);
        return values != null && values.size() > 1;
    }

    static Map<String, List<String>> parseAll(URI uri) {
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, List<String>> out = new LinkedHashMap<>();
        int start = 0;
        while (start <= raw.length()) {
            int amp = raw.indexOf('&', start);
            int end = amp < 0 ? raw.length() : amp;
            if (end > start) {
                int eq = raw.indexOf('=', start);
                boolean hasValue = eq >= 0 && eq < end;
                String key = decode(raw.substring(start, hasValue ? eq : end));
                String value = hasValue ? decode(raw.substring(eq + 1, end)) : "";
                out.computeIfAbsent(key, k -> new ArrayList<>(1)).add(value);
            }
            start = end + 1;
        }
        return out;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
