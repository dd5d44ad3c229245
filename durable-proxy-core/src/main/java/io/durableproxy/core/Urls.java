package io.durableproxy.core;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build URLs with lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    /**
     * Returns {@code base} with {@code params} set. Keys already present in the query are replaced;
     * other existing parameters are kept in their original order.
     */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        Map<String, String> kept = new LinkedHashMap<>(rawQuery(base));
        for (String key : params.keySet()) {
            kept.remove(encode(key));
        }

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(withoutQuery(base).toString());
        boolean first = true;
        for (Map.Entry<String, String> e : kept.entrySet()) {
            sb.append(first ? "?" : "&");
            first = false;
            sb.append(e.getKey());
            if (e.getValue() != null) sb.append("=").append(e.getValue());
        }
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            sb.append(first ? "?" : "&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /** Returns {@code base} with every query parameter named in {@code keys} removed. */
    public static URI withoutParams(URI base, Collection<String> keys) {
        Objects.requireNonNull(base, "base");
        Map<String, String> kept = new LinkedHashMap<>(rawQuery(base));
        for (String key : keys) {
            kept.remove(encode(key));
        }
        StringBuilder sb = new StringBuilder(withoutQuery(base).toString());
        boolean first = true;
        for (Map.Entry<String, String> e : kept.entrySet()) {
            sb.append(first ? "?" : "&");
            first = false;
            sb.append(e.getKey());
            if (e.getValue() != null) sb.append("=").append(e.getValue());
        }
        return URI.create(sb.toString());
    }

    /** Returns the URL without query string and fragment. */
    public static URI withoutQuery(URI uri) {
        String s = uri.toString();
        int cut = s.length();
        int q = s.indexOf('?');
        if (q >= 0) cut = q;
        int f = s.indexOf('#');
        if (f >= 0 && f < cut) cut = f;
        return URI.create(s.substring(0, cut));
    }

    /** Returns the first decoded value of query parameter {@code key}, or {@code null}. */
    public static String queryParam(URI uri, String key) {
        String raw = rawQuery(uri).get(encode(key));
        return raw == null ? null : URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }

    public static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static Map<String, String> rawQuery(URI uri) {
        String q = uri.getRawQuery();
        Map<String, String> out = new LinkedHashMap<>();
        if (q == null || q.isEmpty()) return out;
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.putIfAbsent(part, null);
            } else {
                out.putIfAbsent(part.substring(0, eq), part.substring(eq + 1));
            }
        }
        return out;
    }
}
