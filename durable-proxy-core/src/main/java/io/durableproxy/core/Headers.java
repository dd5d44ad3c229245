package io.durableproxy.core;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Header and counter parsing shared by the proxy, its storage client and the session client.
 */
public final class Headers {
    private static final Pattern CANONICAL_DECIMAL = Pattern.compile("0|[1-9][0-9]{0,18}");

    private Headers() {}

    /** First non-null value of {@code name}, matched case-insensitively. */
    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getValue() == null || !name.equalsIgnoreCase(e.getKey())) continue;
            for (String v : e.getValue()) {
                if (v != null) return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /** Whether {@code name} is present with the value {@code true}. */
    public static boolean flag(Map<String, ? extends Iterable<String>> headers, String name) {
        return firstValue(headers, name)
                .map(String::trim)
                .filter(Protocol.BOOL_TRUE::equalsIgnoreCase)
                .isPresent();
    }

    /**
     * Parses a non-negative decimal with no sign and no leading zeros, as used for TTLs, expiry
     * times and response ids.
     *
     * @return the value, or empty when {@code raw} is null, not canonical or out of range
     */
    public static Optional<Long> canonicalDecimal(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (!CANONICAL_DECIMAL.matcher(s).matches()) return Optional.empty();
        try {
            return Optional.of(Long.parseLong(s));
        } catch (NumberFormatException overflow) {
            return Optional.empty();
        }
    }
}
