package io.durableproxy.server.upstream;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Upstream URLs the proxy is permitted to call.
 *
 * <p>Pattern syntax:
 * <ul>
 *   <li>{@code api.example.com} - any scheme, any port, any path
 *   <li>{@code https://api.example.com} - https only
 *   <li>{@code api.example.com:8080} - that port only ({@code :*} for any port)
 *   <li>{@code api.example.com/v1/*} - {@code /v1} and everything below it
 *   <li>{@code *.example.com} - any subdomain
 * </ul>
 *
 * <p>An empty allowlist allows nothing. Host matching ignores case, path matching does not.
 */
public final class UpstreamAllowlist {

    private static final Pattern SCHEME_PREFIX = Pattern.compile("^(https?)://(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOST_PORT = Pattern.compile("^(.+):(\\d+|\\*)$");

    private final List<Entry> entries;

    private UpstreamAllowlist(List<Entry> entries) {
        this.entries = entries;
    }

    public static UpstreamAllowlist of(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        return new UpstreamAllowlist(patterns.stream()
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(UpstreamAllowlist::parse)
                .collect(Collectors.toUnmodifiableList()));
    }

    public static UpstreamAllowlist of(String... patterns) {
        return of(List.of(patterns));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isAllowed(String url) {
        if (entries.isEmpty()) return false;
        Optional<URI> parsed = validateUpstreamUrl(url);
        return parsed.isPresent() && isAllowed(parsed.get());
    }

    public boolean isAllowed(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        String port = normalizePort(uri.getPort(), scheme);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        for (Entry entry : entries) {
            if (entry.scheme != null && !entry.scheme.equals(scheme)) continue;
            if (!entry.host.matcher(host).matches()) continue;
            if (entry.port != null && !entry.port.equals(port)) continue;
            if (!entry.path.matcher(path).matches()) continue;
            return true;
        }
        return false;
    }

    /**
     * Parses an upstream URL, accepting only absolute http(s) URLs with a host.
     */
    public static Optional<URI> validateUpstreamUrl(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        String scheme = uri.getScheme();
        if (scheme == null) return Optional.empty();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) return Optional.empty();
        if (uri.getHost() == null || uri.getHost().isEmpty()) return Optional.empty();
        return Optional.of(uri);
    }

    @Override
    public String toString() {
        return entries.stream().map(e -> e.source).collect(Collectors.joining(", ", "[", "]"));
    }

    private static Entry parse(String source) {
        String rest = source;
        String scheme = null;
        var schemeMatch = SCHEME_PREFIX.matcher(rest);
        if (schemeMatch.matches()) {
            scheme = schemeMatch.group(1).toLowerCase(Locale.ROOT);
            rest = schemeMatch.group(2);
        }

        String hostPart;
        String pathRegex;
        int slash = rest.indexOf('/');
        if (slash < 0) {
            hostPart = rest;
            pathRegex = ".*";
        } else {
            hostPart = rest.substring(0, slash);
            pathRegex = pathRegex(rest.substring(slash));
        }

        String host = hostPart;
        String port = null;
        var portMatch = HOST_PORT.matcher(hostPart);
        if (portMatch.matches()) {
            host = portMatch.group(1);
            port = "*".equals(portMatch.group(2)) ? null : portMatch.group(2);
        }

        return new Entry(source, scheme,
                Pattern.compile(hostRegex(host), Pattern.CASE_INSENSITIVE),
                port,
                Pattern.compile(pathRegex));
    }

    private static String pathRegex(String path) {
        if (path.equals("/*") || path.equals("/**")) return ".*";
        if (path.endsWith("/**")) return Pattern.quote(path.substring(0, path.length() - 3)) + "(/.*)?";
        if (path.endsWith("/*")) return Pattern.quote(path.substring(0, path.length() - 2)) + "(/.*)?";
        return Pattern.quote(path);
    }

    private static String hostRegex(String host) {
        if (host.startsWith("*.")) return ".*\\." + Pattern.quote(host.substring(2));
        if (host.equals("**")) return ".*";
        if (host.contains("*")) {
            StringBuilder sb = new StringBuilder();
            String[] parts = host.split("\\*", -1);
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) sb.append("[^/]*");
                if (!parts[i].isEmpty()) sb.append(Pattern.quote(parts[i]));
            }
            return sb.toString();
        }
        return Pattern.quote(host);
    }

    /** Empty string for the scheme's default port. */
    private static String normalizePort(int port, String scheme) {
        if (port < 0) return "";
        if (port == 443 && "https".equals(scheme)) return "";
        if (port == 80 && "http".equals(scheme)) return "";
        return Integer.toString(port);
    }

    private static final class Entry {
        final String source;
        final String scheme; // null = http or https
        final Pattern host;
        final String port; // null = any, "" = default
        final Pattern path;

        Entry(String source, String scheme, Pattern host, String port, Pattern path) {
            this.source = source;
            this.scheme = scheme;
            this.host = host;
            this.port = port;
            this.path = path;
        }
    }
}
