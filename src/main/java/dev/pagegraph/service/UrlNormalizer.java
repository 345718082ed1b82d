package dev.pagegraph.service;

import dev.pagegraph.config.IngestProperties;
import dev.pagegraph.domain.valueobject.NormalizedUrl;
import dev.pagegraph.exception.InvalidEventException;
import org.springframework.stereotype.Component;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Canonical form of a visited URL: scheme + host + path + query. Two URLs that
 * normalize to the same string are the same page for dedup purposes.
 *
 * <ul>
 *   <li>only http and https; scheme and host lowercased, host converted to ASCII</li>
 *   <li>user-info and default ports dropped, empty path becomes "/", dot segments removed</li>
 *   <li>configured tracking parameters removed, remaining parameter order kept</li>
 *   <li>fragment dropped unless it is a hash-bang route ({@code #!...} or {@code #/...})</li>
 * </ul>
 */
@Component
public class UrlNormalizer {

    private final IngestProperties properties;

    public UrlNormalizer(IngestProperties properties) {
        this.properties = properties;
    }

    public NormalizedUrl normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidEventException("url is required");
        }
        String trimmed = raw.trim();
        if (trimmed.length() > properties.maxUrlLength()) {
            throw new InvalidEventException("url exceeds %d characters".formatted(properties.maxUrlLength()));
        }

        URI uri;
        try {
            uri = new URI(trimmed).normalize();
        } catch (URISyntaxException e) {
            throw new InvalidEventException("malformed url: " + e.getReason());
        }

        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidEventException("only http and https urls are accepted");
        }

        String host = resolveHost(uri);
        int port = uri.getPort();
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);

        String query = stripTrackingParams(uri.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);

        String fragment = uri.getRawFragment();
        if (fragment != null && isSignificantFragment(fragment)) {
            sb.append('#').append(fragment);
        }

        String value = sb.toString();
        if (value.length() > properties.maxUrlLength()) {
            throw new InvalidEventException("url exceeds %d characters".formatted(properties.maxUrlLength()));
        }
        return new NormalizedUrl(value, host);
    }

    private String resolveHost(URI uri) {
        String host = uri.getHost();
        if (host == null && uri.getRawAuthority() != null) {
            // java.net.URI leaves host null for non-ASCII names; recover it from the authority
            String authority = uri.getRawAuthority();
            int at = authority.lastIndexOf('@');
            if (at >= 0) authority = authority.substring(at + 1);
            int colon = authority.lastIndexOf(':');
            if (colon > 0 && !authority.endsWith("]")) authority = authority.substring(0, colon);
            host = authority;
        }
        if (host == null || host.isBlank()) {
            throw new InvalidEventException("url has no host");
        }
        try {
            return IDN.toASCII(host.toLowerCase(Locale.ROOT), IDN.ALLOW_UNASSIGNED);
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException("url host is not valid: " + e.getMessage());
        }
    }

    private String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String name = (eq >= 0 ? part.substring(0, eq) : part).toLowerCase(Locale.ROOT);
            if (!isTrackingParam(name)) kept.add(part);
        }
        return String.join("&", kept);
    }

    private boolean isTrackingParam(String name) {
        for (String pattern : properties.strippedQueryParams()) {
            String p = pattern.toLowerCase(Locale.ROOT);
            if (p.endsWith("*") ? name.startsWith(p.substring(0, p.length() - 1)) : name.equals(p)) {
                return true;
            }
        }
        return false;
    }

    private boolean isSignificantFragment(String fragment) {
        return properties.keepHashBangFragments() && (fragment.startsWith("!") || fragment.startsWith("/"));
    }
}
