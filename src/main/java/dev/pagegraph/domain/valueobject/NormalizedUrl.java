package dev.pagegraph.domain.valueobject;

/**
 * A URL after normalization: lowercase scheme and host, no default port, no user-info,
 * tracking parameters removed, fragment kept only when it is a hash-bang route.
 */
public record NormalizedUrl(String value, String host) {
    public NormalizedUrl {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("value required");
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host required");
    }

    @Override
    public String toString() {
        return value;
    }
}
