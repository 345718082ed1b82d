package dev.pagegraph.domain.valueobject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic dedup key: lowercase hex SHA-256 of the normalized URL.
 */
public record Fingerprint(String value) {

    public Fingerprint {
        if (value == null || value.length() != 64) {
            throw new IllegalArgumentException("fingerprint must be 64 hex chars");
        }
    }

    public static Fingerprint of(NormalizedUrl url) {
        return new Fingerprint(sha256Hex(url.value()));
    }

    /** Content hash used on fetched documents; same digest, different input. */
    public static String contentHash(String text) {
        return sha256Hex(text == null ? "" : text);
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
