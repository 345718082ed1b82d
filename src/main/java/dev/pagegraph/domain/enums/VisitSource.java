package dev.pagegraph.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * How a navigation was observed by the capture client.
 */
public enum VisitSource {
    FULL_LOAD, SPA_NAVIGATION, MANUAL;

    /**
     * Parses the canonical wire names ({@code full-load}, {@code spa-navigation}, {@code manual})
     * in any case with {@code -} or {@code _}, plus the names older capture clients send.
     */
    public static Optional<VisitSource> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (key) {
            case "full-load", "fullload", "extension" -> Optional.of(FULL_LOAD);
            case "spa-navigation", "spanavigation", "spa" -> Optional.of(SPA_NAVIGATION);
            case "manual", "manualclick", "inpagebutton" -> Optional.of(MANUAL);
            default -> Optional.empty();
        };
    }
}
