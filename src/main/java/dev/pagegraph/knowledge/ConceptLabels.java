package dev.pagegraph.knowledge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical form of concept labels. Two labels with the same normalized form name the
 * same ConceptNode.
 */
public final class ConceptLabels {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$");
    static final int MAX_LENGTH = 255;

    private ConceptLabels() {}

    /** Trim, collapse whitespace, strip surrounding punctuation, lowercase. Empty if nothing is left. */
    public static String normalize(String label) {
        if (label == null) return "";
        String collapsed = WHITESPACE.matcher(label.strip()).replaceAll(" ");
        String stripped = EDGE_PUNCTUATION.matcher(collapsed).replaceAll("");
        String lower = stripped.toLowerCase(Locale.ROOT);
        return lower.length() > MAX_LENGTH ? lower.substring(0, MAX_LENGTH).strip() : lower;
    }

    /** Display form: whitespace collapsed and edge punctuation removed, case kept. */
    public static String display(String label) {
        String collapsed = WHITESPACE.matcher(label.strip()).replaceAll(" ");
        String stripped = EDGE_PUNCTUATION.matcher(collapsed).replaceAll("");
        return stripped.length() > MAX_LENGTH ? stripped.substring(0, MAX_LENGTH).strip() : stripped;
    }

    /**
     * Drops blank labels and later duplicates (by normalized form), keeping the original order
     * and the first display form seen.
     */
    public static List<String> distinct(List<String> labels) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String label : labels) {
            String key = normalize(label);
            if (!key.isEmpty()) {
                seen.putIfAbsent(key, display(label));
            }
        }
        return new ArrayList<>(seen.values());
    }
}
