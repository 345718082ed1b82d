package dev.pagegraph.capability;

/**
 * Extracted page text and the method that produced it (e.g. {@code jsoup-html}).
 */
public record FetchedContent(String text, String extractionMethod) {
    public FetchedContent {
        if (text == null) throw new IllegalArgumentException("text is required");
        if (extractionMethod == null || extractionMethod.isBlank()) extractionMethod = "unknown";
    }
}
