package dev.pagegraph.capability;

import dev.pagegraph.exception.SummarizeException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-free summarizer: leading sentences as the summary, recurring capitalized phrases
 * and frequent content words as concepts. Deterministic, so it also serves as the offline
 * default.
 */
public class HeuristicSummarizationAdapter implements SummarizationAdapter {

    private static final int SUMMARY_SENTENCES = 3;
    private static final int SUMMARY_MAX_CHARS = 600;
    private static final int MAX_CONCEPTS = 8;

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern CAPITALIZED_PHRASE =
            Pattern.compile("\\b([A-Z][\\p{L}0-9-]+(?:\\s+[A-Z][\\p{L}0-9-]+)+)\\b");
    private static final Pattern WORD = Pattern.compile("[\\p{L}][\\p{L}0-9-]{3,}");

    private static final Set<String> STOPWORDS = Set.of(
            "this", "that", "with", "from", "have", "been", "were", "will", "would", "could",
            "should", "there", "their", "which", "about", "into", "more", "most", "some", "such",
            "than", "then", "them", "they", "what", "when", "where", "while", "your", "also",
            "only", "other", "over", "very", "just", "like", "here", "each", "many", "these",
            "those", "after", "before", "between", "because", "through", "being", "does");

    @Override
    public SummaryResult summarize(String text) {
        if (text == null || text.isBlank()) {
            throw new SummarizeException("Nothing to summarize");
        }
        String normalized = text.replaceAll("\\s+", " ").strip();
        return new SummaryResult(leadSentences(normalized), concepts(normalized));
    }

    private static String leadSentences(String text) {
        String[] sentences = SENTENCE_END.split(text, SUMMARY_SENTENCES + 1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(SUMMARY_SENTENCES, sentences.length); i++) {
            if (sb.length() + sentences[i].length() > SUMMARY_MAX_CHARS && sb.length() > 0) break;
            if (sb.length() > 0) sb.append(' ');
            sb.append(sentences[i]);
        }
        return sb.length() > SUMMARY_MAX_CHARS ? sb.substring(0, SUMMARY_MAX_CHARS) : sb.toString();
    }

    static List<String> concepts(String text) {
        Map<String, Integer> scores = new HashMap<>();
        Map<String, String> display = new LinkedHashMap<>();

        Matcher phrases = CAPITALIZED_PHRASE.matcher(text);
        while (phrases.find()) {
            String phrase = phrases.group(1);
            String key = phrase.toLowerCase(Locale.ROOT);
            display.putIfAbsent(key, phrase);
            scores.merge(key, 3, Integer::sum);
        }

        Matcher words = WORD.matcher(text);
        while (words.find()) {
            String key = words.group().toLowerCase(Locale.ROOT);
            if (STOPWORDS.contains(key)) continue;
            display.putIfAbsent(key, key);
            scores.merge(key, 1, Integer::sum);
        }

        List<String> ranked = new ArrayList<>(display.keySet());
        // stable sort keeps first-seen order among equal scores
        ranked.sort((a, b) -> Integer.compare(scores.get(b), scores.get(a)));
        List<String> result = new ArrayList<>();
        for (String key : ranked) {
            if (scores.get(key) < 2) break;
            result.add(display.get(key));
            if (result.size() == MAX_CONCEPTS) break;
        }
        return result;
    }
}
