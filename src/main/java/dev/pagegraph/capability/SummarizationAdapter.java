package dev.pagegraph.capability;

/**
 * Condenses document text into a short summary plus the concept labels it is about.
 * Failures are reported as {@link dev.pagegraph.exception.SummarizeException}.
 */
public interface SummarizationAdapter {

    SummaryResult summarize(String text);
}
