package dev.pagegraph.capability;

/**
 * Retrieves a page and extracts its readable text.
 *
 * <p>Implementations throw {@link dev.pagegraph.exception.FetchException} for anything
 * that should count as a failed fetch (network error, non-2xx status, unsupported or
 * empty content). They hold no state between calls.
 */
public interface ContentAdapter {

    FetchedContent fetch(String url);
}
