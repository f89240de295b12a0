package com.deepsearch.research.dto.search;

/**
 * One organic result returned by the search provider.
 * Identity is the normalized {@code url}; hits only live for the duration of a retrieval.
 *
 * @param dork query-refinement variant that produced the hit, or null for a plain query
 */
public record SearchHit(
        String url,
        String title,
        String snippet,
        String searchTerm,
        String dork
) {
    public static SearchHit of(String url, String title, String snippet) {
        return new SearchHit(url, title, snippet, null, null);
    }

    public SearchHit withOrigin(String searchTerm, String dork) {
        return new SearchHit(url, title, snippet, searchTerm, dork);
    }
}
