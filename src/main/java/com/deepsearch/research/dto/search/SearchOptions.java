package com.deepsearch.research.dto.search;

/**
 * Parameters for a single search provider call.
 */
public record SearchOptions(
        int maxResults,
        String region,
        String safeSearch
) {
    public SearchOptions withMaxResults(int maxResults) {
        return new SearchOptions(maxResults, region, safeSearch);
    }
}
