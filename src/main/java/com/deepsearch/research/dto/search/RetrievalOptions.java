package com.deepsearch.research.dto.search;

/**
 * @param maxResults result budget shared by every provider call of the retrieval
 * @param useAdvancedSearch run the query-refinement variants against the first term
 */
public record RetrievalOptions(
        int maxResults,
        boolean useAdvancedSearch
) {
}
