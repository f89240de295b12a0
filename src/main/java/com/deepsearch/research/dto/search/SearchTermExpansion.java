package com.deepsearch.research.dto.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Search terms derived from the user's query by the language model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchTermExpansion(
        @JsonProperty("original_query") String originalQuery,
        @JsonProperty("search_terms") List<String> searchTerms,
        @JsonProperty("categories") List<String> categories
) {
    public static final String FALLBACK_CATEGORY = "general";

    public SearchTermExpansion {
        searchTerms = searchTerms == null ? List.of() : List.copyOf(searchTerms);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /**
     * Single-term expansion used whenever the model cannot provide one.
     */
    public static SearchTermExpansion fallback(String query) {
        return new SearchTermExpansion(query, List.of(query), List.of(FALLBACK_CATEGORY));
    }
}
