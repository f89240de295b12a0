package com.deepsearch.research.dto.search;

import java.util.List;

public record WebResults(
        List<String> searchTerms,
        List<ScrapedSource> sources,
        SearchStats stats
) {
    public WebResults {
        searchTerms = searchTerms == null ? List.of() : List.copyOf(searchTerms);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
