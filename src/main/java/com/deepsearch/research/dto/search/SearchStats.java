package com.deepsearch.research.dto.search;

import java.util.List;
import java.util.Map;

/**
 * Aggregate figures over the scraped sources of one retrieval.
 */
public record SearchStats(
        int totalResults,
        Map<String, Long> domains,
        List<DomainCount> topDomains,
        long averageContentLength,
        long totalContentLength,
        long totalWords,
        long averageWordCount
) {
    public static SearchStats empty() {
        return new SearchStats(0, Map.of(), List.of(), 0, 0, 0, 0);
    }
}
