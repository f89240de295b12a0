package com.deepsearch.research.dto.analysis;

public record SourceSummary(
        String url,
        String domain,
        String title,
        int relevance,
        int credibility,
        String summary
) {
}
