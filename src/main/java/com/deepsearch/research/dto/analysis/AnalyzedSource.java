package com.deepsearch.research.dto.analysis;

import com.deepsearch.research.dto.search.ScrapedSource;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A scraped source that survived analysis, with its embedding when one was produced.
 */
public record AnalyzedSource(
        ScrapedSource source,
        SourceAnalysis analysis,
        @JsonIgnore float[] embedding
) {
    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
