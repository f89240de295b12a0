package com.deepsearch.research.dto.analysis;

import java.util.List;

/**
 * Outcome of the analysis stage.
 *
 * @param totalSources number of scraped sources handed to the analyzer
 * @param successfulAnalyses number of sources that survived analysis
 */
public record AnalysisResult(
        List<AnalyzedSource> individualAnalyses,
        ConsolidatedSynthesis consolidatedAnalysis,
        int totalSources,
        int successfulAnalyses
) {
}
