package com.deepsearch.research.dto.analysis;

import java.util.List;

/**
 * Frequency-ranked aggregate of every per-source analysis of a run.
 * Derived only; it is never stored apart from the report built from it.
 */
public record ConsolidatedSynthesis(
        String query,
        int totalSources,
        int highRelevanceSources,
        int mediumRelevanceSources,
        int lowRelevanceSources,
        List<RankedItem> topKeyPoints,
        List<RankedItem> topInsights,
        List<RankedItem> topTopics,
        List<SourceSummary> sources
) {
}
