package com.deepsearch.research.dto;

import com.deepsearch.research.dto.analysis.AnalysisResult;
import com.deepsearch.research.dto.report.Report;
import com.deepsearch.research.dto.search.SearchTermExpansion;
import com.deepsearch.research.dto.search.WebResults;

import java.util.UUID;

/**
 * Everything a completed run produced.
 *
 * @param sessionId null when the run was not persisted
 */
public record DeepSearchResult(
        UUID sessionId,
        String query,
        SearchTermExpansion searchTerms,
        WebResults webResults,
        AnalysisResult analysis,
        Report report
) {
}
