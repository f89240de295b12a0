package com.deepsearch.research.dto;

import com.deepsearch.research.repository.VectorStoreRepository.SimilarSource;

import java.util.List;

public record VectorSearchResult(
        String query,
        List<SimilarSource> results,
        int totalFound
) {
}
