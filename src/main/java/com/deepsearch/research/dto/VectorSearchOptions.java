package com.deepsearch.research.dto;

/**
 * Nearest-neighbour search parameters; null values take the configured defaults.
 */
public record VectorSearchOptions(
        Integer limit,
        Double threshold
) {
    public static VectorSearchOptions defaults() {
        return new VectorSearchOptions(null, null);
    }
}
