package com.deepsearch.research.dto;

/**
 * Options of one research run.
 *
 * @param maxSources result budget of the retrieval phase
 * @param saveToDatabase persist the session, its sources and its report
 */
public record DeepSearchOptions(
        boolean useAdvancedSearch,
        boolean generateEmbeddings,
        int maxSources,
        boolean saveToDatabase
) {
    public static DeepSearchOptions defaults(int maxSources) {
        return new DeepSearchOptions(true, true, maxSources, true);
    }

    /**
     * Request values over the defaults
     */
    public static DeepSearchOptions from(DeepSearchRequest request, int defaultMaxSources) {
        return new DeepSearchOptions(
                request.getUseAdvancedSearch() == null || request.getUseAdvancedSearch(),
                request.getGenerateEmbeddings() == null || request.getGenerateEmbeddings(),
                request.getMaxSources() != null ? request.getMaxSources() : defaultMaxSources,
                request.getSaveToDatabase() == null || request.getSaveToDatabase()
        );
    }
}
