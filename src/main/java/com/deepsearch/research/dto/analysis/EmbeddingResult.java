package com.deepsearch.research.dto.analysis;

/**
 * Raw vector returned by the embedding endpoint.
 */
public record EmbeddingResult(
        float[] embedding,
        String model,
        int textLength
) {
    public boolean isEmpty() {
        return embedding == null || embedding.length == 0;
    }
}
