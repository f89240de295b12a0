package com.deepsearch.research.dto.analysis;

import java.util.UUID;

/**
 * @param sessionId session to persist analyzed sources into, or null for an unsaved run
 */
public record AnalysisOptions(
        boolean generateEmbeddings,
        UUID sessionId
) {
    public boolean sessionBacked() {
        return sessionId != null;
    }
}
