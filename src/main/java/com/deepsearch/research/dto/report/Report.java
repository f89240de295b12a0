package com.deepsearch.research.dto.report;

import java.time.Instant;

/**
 * Final narrative of a run. Built once and never modified.
 */
public record Report(
        String title,
        String content,
        String filename,
        String filePath,
        String query,
        Instant timestamp,
        int sourceCount,
        int successfulAnalyses
) {
}
