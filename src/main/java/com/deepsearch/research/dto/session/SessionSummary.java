package com.deepsearch.research.dto.session;

import com.deepsearch.research.entity.SessionStatus;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * History row: a session with the number of rows it owns.
 */
public record SessionSummary(
        UUID id,
        String query,
        SessionStatus status,
        LocalDateTime createdAt,
        Long sourcesCount,
        Long reportsCount
) {
}
