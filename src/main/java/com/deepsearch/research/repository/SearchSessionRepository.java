package com.deepsearch.research.repository;

import com.deepsearch.research.dto.session.SessionSummary;
import com.deepsearch.research.entity.SearchSession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface SearchSessionRepository extends JpaRepository<SearchSession, UUID> {

    /**
     * Most recent sessions with the number of sources and reports each one owns
     */
    @Query("""
            SELECT new com.deepsearch.research.dto.session.SessionSummary(
                s.id, s.query, s.status, s.createdAt,
                (SELECT COUNT(w) FROM WebSource w WHERE w.sessionId = s.id),
                (SELECT COUNT(r) FROM ResearchReport r WHERE r.sessionId = s.id))
            FROM SearchSession s
            ORDER BY s.createdAt DESC
            """)
    List<SessionSummary> findRecentWithCounts(Pageable pageable);

    /**
     * Retention cleanup. Sources and reports go with their session (ON DELETE CASCADE).
     */
    @Modifying
    @Query("DELETE FROM SearchSession s WHERE s.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
