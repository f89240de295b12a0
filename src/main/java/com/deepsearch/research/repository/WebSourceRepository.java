package com.deepsearch.research.repository;

import com.deepsearch.research.entity.WebSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WebSourceRepository extends JpaRepository<WebSource, UUID> {

    List<WebSource> findBySessionIdOrderByScrapedAtAsc(UUID sessionId);

    long countBySessionId(UUID sessionId);

    @Query("""
            SELECT w.domain AS domain, COUNT(w) AS count
            FROM WebSource w
            WHERE w.domain IS NOT NULL
            GROUP BY w.domain
            ORDER BY COUNT(w) DESC
            """)
    List<DomainCountView> findTopDomains(Pageable pageable);

    interface DomainCountView {
        String getDomain();

        Long getCount();
    }
}
