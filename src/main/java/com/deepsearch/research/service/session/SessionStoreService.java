package com.deepsearch.research.service.session;

import com.deepsearch.research.dto.analysis.SourceAnalysis;
import com.deepsearch.research.dto.report.Report;
import com.deepsearch.research.dto.search.DomainCount;
import com.deepsearch.research.dto.search.ScrapedSource;
import com.deepsearch.research.dto.session.SessionDetails;
import com.deepsearch.research.dto.session.SessionSummary;
import com.deepsearch.research.dto.session.StoreStatistics;
import com.deepsearch.research.entity.ResearchReport;
import com.deepsearch.research.entity.SearchSession;
import com.deepsearch.research.entity.SessionStatus;
import com.deepsearch.research.entity.WebSource;
import com.deepsearch.research.exception.SessionNotFoundException;
import com.deepsearch.research.repository.ResearchReportRepository;
import com.deepsearch.research.repository.SearchSessionRepository;
import com.deepsearch.research.repository.VectorStoreRepository;
import com.deepsearch.research.repository.VectorStoreRepository.SimilarSource;
import com.deepsearch.research.repository.WebSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 리서치 세션 저장소 서비스
 *
 * 세션, 소스, 리포트를 저장하고 조회합니다.
 * 모든 메서드는 블로킹이므로 리액티브 호출자는 boundedElastic 스케줄러에서 실행합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionStoreService {

    private static final int TOP_DOMAINS = 10;

    private final SearchSessionRepository sessionRepository;
    private final WebSourceRepository webSourceRepository;
    private final ResearchReportRepository reportRepository;
    private final VectorStoreRepository vectorStoreRepository;

    @Transactional
    public SearchSession createSession(String query, Map<String, Object> metadata) {
        SearchSession session = SearchSession.builder()
                .query(query)
                .status(SessionStatus.PENDING)
                .metadata(new HashMap<>(metadata))
                .build();
        SearchSession saved = sessionRepository.save(session);
        log.info("Created search session {} for \"{}\"", saved.getId(), query);
        return saved;
    }

    /**
     * Final status update of a session; the given entries are merged into its metadata.
     */
    @Transactional
    public SearchSession updateSession(UUID sessionId, SessionStatus status, Map<String, Object> metadata) {
        SearchSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> SessionNotFoundException.of(sessionId));

        Map<String, Object> merged = new HashMap<>();
        if (session.getMetadata() != null) {
            merged.putAll(session.getMetadata());
        }
        merged.putAll(metadata);

        session.setStatus(status);
        session.setMetadata(merged);
        SearchSession saved = sessionRepository.save(session);
        log.info("Search session {} marked {}", sessionId, status);
        return saved;
    }

    /**
     * Stores a scraped source with its summary and scores, then its embedding when one is given.
     */
    @Transactional
    public UUID saveSource(UUID sessionId, ScrapedSource source, SourceAnalysis analysis, float[] embedding) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("relevance", analysis.relevanceScore());
        metadata.put("credibility", analysis.credibilityScore());
        metadata.put("searchTerm", source.searchTerm());
        metadata.put("wordCount", source.wordCount());
        metadata.put("description", source.description());

        WebSource entity = WebSource.builder()
                .sessionId(sessionId)
                .url(source.url())
                .title(source.title())
                .content(source.content())
                .summary(analysis.summary())
                .domain(source.domain())
                .scrapedAt(source.scrapedAt() != null
                        ? LocalDateTime.ofInstant(source.scrapedAt(), ZoneId.systemDefault())
                        : LocalDateTime.now())
                .metadata(metadata)
                .build();

        // JDBC로 벡터 컬럼을 쓰기 전에 행이 존재해야 함
        WebSource saved = webSourceRepository.saveAndFlush(entity);
        if (embedding != null && embedding.length > 0) {
            vectorStoreRepository.updateSourceEmbedding(saved.getId(), embedding);
        }
        log.debug("Saved source {} for session {}", source.url(), sessionId);
        return saved.getId();
    }

    @Transactional
    public ResearchReport saveReport(UUID sessionId, Report report) {
        ResearchReport entity = ResearchReport.builder()
                .sessionId(sessionId)
                .title(report.title())
                .content(report.content())
                .filePath(report.filePath())
                .format("markdown")
                .build();
        ResearchReport saved = reportRepository.save(entity);
        log.info("Saved report {} for session {}", report.filename(), sessionId);
        return saved;
    }

    public List<SimilarSource> findSimilarSources(float[] queryEmbedding, int limit, double threshold) {
        return vectorStoreRepository.findSimilarSources(queryEmbedding, limit, threshold);
    }

    @Transactional(readOnly = true)
    public List<SessionSummary> getSearchHistory(int limit) {
        return sessionRepository.findRecentWithCounts(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public SessionDetails getSessionDetails(UUID sessionId) {
        SearchSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> SessionNotFoundException.of(sessionId));
        return new SessionDetails(
                session,
                webSourceRepository.findBySessionIdOrderByScrapedAtAsc(sessionId),
                reportRepository.findBySessionIdOrderByCreatedAtAsc(sessionId)
        );
    }

    @Transactional(readOnly = true)
    public StoreStatistics getStatistics() {
        List<DomainCount> topDomains = webSourceRepository.findTopDomains(PageRequest.of(0, TOP_DOMAINS)).stream()
                .map(view -> new DomainCount(view.getDomain(), view.getCount()))
                .toList();

        return new StoreStatistics(
                sessionRepository.count(),
                webSourceRepository.count(),
                reportRepository.count(),
                vectorStoreRepository.countCachedEmbeddings(),
                topDomains
        );
    }

    /**
     * {@code daysOld}일보다 오래된 세션을 소스, 리포트와 함께 삭제합니다.
     */
    @Transactional
    public int cleanupOldSessions(int daysOld) {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(daysOld);
        int deleted = sessionRepository.deleteCreatedBefore(cutoff);
        log.info("Removed {} sessions older than {} days", deleted, daysOld);
        return deleted;
    }

    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        try {
            boolean vectorAvailable = vectorStoreRepository.isVectorExtensionAvailable();
            health.put("status", vectorAvailable ? "ok" : "degraded");
            health.put("vectorExtension", vectorAvailable);
            health.put("sessions", sessionRepository.count());
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            health.put("status", "error");
            health.put("message", e.getMessage());
        }
        return health;
    }
}
