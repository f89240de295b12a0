package com.deepsearch.research.controller;

import com.deepsearch.research.client.OllamaClient;
import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.DeepSearchOptions;
import com.deepsearch.research.dto.DeepSearchRequest;
import com.deepsearch.research.dto.DeepSearchResult;
import com.deepsearch.research.dto.VectorSearchOptions;
import com.deepsearch.research.dto.VectorSearchRequest;
import com.deepsearch.research.dto.VectorSearchResult;
import com.deepsearch.research.dto.session.SessionDetails;
import com.deepsearch.research.dto.session.SessionSummary;
import com.deepsearch.research.dto.session.StoreStatistics;
import com.deepsearch.research.service.DeepSearchOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 딥 서치 API
 *
 * POST /api/search          - 리서치 실행
 * POST /api/vector-search   - 쿼리와 유사한 저장 소스 검색
 * GET  /api/history         - 최근 세션 목록 (소스/리포트 수 포함)
 * GET  /api/session/{id}    - 세션 상세 (소스, 리포트)
 * GET  /api/stats           - 저장소 통계 및 상위 도메인
 * GET  /api/models          - 모델 서버에 설치된 모델 목록
 * POST /api/admin/cleanup   - N일보다 오래된 세션 삭제
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DeepSearchController {

    private final DeepSearchOrchestrator orchestrator;
    private final DeepSearchProperties properties;

    @PostMapping("/search")
    public Mono<ResponseEntity<DeepSearchResult>> search(@Valid @RequestBody DeepSearchRequest request) {
        log.info("Deep search requested: \"{}\"", request.getQuery());
        DeepSearchOptions options = DeepSearchOptions.from(request, properties.getSearch().getMaxResults());

        return orchestrator.performDeepSearch(request.getQuery(), options)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/vector-search")
    public Mono<ResponseEntity<VectorSearchResult>> vectorSearch(@Valid @RequestBody VectorSearchRequest request) {
        return orchestrator.vectorSearch(request.getQuery(),
                        new VectorSearchOptions(request.getLimit(), request.getThreshold()))
                .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<List<SessionSummary>>> history(@RequestParam(defaultValue = "10") int limit) {
        return orchestrator.getSearchHistory(limit)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/session/{id}")
    public Mono<ResponseEntity<SessionDetails>> session(@PathVariable UUID id) {
        return orchestrator.getSessionDetails(id)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<StoreStatistics>> stats() {
        return orchestrator.getStatistics()
                .map(ResponseEntity::ok);
    }

    @GetMapping("/models")
    public Mono<ResponseEntity<List<OllamaClient.ModelInfo>>> models() {
        return orchestrator.listModels()
                .map(ResponseEntity::ok);
    }

    @PostMapping("/admin/cleanup")
    public Mono<ResponseEntity<Map<String, Object>>> cleanup(@RequestParam(defaultValue = "30") int daysOld) {
        log.info("Cleanup requested for sessions older than {} days", daysOld);
        return orchestrator.cleanupOldSessions(daysOld)
                .map(deleted -> ResponseEntity.ok(Map.<String, Object>of(
                        "deletedSessions", deleted,
                        "daysOld", daysOld
                )));
    }
}
