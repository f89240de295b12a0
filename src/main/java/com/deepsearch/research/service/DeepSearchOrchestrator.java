package com.deepsearch.research.service;

import com.deepsearch.research.client.OllamaClient;
import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.DeepSearchOptions;
import com.deepsearch.research.dto.DeepSearchResult;
import com.deepsearch.research.dto.VectorSearchOptions;
import com.deepsearch.research.dto.VectorSearchResult;
import com.deepsearch.research.dto.analysis.AnalysisOptions;
import com.deepsearch.research.dto.analysis.AnalysisResult;
import com.deepsearch.research.dto.search.RetrievalOptions;
import com.deepsearch.research.dto.search.WebResults;
import com.deepsearch.research.dto.session.SessionDetails;
import com.deepsearch.research.dto.session.SessionSummary;
import com.deepsearch.research.dto.session.StoreStatistics;
import com.deepsearch.research.entity.SearchSession;
import com.deepsearch.research.entity.SessionStatus;
import com.deepsearch.research.exception.InvalidQueryException;
import com.deepsearch.research.service.analysis.Consolidator;
import com.deepsearch.research.service.analysis.LlmAnalysisService;
import com.deepsearch.research.service.analysis.SourceAnalyzer;
import com.deepsearch.research.service.report.ReportSynthesizer;
import com.deepsearch.research.service.search.RetrievalCoordinator;
import com.deepsearch.research.service.session.SessionStoreService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 딥 서치 오케스트레이터
 *
 * 검색어 확장 -> 웹 검색 -> 소스별 분석 -> 통합 -> 리포트 순으로 리서치를 실행합니다.
 *
 * 세션 저장 시 시작할 때 세션을 만들고, 종료 시 COMPLETED 또는 ERROR(실패 단계 포함)로
 * 한 번만 갱신합니다. 오류는 재시도하지 않고 다시 던집니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeepSearchOrchestrator {

    private final RetrievalCoordinator retrievalCoordinator;
    private final SourceAnalyzer sourceAnalyzer;
    private final Consolidator consolidator;
    private final ReportSynthesizer reportSynthesizer;
    private final SessionStoreService sessionStoreService;
    private final LlmAnalysisService llmAnalysisService;
    private final OllamaClient ollamaClient;
    private final MeterRegistry meterRegistry;
    private final DeepSearchProperties properties;

    private Timer runDurationTimer;

    @PostConstruct
    public void initMetrics() {
        runDurationTimer = Timer.builder("deepsearch.run.duration")
                .description("Time taken for a complete research run")
                .register(meterRegistry);
    }

    public DeepSearchOptions defaultOptions() {
        return DeepSearchOptions.defaults(properties.getSearch().getMaxResults());
    }

    public Mono<DeepSearchResult> performDeepSearch(String query) {
        return performDeepSearch(query, defaultOptions());
    }

    public Mono<DeepSearchResult> performDeepSearch(String query, DeepSearchOptions options) {
        if (query == null || query.isBlank()) {
            return Mono.error(InvalidQueryException.blankQuery());
        }
        String normalizedQuery = query.trim();
        log.info("Starting deep search for \"{}\"", normalizedQuery);

        Timer.Sample sample = Timer.start(meterRegistry);
        AtomicReference<ResearchStage> stage = new AtomicReference<>(ResearchStage.CREATED);

        return createSession(normalizedQuery, options)
                .flatMap(session -> {
                    UUID sessionId = session.map(SearchSession::getId).orElse(null);
                    return runPipeline(normalizedQuery, options, sessionId, stage)
                            .flatMap(result -> markCompleted(sessionId, result).thenReturn(result))
                            .doOnNext(result -> {
                                stage.set(ResearchStage.COMPLETED);
                                log.info("Deep search completed for \"{}\" (session {}, {} sources)",
                                        normalizedQuery, sessionId, result.analysis().successfulAnalyses());
                            })
                            .onErrorResume(e -> {
                                ResearchStage failedStage = stage.get().next();
                                stage.set(ResearchStage.ERROR);
                                log.error("Deep search failed for \"{}\" at stage {}: {}",
                                        normalizedQuery, failedStage, e.getMessage(), e);
                                return markError(sessionId, failedStage, e).then(Mono.error(e));
                            });
                })
                .doFinally(signal -> sample.stop(runDurationTimer));
    }

    private Mono<DeepSearchResult> runPipeline(String query, DeepSearchOptions options, UUID sessionId,
                                               AtomicReference<ResearchStage> stage) {
        return retrievalCoordinator.expandTerms(query)
                .doOnNext(expansion -> advance(stage, ResearchStage.TERMS_GENERATED, sessionId))
                .flatMap(expansion -> retrievalCoordinator.retrieve(expansion.searchTerms(),
                                new RetrievalOptions(options.maxSources(), options.useAdvancedSearch()))
                        .doOnNext(webResults -> advance(stage, ResearchStage.WEB_SEARCHED, sessionId))
                        .flatMap(webResults -> analyze(query, webResults, options, sessionId)
                                .doOnNext(analysis -> advance(stage, ResearchStage.ANALYZED, sessionId))
                                .flatMap(analysis -> reportSynthesizer.synthesize(query, analysis, sessionId)
                                        .doOnNext(report -> advance(stage, ResearchStage.REPORTED, sessionId))
                                        .map(report -> new DeepSearchResult(
                                                sessionId, query, expansion, webResults, analysis, report)))));
    }

    private Mono<AnalysisResult> analyze(String query, WebResults webResults, DeepSearchOptions options,
                                         UUID sessionId) {
        AnalysisOptions analysisOptions = new AnalysisOptions(options.generateEmbeddings(), sessionId);
        return sourceAnalyzer.analyzeAll(query, webResults.sources(), analysisOptions)
                .map(analyzed -> new AnalysisResult(
                        analyzed,
                        consolidator.consolidate(query, analyzed),
                        webResults.sources().size(),
                        analyzed.size()
                ));
    }

    private void advance(AtomicReference<ResearchStage> stage, ResearchStage next, UUID sessionId) {
        stage.set(next);
        log.info("Deep search stage {} (session {})", next, sessionId);
    }

    private Mono<Optional<SearchSession>> createSession(String query, DeepSearchOptions options) {
        if (!options.saveToDatabase()) {
            return Mono.just(Optional.empty());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("options", optionsMetadata(options));
        metadata.put("startTime", Instant.now().toString());

        return Mono.fromCallable(() -> Optional.of(sessionStoreService.createSession(query, metadata)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> markCompleted(UUID sessionId, DeepSearchResult result) {
        if (sessionId == null) {
            return Mono.empty();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("completedTime", Instant.now().toString());
        metadata.put("sourcesFound", result.webResults().sources().size());
        metadata.put("reportGenerated", result.report() != null);

        return Mono.fromCallable(() -> sessionStoreService.updateSession(sessionId, SessionStatus.COMPLETED, metadata))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    /**
     * 오류 기록 실패는 로그만 남기고 원래 오류를 그대로 전파합니다.
     */
    private Mono<Void> markError(UUID sessionId, ResearchStage failedStage, Throwable error) {
        if (sessionId == null) {
            return Mono.empty();
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("error", String.valueOf(error.getMessage()));
        metadata.put("errorTime", Instant.now().toString());
        metadata.put("failedStage", failedStage.name());

        return Mono.fromCallable(() -> sessionStoreService.updateSession(sessionId, SessionStatus.ERROR, metadata))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Failed to mark session {} as ERROR: {}", sessionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Map<String, Object> optionsMetadata(DeepSearchOptions options) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("useAdvancedSearch", options.useAdvancedSearch());
        map.put("generateEmbeddings", options.generateEmbeddings());
        map.put("maxSources", options.maxSources());
        map.put("saveToDatabase", options.saveToDatabase());
        return map;
    }

    // ==================== 저장 데이터 조회 ====================

    /**
     * 쿼리와 가장 유사한 저장 소스. limit과 threshold는 설정 범위 안으로 맞춥니다.
     */
    public Mono<VectorSearchResult> vectorSearch(String query, VectorSearchOptions options) {
        if (query == null || query.isBlank()) {
            return Mono.error(InvalidQueryException.blankQuery());
        }

        DeepSearchProperties.VectorSearch config = properties.getVectorSearch();
        int limit = options.limit() != null ? options.limit() : config.getDefaultLimit();
        limit = Math.max(1, Math.min(config.getMaxLimit(), limit));
        double threshold = options.threshold() != null ? options.threshold() : config.getDefaultThreshold();
        threshold = Math.max(config.getMinThreshold(), Math.min(1.0, threshold));

        int effectiveLimit = limit;
        double effectiveThreshold = threshold;
        log.info("Vector search for \"{}\" (limit {}, threshold {})", query, effectiveLimit, effectiveThreshold);

        return llmAnalysisService.generateEmbedding(query.trim())
                .flatMap(embedding -> Mono.fromCallable(() ->
                                sessionStoreService.findSimilarSources(embedding.embedding(), effectiveLimit, effectiveThreshold))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(results -> new VectorSearchResult(query, results, results.size()));
    }

    public Mono<List<SessionSummary>> getSearchHistory(int limit) {
        return Mono.fromCallable(() -> sessionStoreService.getSearchHistory(limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<SessionDetails> getSessionDetails(UUID sessionId) {
        return Mono.fromCallable(() -> sessionStoreService.getSessionDetails(sessionId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<StoreStatistics> getStatistics() {
        return Mono.fromCallable(sessionStoreService::getStatistics)
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Integer> cleanupOldSessions(int daysOld) {
        if (daysOld < 1) {
            return Mono.error(new InvalidQueryException("daysOld must be at least 1"));
        }
        return Mono.fromCallable(() -> sessionStoreService.cleanupOldSessions(daysOld))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<OllamaClient.ModelInfo>> listModels() {
        return ollamaClient.listModels();
    }

    /**
     * DB 및 모델 서버 상태
     */
    public Mono<Map<String, Object>> health() {
        Mono<Map<String, Object>> database = Mono.fromCallable(sessionStoreService::health)
                .subscribeOn(Schedulers.boundedElastic());

        return Mono.zip(database, ollamaClient.isHealthy())
                .map(tuple -> {
                    Map<String, Object> db = tuple.getT1();
                    boolean llmUp = tuple.getT2();
                    boolean dbUp = "ok".equals(db.get("status"));

                    Map<String, Object> health = new LinkedHashMap<>();
                    health.put("status", dbUp && llmUp ? "UP" : "DEGRADED");
                    health.put("timestamp", Instant.now().toString());
                    health.put("database", db);
                    health.put("llm", Map.of("status", llmUp ? "ok" : "error"));
                    return health;
                });
    }
}
