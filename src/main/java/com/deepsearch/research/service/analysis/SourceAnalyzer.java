package com.deepsearch.research.service.analysis;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.AnalysisOptions;
import com.deepsearch.research.dto.analysis.AnalyzedSource;
import com.deepsearch.research.dto.analysis.SourceAnalysis;
import com.deepsearch.research.dto.search.ScrapedSource;
import com.deepsearch.research.service.embedding.EmbeddingCacheService;
import com.deepsearch.research.service.search.PacingPolicy;
import com.deepsearch.research.service.session.SessionStoreService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * 소스 분석기
 *
 * 소스별로 모델 분석, 임베딩(선택), 저장(선택)을 수행합니다.
 * 분석 호출이나 저장에 실패한 소스는 제외되며 다른 소스에는 영향이 없습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceAnalyzer {

    private final LlmAnalysisService llmAnalysisService;
    private final EmbeddingCacheService embeddingCacheService;
    private final SessionStoreService sessionStoreService;
    private final PacingPolicy pacingPolicy;
    private final MeterRegistry meterRegistry;
    private final DeepSearchProperties properties;

    private Counter analysisFailureCounter;

    @PostConstruct
    public void initMetrics() {
        analysisFailureCounter = Counter.builder("deepsearch.analysis.failures")
                .description("Sources dropped during analysis")
                .register(meterRegistry);
    }

    /**
     * 배치 단위 분석. 배치 내부는 동시에 실행되고 남은 소스는 원래 순서를 유지합니다.
     */
    public Mono<List<AnalyzedSource>> analyzeAll(String query, List<ScrapedSource> sources, AnalysisOptions options) {
        int batchSize = Math.max(1, properties.getAnalysis().getParallelism());
        log.info("Analyzing {} sources (batch size {})", sources.size(), batchSize);

        return Flux.fromIterable(sources)
                .buffer(batchSize)
                .index()
                .concatMap(indexed -> {
                    Mono<Void> pause = indexed.getT1() > 0 ? pacingPolicy.betweenBatches() : Mono.empty();
                    return pause.thenMany(Flux.fromIterable(indexed.getT2())
                            .flatMapSequential(source -> analyze(query, source, options), batchSize));
                })
                .collectList()
                .doOnNext(analyzed -> log.info("Analysis finished: {}/{} sources survived",
                        analyzed.size(), sources.size()));
    }

    /**
     * Empty when the source was dropped.
     */
    public Mono<AnalyzedSource> analyze(String query, ScrapedSource source, AnalysisOptions options) {
        return llmAnalysisService.analyzeContent(source.content(), query)
                .flatMap(analysis -> embed(source, analysis, options)
                        .flatMap(embedding -> persist(source, analysis, embedding.orElse(null), options)))
                .onErrorResume(e -> {
                    analysisFailureCounter.increment();
                    log.warn("Dropping source {}: {}", source.url(), e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<Optional<float[]>> embed(ScrapedSource source, SourceAnalysis analysis, AnalysisOptions options) {
        int threshold = properties.getAnalysis().getEmbeddingRelevanceThreshold();
        if (!options.generateEmbeddings() || analysis.relevanceScore() <= threshold) {
            return Mono.just(Optional.empty());
        }

        String input = embeddingCacheService.buildEmbeddingInput(source.title(), source.content());
        return embeddingCacheService.getOrCompute(input)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private Mono<AnalyzedSource> persist(ScrapedSource source, SourceAnalysis analysis, float[] embedding,
                                         AnalysisOptions options) {
        AnalyzedSource analyzed = new AnalyzedSource(source, analysis, embedding);
        if (!options.sessionBacked()) {
            return Mono.just(analyzed);
        }

        return Mono.fromCallable(() -> sessionStoreService.saveSource(options.sessionId(), source, analysis, embedding))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(analyzed);
    }
}
