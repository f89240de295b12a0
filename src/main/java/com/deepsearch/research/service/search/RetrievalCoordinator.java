package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.search.DomainCount;
import com.deepsearch.research.dto.search.RetrievalOptions;
import com.deepsearch.research.dto.search.ScrapedSource;
import com.deepsearch.research.dto.search.SearchHit;
import com.deepsearch.research.dto.search.SearchOptions;
import com.deepsearch.research.dto.search.SearchStats;
import com.deepsearch.research.dto.search.SearchTermExpansion;
import com.deepsearch.research.dto.search.WebResults;
import com.deepsearch.research.exception.WebSearchException;
import com.deepsearch.research.service.analysis.LlmAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 웹 검색 코디네이터
 *
 * 쿼리를 수집된 소스 목록으로 바꿉니다.
 * - 검색어 확장
 * - 검색 엔진 호출 (일반 / 변형 검색)
 * - URL 기준 중복 제거 및 도메인 필터링
 * - 청크 단위 페이지 수집
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalCoordinator {

    private static final int TOP_DOMAINS = 10;

    private final LlmAnalysisService llmAnalysisService;
    private final SearchEngineClient searchEngineClient;
    private final ContentFetcher contentFetcher;
    private final DomainPolicy domainPolicy;
    private final PacingPolicy pacingPolicy;
    private final DorkVariants dorkVariants;
    private final DeepSearchProperties properties;

    /**
     * 쿼리의 검색어 목록. 실패하지 않습니다.
     */
    public Mono<SearchTermExpansion> expandTerms(String query) {
        return llmAnalysisService.expandSearchTerms(query)
                .doOnNext(expansion -> log.info("Generated {} search terms for \"{}\"",
                        expansion.searchTerms().size(), query));
    }

    public Mono<WebResults> retrieve(String query, RetrievalOptions options) {
        return expandTerms(query)
                .flatMap(expansion -> retrieve(expansion.searchTerms(), options));
    }

    public Mono<WebResults> retrieve(List<String> terms, RetrievalOptions options) {
        log.info("Starting web search: {} terms, maxResults={}, advanced={}",
                terms.size(), options.maxResults(), options.useAdvancedSearch());

        return Flux.fromIterable(planCalls(terms, options))
                .index()
                .concatMap(indexed -> execute(indexed.getT2(), indexed.getT1() > 0))
                .collectList()
                .map(this::deduplicate)
                .doOnNext(hits -> log.info("Found {} unique search results", hits.size()))
                .map(hits -> hits.stream().filter(hit -> domainPolicy.isAllowed(hit.url())).toList())
                .flatMap(this::scrapeAll)
                .map(sources -> {
                    log.info("Scraping finished: {} pages processed", sources.size());
                    return new WebResults(terms, sources, computeStats(sources));
                })
                .onErrorMap(e -> !(e instanceof WebSearchException), WebSearchException::retrievalFailed);
    }

    /**
     * 한 번의 수집에서 실행할 검색 호출 목록 (실행 순서).
     *
     * 고급 모드에서는 첫 검색어에 모든 변형을 적용하고 예산의 절반을 변형끼리 나누며,
     * 나머지 검색어가 남은 절반을 나눕니다.
     */
    List<ProviderCall> planCalls(List<String> terms, RetrievalOptions options) {
        List<ProviderCall> calls = new ArrayList<>();
        if (terms.isEmpty()) {
            return calls;
        }

        int maxResults = options.maxResults();
        if (!options.useAdvancedSearch()) {
            for (String term : terms) {
                calls.add(new ProviderCall(term, term, null, maxResults));
            }
            return calls;
        }

        String primary = terms.get(0);
        int dorkBudget = ceilDiv(maxResults, 2);
        int perVariant = Math.max(1, ceilDiv(dorkBudget, Math.max(1, dorkVariants.count())));
        for (String dork : dorkVariants.expand(primary)) {
            calls.add(new ProviderCall(dork, primary, dork, perVariant));
        }

        List<String> otherTerms = terms.subList(1, terms.size());
        if (!otherTerms.isEmpty()) {
            int remaining = Math.max(1, maxResults - dorkBudget);
            int perTerm = Math.max(1, ceilDiv(remaining, otherTerms.size()));
            for (String term : otherTerms) {
                calls.add(new ProviderCall(term, term, null, perTerm));
            }
        }
        return calls;
    }

    private Mono<List<SearchHit>> execute(ProviderCall call, boolean notFirst) {
        SearchOptions searchOptions = searchEngineClient.defaultOptions().withMaxResults(call.budget());

        if (call.isDork()) {
            return searchEngineClient.search(call.query(), searchOptions)
                    .map(hits -> tag(hits, call))
                    .flatMap(hits -> pacingPolicy.afterDork().thenReturn(hits));
        }

        Mono<Void> pause = notFirst ? pacingPolicy.beforeNextTerm() : Mono.empty();
        return pause.then(searchEngineClient.search(call.query(), searchOptions))
                .map(hits -> tag(hits, call));
    }

    private List<SearchHit> tag(List<SearchHit> hits, ProviderCall call) {
        return hits.stream().map(hit -> hit.withOrigin(call.term(), call.dork())).toList();
    }

    /**
     * First occurrence of a normalized URL wins
     */
    private List<SearchHit> deduplicate(List<List<SearchHit>> batches) {
        Map<String, SearchHit> unique = new LinkedHashMap<>();
        for (List<SearchHit> batch : batches) {
            for (SearchHit hit : batch) {
                unique.putIfAbsent(hit.url(), hit);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private Mono<List<ScrapedSource>> scrapeAll(List<SearchHit> hits) {
        int chunkSize = Math.max(1, properties.getScrape().getMaxConcurrentScrapes());

        return Flux.fromIterable(hits)
                .buffer(chunkSize)
                .index()
                .concatMap(indexed -> {
                    Mono<Void> pause = indexed.getT1() > 0 ? pacingPolicy.betweenChunks() : Mono.empty();
                    return pause.thenMany(Flux.fromIterable(indexed.getT2())
                            .flatMapSequential(contentFetcher::fetch, chunkSize));
                })
                .collectList();
    }

    SearchStats computeStats(List<ScrapedSource> sources) {
        if (sources.isEmpty()) {
            return SearchStats.empty();
        }

        Map<String, Long> domains = new LinkedHashMap<>();
        long totalContentLength = 0;
        long totalWords = 0;
        for (ScrapedSource source : sources) {
            String domain = source.domain() != null ? source.domain() : "unknown";
            domains.merge(domain, 1L, Long::sum);
            totalContentLength += source.contentLength();
            totalWords += source.wordCount();
        }

        // 안정 정렬: 동률은 처음 나온 순서 유지
        List<DomainCount> topDomains = domains.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_DOMAINS)
                .map(entry -> new DomainCount(entry.getKey(), entry.getValue()))
                .toList();

        int count = sources.size();
        return new SearchStats(
                count,
                domains,
                topDomains,
                Math.round((double) totalContentLength / count),
                totalContentLength,
                totalWords,
                Math.round((double) totalWords / count)
        );
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }

    /**
     * @param query text sent to the provider
     * @param term base search term the call belongs to
     * @param dork refinement variant, or null for a plain term call
     */
    record ProviderCall(String query, String term, String dork, int budget) {
        boolean isDork() {
            return dork != null;
        }
    }
}
