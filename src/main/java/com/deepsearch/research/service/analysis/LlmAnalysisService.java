package com.deepsearch.research.service.analysis;

import com.deepsearch.research.client.OllamaClient;
import com.deepsearch.research.client.OllamaClient.GenerationOptions;
import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.EmbeddingResult;
import com.deepsearch.research.dto.analysis.SourceAnalysis;
import com.deepsearch.research.dto.search.SearchTermExpansion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * LLM 분석 서비스
 *
 * 검색어 확장, 소스별 분석, 리포트 작성, 임베딩 생성을 담당합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmAnalysisService {

    static final int MAX_SEARCH_TERMS = 10;

    private static final GenerationOptions EXPAND_OPTIONS = GenerationOptions.of(0.3, 1000);
    private static final GenerationOptions ANALYZE_OPTIONS = GenerationOptions.of(0.2, 2000);
    private static final GenerationOptions REPORT_OPTIONS = GenerationOptions.of(0.4, 6000)
            .withSystem("You are a research specialist who writes detailed, well-structured reports.");

    private final OllamaClient ollamaClient;
    private final LlmResponseParser responseParser;
    private final DeepSearchProperties properties;

    /**
     * 쿼리 검색어 확장. 오류 시 {@link SearchTermExpansion#fallback}을 반환하며 실패하지 않습니다.
     */
    public Mono<SearchTermExpansion> expandSearchTerms(String query) {
        String prompt = """
                Analyze the following query and generate optimized search terms to find relevant information on the web.

                Query: "%s"

                Instructions:
                1. Generate between 5 and 10 related search terms
                2. Include synonyms and variations of the original query
                3. Consider both technical and popular terms

                Answer only with JSON in the format:
                {
                  "original_query": "original query",
                  "search_terms": ["term1", "term2", "term3"],
                  "categories": ["category1", "category2"]
                }
                """.formatted(query);

        return ollamaClient.generate(prompt, EXPAND_OPTIONS)
                .map(generation -> responseParser.parse(generation.text(), SearchTermExpansion.class)
                        .map(expansion -> sanitize(query, expansion))
                        .orElseGet(() -> {
                            log.warn("Unusable term expansion for \"{}\", using the query alone", query);
                            return SearchTermExpansion.fallback(query);
                        }))
                .onErrorResume(e -> {
                    log.warn("Term expansion failed for \"{}\": {}", query, e.getMessage());
                    return Mono.just(SearchTermExpansion.fallback(query));
                })
                .defaultIfEmpty(SearchTermExpansion.fallback(query));
    }

    /**
     * 페이지 한 건 분석. 호출 실패는 전파하고, 디코딩할 수 없거나 점수가 빠진 응답은
     * {@link SourceAnalysis#fallback}으로 대체합니다.
     */
    public Mono<SourceAnalysis> analyzeContent(String content, String query) {
        int maxLength = properties.getAnalysis().getMaxPromptContentLength();
        String excerpt = content.length() > maxLength
                ? content.substring(0, maxLength) + " ...[truncated]"
                : content;

        String prompt = """
                Analyze the following web content in the context of the query "%s":

                CONTENT:
                %s

                Instructions:
                1. Extract information relevant to the query
                2. Identify key points and insights
                3. Assess the credibility of the source
                4. Write a structured summary

                Answer in JSON format:
                {
                  "relevance_score": 0-100,
                  "key_points": ["point1", "point2"],
                  "summary": "summary of the content",
                  "insights": ["insight1", "insight2"],
                  "credibility_score": 0-100,
                  "topics": ["topic1", "topic2"]
                }
                """.formatted(query, excerpt);

        return ollamaClient.generate(prompt, ANALYZE_OPTIONS)
                .map(generation -> responseParser.parse(generation.text(), SourceAnalysis.class)
                        .filter(analysis -> {
                            if (!analysis.hasScores()) {
                                log.warn("Model analysis is missing a score, using fallback analysis");
                            }
                            return analysis.hasScores();
                        })
                        .orElseGet(() -> SourceAnalysis.fallback(content)));
    }

    /**
     * Markdown report built from the consolidated analysis data (already serialized as JSON).
     */
    public Mono<String> generateReport(String query, String analysisJson) {
        String prompt = """
                Write a detailed report based on the research about: "%s"

                ANALYSIS DATA:
                %s

                Instructions:
                1. Write a structured report in Markdown
                2. Include the sections: Introduction, Main Findings, Insights, Conclusions
                3. Use appropriate Markdown formatting
                4. Cite the sources where relevant
                5. Keep a professional but accessible tone

                Answer only with the Markdown content of the report.
                """.formatted(query, analysisJson);

        return ollamaClient.generate(prompt, REPORT_OPTIONS)
                .map(OllamaClient.Generation::text);
    }

    public Mono<EmbeddingResult> generateEmbedding(String text) {
        return ollamaClient.embed(text);
    }

    private SearchTermExpansion sanitize(String query, SearchTermExpansion expansion) {
        Set<String> terms = new LinkedHashSet<>();
        for (String term : expansion.searchTerms()) {
            if (term != null && !term.isBlank()) {
                terms.add(term.trim());
            }
            if (terms.size() == MAX_SEARCH_TERMS) {
                break;
            }
        }
        if (terms.isEmpty()) {
            log.warn("Model returned no search terms for \"{}\"", query);
            return SearchTermExpansion.fallback(query);
        }

        List<String> categories = expansion.categories().isEmpty()
                ? List.of(SearchTermExpansion.FALLBACK_CATEGORY)
                : expansion.categories();
        return new SearchTermExpansion(query, List.copyOf(terms), categories);
    }
}
