package com.deepsearch.research.controller;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.DeepSearchOptions;
import com.deepsearch.research.dto.DeepSearchResult;
import com.deepsearch.research.dto.VectorSearchOptions;
import com.deepsearch.research.dto.VectorSearchResult;
import com.deepsearch.research.dto.analysis.AnalysisResult;
import com.deepsearch.research.dto.search.SearchStats;
import com.deepsearch.research.dto.search.SearchTermExpansion;
import com.deepsearch.research.dto.search.WebResults;
import com.deepsearch.research.exception.AnalysisServiceException;
import com.deepsearch.research.exception.InvalidQueryException;
import com.deepsearch.research.exception.SessionNotFoundException;
import com.deepsearch.research.service.DeepSearchOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest({DeepSearchController.class, HealthController.class})
@ActiveProfiles("test")
@Import(DeepSearchProperties.class)
class DeepSearchControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private DeepSearchOrchestrator orchestrator;

    private static DeepSearchResult emptyResult(String query) {
        return new DeepSearchResult(null, query, SearchTermExpansion.fallback(query),
                new WebResults(List.of(query), List.of(), SearchStats.empty()),
                new AnalysisResult(List.of(), null, 0, 0), null);
    }

    @Test
    @DisplayName("POST /api/search - 요청 옵션을 기본값보다 우선 적용해 실행한다")
    void search() {
        when(orchestrator.performDeepSearch(eq("quantum computing"), any(DeepSearchOptions.class)))
                .thenReturn(Mono.just(emptyResult("quantum computing")));

        webTestClient.post()
                .uri("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "quantum computing", "maxSources", 20, "saveToDatabase", false))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.query").isEqualTo("quantum computing")
                .jsonPath("$.searchTerms.search_terms[0]").isEqualTo("quantum computing");

        ArgumentCaptor<DeepSearchOptions> options = ArgumentCaptor.forClass(DeepSearchOptions.class);
        verify(orchestrator).performDeepSearch(eq("quantum computing"), options.capture());
        assertThat(options.getValue()).isEqualTo(new DeepSearchOptions(true, true, 20, false));
    }

    @Test
    @DisplayName("POST /api/search - 빈 쿼리는 400으로 거부된다")
    void searchBlankQuery() {
        webTestClient.post()
                .uri("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "  "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("POST /api/search - 범위를 벗어난 maxSources는 400으로 거부된다")
    void searchInvalidMaxSources() {
        webTestClient.post()
                .uri("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "quantum", "maxSources", 0))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("POST /api/search - 모델 서버 실패는 502로 매핑된다")
    void searchAnalysisFailure() {
        when(orchestrator.performDeepSearch(any(), any()))
                .thenReturn(Mono.error(new AnalysisServiceException("connection refused")));

        webTestClient.post()
                .uri("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "quantum"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("ANALYSIS_SERVICE_ERROR");
    }

    @Test
    @DisplayName("POST /api/vector-search - limit과 threshold를 그대로 전달한다")
    void vectorSearch() {
        when(orchestrator.vectorSearch(eq("qubits"), any(VectorSearchOptions.class)))
                .thenReturn(Mono.just(new VectorSearchResult("qubits", List.of(), 0)));

        webTestClient.post()
                .uri("/api/vector-search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "qubits", "limit", 5, "threshold", 0.8))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalFound").isEqualTo(0);

        verify(orchestrator).vectorSearch("qubits", new VectorSearchOptions(5, 0.8));
    }

    @Test
    @DisplayName("GET /api/session/{id} - 없는 세션은 404")
    void sessionNotFound() {
        UUID id = UUID.randomUUID();
        when(orchestrator.getSessionDetails(id)).thenReturn(Mono.error(SessionNotFoundException.of(id)));

        webTestClient.get()
                .uri("/api/session/{id}", id)
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SESSION_NOT_FOUND")
                .jsonPath("$.sessionId").isEqualTo(id.toString());
    }

    @Test
    @DisplayName("GET /api/history - 기본 조회 개수는 10이다")
    void historyDefaultLimit() {
        when(orchestrator.getSearchHistory(10)).thenReturn(Mono.just(List.of()));

        webTestClient.get()
                .uri("/api/history")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .json("[]");
    }

    @Test
    @DisplayName("POST /api/admin/cleanup - 삭제된 세션 수를 반환한다")
    void cleanup() {
        when(orchestrator.cleanupOldSessions(7)).thenReturn(Mono.just(3));

        webTestClient.post()
                .uri("/api/admin/cleanup?daysOld=7")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deletedSessions").isEqualTo(3)
                .jsonPath("$.daysOld").isEqualTo(7);
    }

    @Test
    @DisplayName("POST /api/admin/cleanup - 잘못된 기간은 400")
    void cleanupInvalid() {
        when(orchestrator.cleanupOldSessions(0))
                .thenReturn(Mono.error(new InvalidQueryException("daysOld must be at least 1")));

        webTestClient.post()
                .uri("/api/admin/cleanup?daysOld=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_QUERY");
    }

    @Test
    @DisplayName("GET /health - 저하 상태는 503")
    void healthDegraded() {
        when(orchestrator.health()).thenReturn(Mono.just(Map.of("status", "DEGRADED")));

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED");
    }

    @Test
    @DisplayName("GET /health - 정상 상태는 200")
    void healthUp() {
        when(orchestrator.health()).thenReturn(Mono.just(Map.of("status", "UP")));

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk();
    }
}
