package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.search.SearchHit;
import com.deepsearch.research.dto.search.SearchOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SearchEngineClientTest {

    private static final String RESULT_PAGE = """
            <html><body>
              <div class="result results_links result--ad">
                <h2 class="result__title"><a href="https://ads.example.com/buy">Sponsored offer</a></h2>
                <a class="result__snippet">Buy now</a>
              </div>
              <div class="result results_links">
                <h2 class="result__title">
                  <a href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fen.wikipedia.org%2Fwiki%2FQuantum_computing&rut=1">Quantum computing - Wikipedia</a>
                </h2>
                <a class="result__snippet">A quantum computer is a computer that exploits quantum mechanical phenomena.</a>
              </div>
              <div class="result results_links">
                <h2 class="result__title"><a href="https://EN.wikipedia.org/wiki/Quantum_computing#History">Duplicate</a></h2>
              </div>
              <div class="result results_links">
                <h2 class="result__title"><a href="https://www.ibm.com/topics/quantum-computing">What is quantum computing? | IBM</a></h2>
                <a class="result__snippet">Quantum computing uses qubits.</a>
              </div>
              <div class="result results_links">
                <h2 class="result__title"><a href="">No link</a></h2>
              </div>
            </body></html>
            """;

    private final DeepSearchProperties properties = new DeepSearchProperties();

    @Test
    @DisplayName("광고를 제외한 결과만 파싱하고 URL 기준으로 유일하게 만든다")
    void parsesOrganicResults() {
        SearchEngineClient client = new SearchEngineClient(WebClient.builder().build(), properties);

        List<SearchHit> hits = client.parseResults(RESULT_PAGE, 10);

        assertThat(hits).extracting(SearchHit::url).containsExactly(
                "https://en.wikipedia.org/wiki/Quantum_computing",
                "https://www.ibm.com/topics/quantum-computing");
        assertThat(hits.get(0).title()).isEqualTo("Quantum computing - Wikipedia");
        assertThat(hits.get(0).snippet()).startsWith("A quantum computer");
        assertThat(hits.get(1).snippet()).isEqualTo("Quantum computing uses qubits.");
    }

    @Test
    @DisplayName("검색 결과는 요청한 최대 개수로 제한된다")
    void capsResults() {
        SearchEngineClient client = new SearchEngineClient(WebClient.builder().build(), properties);

        assertThat(client.parseResults(RESULT_PAGE, 1)).hasSize(1);
        assertThat(client.parseResults("", 10)).isEmpty();
    }

    @Test
    @DisplayName("검색 호출은 쿼리 파라미터를 보내고 결과 페이지를 파싱한다")
    void searchSendsParameters() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                            .body(RESULT_PAGE)
                            .build());
                })
                .build();
        SearchEngineClient client = new SearchEngineClient(webClient, properties);

        StepVerifier.create(client.search("quantum computing", new SearchOptions(5, "br-pt", "moderate")))
                .assertNext(hits -> assertThat(hits).hasSize(2))
                .verifyComplete();

        String query = captured.get().url().getRawQuery();
        assertThat(query).contains("q=quantum%20computing", "kl=br-pt", "safe=moderate", "s=0", "dc=5");
    }

    @Test
    @DisplayName("검색어의 중괄호는 URI 변수로 해석되지 않고 그대로 전송된다")
    void searchEncodesBraces() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                            .body(RESULT_PAGE)
                            .build());
                })
                .build();
        SearchEngineClient client = new SearchEngineClient(webClient, properties);

        StepVerifier.create(client.search("python f-string {name} syntax", client.defaultOptions()))
                .assertNext(hits -> assertThat(hits).hasSize(2))
                .verifyComplete();

        assertThat(captured.get().url().getRawQuery()).contains("q=python%20f-string%20%7Bname%7D%20syntax");
    }

    @Test
    @DisplayName("요청을 만들 수 없으면 빈 결과를 반환한다")
    void unbuildableRequestIsEmpty() {
        properties.getSearch().setEndpoint("not a url");
        SearchEngineClient client = new SearchEngineClient(WebClient.builder().build(), properties);

        StepVerifier.create(client.search("anything", client.defaultOptions()))
                .assertNext(hits -> assertThat(hits).isEmpty())
                .verifyComplete();
    }

    @Test
    @DisplayName("검색 엔진 오류 시 빈 결과를 반환한다")
    void providerErrorIsEmpty() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()))
                .build();
        SearchEngineClient client = new SearchEngineClient(webClient, properties);

        StepVerifier.create(client.search("anything", client.defaultOptions()))
                .assertNext(hits -> assertThat(hits).isEmpty())
                .verifyComplete();
    }
}
