package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.search.ScrapedSource;
import com.deepsearch.research.dto.search.SearchHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFetcherTest {

    private static final String LONG_TEXT =
            "Quantum computers use qubits that can represent zero and one at the same time, "
            + "which allows certain algorithms to run much faster than on classical machines.";

    private DeepSearchProperties properties;
    private SearchHit hit;

    @BeforeEach
    void setUp() {
        properties = new DeepSearchProperties();
        hit = SearchHit.of("https://www.example.org/article", "Fallback title", "snippet")
                .withOrigin("quantum computing", null);
    }

    private ContentFetcher fetcherReturning(HttpStatus status, String html) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_HTML_VALUE)
                        .body(html)
                        .build()))
                .build();
        return new ContentFetcher(webClient, properties);
    }

    @Test
    @DisplayName("본문 영역 텍스트를 내비게이션 잡음 없이 추출한다")
    void extractsMainContent() {
        // given
        String html = """
                <html><head><title>  Quantum   basics </title>
                <meta name="description" content="An introduction"></head>
                <body>
                  <nav>Home About Contact</nav>
                  <article>%s <script>var tracking = 1;</script></article>
                  <footer>Copyright notice</footer>
                </body></html>
                """.formatted(LONG_TEXT);
        ContentFetcher fetcher = new ContentFetcher(WebClient.builder().build(), properties);

        // when
        Optional<ScrapedSource> result = fetcher.extract(hit, html);

        // then
        assertThat(result).isPresent();
        ScrapedSource source = result.get();
        assertThat(source.title()).isEqualTo("Quantum basics");
        assertThat(source.description()).isEqualTo("An introduction");
        assertThat(source.content()).isEqualTo(LONG_TEXT);
        assertThat(source.content()).doesNotContain("Home About", "tracking", "Copyright");
        assertThat(source.domain()).isEqualTo("www.example.org");
        assertThat(source.searchTerm()).isEqualTo("quantum computing");
        assertThat(source.contentLength()).isEqualTo(LONG_TEXT.length());
        assertThat(source.wordCount()).isEqualTo(LONG_TEXT.split(" ").length);
    }

    @Test
    @DisplayName("가장 긴 본문 영역이 선택된다")
    void longestRegionWins() {
        String html = """
                <html><body>
                  <main>Short main text</main>
                  <div class="post-content">%s</div>
                </body></html>
                """.formatted(LONG_TEXT);
        ContentFetcher fetcher = new ContentFetcher(WebClient.builder().build(), properties);

        Optional<ScrapedSource> result = fetcher.extract(hit, html);

        assertThat(result).map(ScrapedSource::content).contains(LONG_TEXT);
        assertThat(result).map(ScrapedSource::title).contains("Fallback title");
    }

    @Test
    @DisplayName("본문 영역이 없으면 body 텍스트를 사용한다")
    void fallsBackToBody() {
        String html = "<html><body><div><p>" + LONG_TEXT + "</p></div></body></html>";
        ContentFetcher fetcher = new ContentFetcher(WebClient.builder().build(), properties);

        assertThat(fetcher.extract(hit, html)).map(ScrapedSource::content).contains(LONG_TEXT);
    }

    @Test
    @DisplayName("텍스트가 100자 미만인 페이지는 건너뛴다")
    void skipsShortPages() {
        String html = "<html><body><article>Too short to be useful.</article></body></html>";
        ContentFetcher fetcher = new ContentFetcher(WebClient.builder().build(), properties);

        assertThat(fetcher.extract(hit, html)).isEmpty();
        assertThat(fetcher.extract(hit, "")).isEmpty();
    }

    @Test
    @DisplayName("본문은 설정된 길이로 잘린다")
    void truncatesContent() {
        properties.getScrape().setMaxContentLength(120);
        String html = "<html><body><article>" + LONG_TEXT + " " + LONG_TEXT + "</article></body></html>";
        ContentFetcher fetcher = new ContentFetcher(WebClient.builder().build(), properties);

        Optional<ScrapedSource> result = fetcher.extract(hit, html);

        assertThat(result).isPresent();
        assertThat(result.get().content()).hasSize(120);
        assertThat(result.get().contentLength()).isEqualTo(120);
    }

    @Test
    @DisplayName("가져온 페이지가 소스로 변환된다")
    void fetchesPage() {
        ContentFetcher fetcher = fetcherReturning(HttpStatus.OK,
                "<html><body><article>" + LONG_TEXT + "</article></body></html>");

        StepVerifier.create(fetcher.fetch(hit))
                .assertNext(source -> assertThat(source.url()).isEqualTo(hit.url()))
                .verifyComplete();
    }

    @Test
    @DisplayName("오류 상태 코드는 빈 결과로 완료된다")
    void errorStatusIsEmpty() {
        ContentFetcher fetcher = fetcherReturning(HttpStatus.NOT_FOUND,
                "<html><body><article>" + LONG_TEXT + "</article></body></html>");

        StepVerifier.create(fetcher.fetch(hit)).verifyComplete();
    }

    @Test
    @DisplayName("전송 실패는 빈 결과로 완료된다")
    void transportFailureIsEmpty() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new IllegalStateException("connection refused")))
                .build();
        ContentFetcher fetcher = new ContentFetcher(webClient, properties);

        StepVerifier.create(fetcher.fetch(hit)).verifyComplete();
    }
}
