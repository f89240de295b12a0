package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.search.ScrapedSource;
import com.deepsearch.research.dto.search.SearchHit;
import com.deepsearch.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 웹 페이지 수집기
 *
 * 검색 결과의 페이지를 가져와 본문 텍스트를 추출합니다.
 * HTTP 오류, 타임아웃, 파싱 오류, 텍스트 부족은 모두 빈 Mono로 끝나며
 * 다른 URL 처리에는 영향을 주지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentFetcher {

    private static final String NOISE_SELECTOR =
            "script, style, nav, footer, header, aside, .ads, .advertisement, [class*=ad-banner]";

    private static final List<String> CONTENT_SELECTORS = List.of(
            "article",
            "[role=main]",
            ".content",
            ".post-content",
            ".entry-content",
            "main",
            "#content",
            ".main-content"
    );

    private final WebClient webClient;
    private final DeepSearchProperties properties;

    public Mono<ScrapedSource> fetch(SearchHit hit) {
        log.debug("Scraping: {}", hit.url());

        return webClient.get()
                .uri(hit.url())
                .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() >= 400) {
                        log.warn("Rejected {}: HTTP {}", hit.url(), response.statusCode().value());
                        return response.releaseBody().then(Mono.<String>empty());
                    }
                    return response.bodyToMono(String.class);
                })
                .timeout(properties.getHttp().getTimeout())
                .flatMap(html -> Mono.justOrEmpty(extract(hit, html)))
                .doOnNext(source -> log.debug("Scraped {} ({} words)", source.domain(), source.wordCount()))
                .onErrorResume(e -> {
                    log.warn("Failed to scrape {}: {}", hit.url(), e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Main-content extraction from a fetched page. Empty when the page carries too little text.
     */
    public Optional<ScrapedSource> extract(SearchHit hit, String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }

        DeepSearchProperties.Scrape scrape = properties.getScrape();
        Document doc = Jsoup.parse(html, hit.url());

        String title = normalizeText(doc.title());
        if (title.isEmpty() && hit.title() != null) {
            title = hit.title();
        }
        Element meta = doc.selectFirst("meta[name=description]");
        String description = meta != null ? normalizeText(meta.attr("content")) : "";

        doc.select(NOISE_SELECTOR).remove();

        String content = "";
        for (String selector : CONTENT_SELECTORS) {
            String candidate = normalizeText(doc.select(selector).text());
            if (candidate.length() > content.length()) {
                content = candidate;
            }
        }

        // 본문 영역이 없으면 body 전체 사용
        if (content.length() < scrape.getMinContentLength()) {
            content = doc.body() != null ? normalizeText(doc.body().text()) : "";
        }

        if (content.length() < scrape.getMinContentLength()) {
            log.debug("Skipping page with too short content: {}", hit.url());
            return Optional.empty();
        }

        content = truncate(content, scrape.getMaxContentLength());

        return Optional.of(new ScrapedSource(
                hit.url(),
                UrlNormalizer.extractDomain(hit.url()),
                truncate(title, scrape.getMaxTitleLength()),
                truncate(description, scrape.getMaxDescriptionLength()),
                content,
                countWords(content),
                content.length(),
                Instant.now(),
                hit.searchTerm()
        ));
    }

    private String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    private static int countWords(String text) {
        return text.isEmpty() ? 0 : text.split(" ").length;
    }
}
