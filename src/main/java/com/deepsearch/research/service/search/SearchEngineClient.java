package com.deepsearch.research.service.search;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.search.SearchHit;
import com.deepsearch.research.dto.search.SearchOptions;
import com.deepsearch.research.util.UrlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * DuckDuckGo HTML 검색 클라이언트
 *
 * 검색 엔진 응답이 실패하거나 비어 있으면 빈 목록을 반환하며 오류로 취급하지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchEngineClient {

    private final WebClient webClient;
    private final DeepSearchProperties properties;

    /**
     * Default options for a single provider call
     */
    public SearchOptions defaultOptions() {
        DeepSearchProperties.Search search = properties.getSearch();
        return new SearchOptions(search.getMaxResults(), search.getRegion(), search.getSafeSearch());
    }

    public Mono<List<SearchHit>> search(String term, SearchOptions options) {
        DeepSearchProperties.Search search = properties.getSearch();

        return Mono.defer(() -> {
                    log.info("Searching provider: \"{}\" (max {})", term, options.maxResults());
                    return webClient.get()
                            .uri(searchUri(search.getEndpoint(), term, options))
                            .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                            .header(HttpHeaders.ACCEPT_LANGUAGE, search.getAcceptLanguage())
                            .retrieve()
                            .bodyToMono(String.class);
                })
                .timeout(properties.getHttp().getTimeout())
                .map(html -> parseResults(html, options.maxResults()))
                .doOnNext(hits -> log.info("Found {} results for \"{}\"", hits.size(), term))
                .onErrorResume(e -> {
                    log.error("Search provider call failed for \"{}\": {}", term, e.getMessage());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    /**
     * Query values are encoded literally, so braces in a term are never taken for URI variables.
     */
    static URI searchUri(String endpoint, String term, SearchOptions options) {
        return UriComponentsBuilder.fromHttpUrl(endpoint)
                .queryParam("q", term)
                .queryParam("kl", options.region())
                .queryParam("safe", options.safeSearch())
                .queryParam("s", 0)
                .queryParam("dc", options.maxResults())
                .build()
                .encode()
                .toUri();
    }

    /**
     * Organic results of a provider result page, normalized and unique by URL, at most {@code maxResults}.
     */
    public List<SearchHit> parseResults(String html, int maxResults) {
        if (html == null || html.isBlank() || maxResults <= 0) {
            return List.of();
        }

        Document doc = Jsoup.parse(html);
        List<SearchHit> hits = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (Element result : doc.select(".result")) {
            if (hits.size() >= maxResults) {
                break;
            }
            if (result.hasClass("result--ad")) {
                continue;
            }

            Element link = result.selectFirst(".result__title a");
            if (link == null) {
                continue;
            }
            String title = link.text().trim();
            String href = link.attr("href");
            if (title.isEmpty() || href.isBlank()) {
                continue;
            }

            Optional<String> url = UrlNormalizer.normalize(href);
            if (url.isEmpty() || !seen.add(url.get())) {
                continue;
            }

            Element snippet = result.selectFirst(".result__snippet");
            hits.add(SearchHit.of(url.get(), title, snippet != null ? snippet.text().trim() : ""));
        }

        return hits;
    }
}
