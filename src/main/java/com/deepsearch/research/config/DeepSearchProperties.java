package com.deepsearch.research.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the research pipeline.
 *
 * One nested block per component; every recognized option is listed here with its
 * default so that nothing is read from an implicit map at runtime.
 */
@Configuration
@ConfigurationProperties(prefix = "deepsearch")
@Data
public class DeepSearchProperties {

    private Http http = new Http();

    private Search search = new Search();

    private Scrape scrape = new Scrape();

    private Pacing pacing = new Pacing();

    private Analysis analysis = new Analysis();

    private Embedding embedding = new Embedding();

    private Llm llm = new Llm();

    private Security security = new Security();

    private Reports reports = new Reports();

    private VectorSearch vectorSearch = new VectorSearch();

    @Data
    public static class Http {
        private String userAgent = "DeepSearch Bot 1.0";

        /** Per-call timeout for search queries and page fetches */
        private Duration timeout = Duration.ofSeconds(30);

        private Duration connectTimeout = Duration.ofSeconds(10);

        private int maxRedirects = 5;

        /** Upper bound for a buffered response body */
        private int maxInMemorySize = 8 * 1024 * 1024;
    }

    @Data
    public static class Search {
        private String endpoint = "https://html.duckduckgo.com/html/";

        /** Result budget for one run when the caller gives none */
        private int maxResults = 50;

        private String region = "br-pt";

        private String safeSearch = "moderate";

        private String acceptLanguage = "pt-BR,pt;q=0.9,en;q=0.8";

        /** Query-refinement templates; {q} is replaced by the base term */
        private List<String> dorks = new ArrayList<>(List.of(
                "\"{q}\"",
                "{q} filetype:pdf",
                "{q} site:wikipedia.org",
                "{q} site:edu",
                "{q} site:org",
                "{q} inurl:blog",
                "{q} intitle:\"{q}\""
        ));
    }

    @Data
    public static class Scrape {
        /** Chunk size for concurrent page fetches */
        private int maxConcurrentScrapes = 5;

        private int maxContentLength = 50_000;

        private int minContentLength = 100;

        private int maxTitleLength = 500;

        private int maxDescriptionLength = 1000;
    }

    @Data
    public static class Pacing {
        private Duration betweenTerms = Duration.ofSeconds(1);

        /** Must stay strictly larger than betweenTerms */
        private Duration betweenDorks = Duration.ofSeconds(2);

        private Duration betweenChunks = Duration.ofMillis(500);

        private Duration betweenBatches = Duration.ofSeconds(1);
    }

    @Data
    public static class Analysis {
        /** Batch size for concurrent source analysis */
        private int parallelism = 5;

        /** Sources must score strictly above this to get an embedding */
        private int embeddingRelevanceThreshold = 30;

        /** Content sent to the model for one source is cut to this length */
        private int maxPromptContentLength = 8000;

        private int topItems = 10;
    }

    @Data
    public static class Embedding {
        private int maxInputLength = 8000;

        private int previewLength = 500;

        private int dimension = 768;
    }

    @Data
    public static class Llm {
        private String baseUrl = "http://localhost:11434";

        private String defaultModel = "llama3.1:8b";

        private String embeddingModel = "nomic-embed-text";

        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Security {
        /** "*" means every host is allowed */
        private List<String> allowedDomains = new ArrayList<>(List.of("*"));

        private List<String> blockedDomains = new ArrayList<>(List.of(
                "localhost", "127.0.0.1", "10.*", "192.168.*", "172.16.*"));
    }

    @Data
    public static class Reports {
        private String dir = "./reports";

        private boolean autoSave = false;

        private int maxSlugLength = 50;

        private int maxTitleWords = 8;
    }

    @Data
    public static class VectorSearch {
        private int defaultLimit = 10;

        private int maxLimit = 50;

        private double defaultThreshold = 0.7;

        private double minThreshold = 0.1;
    }
}
