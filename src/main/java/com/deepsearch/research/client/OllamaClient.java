package com.deepsearch.research.client;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.EmbeddingResult;
import com.deepsearch.research.exception.AnalysisServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama 서버 클라이언트
 *
 * Endpoints:
 *   POST /api/generate   - {model, prompt, system, options{temperature, num_predict}, stream=false}
 *   POST /api/embeddings - {model, prompt} -> {embedding: [...]}
 *   GET  /api/tags       - installed models
 *
 * 전송 오류와 HTTP 오류는 모두 {@link AnalysisServiceException}으로 변환됩니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OllamaClient {

    private final ObjectMapper objectMapper;
    private final DeepSearchProperties properties;

    private WebClient ollamaWebClient;

    @PostConstruct
    public void init() {
        DeepSearchProperties.Llm llm = properties.getLlm();
        long timeoutSeconds = llm.getTimeout().toSeconds();

        // 생성 호출은 페이지 수집보다 훨씬 오래 걸리므로 별도 클라이언트 사용
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getHttp().getConnectTimeout().toMillis())
                .responseTimeout(llm.getTimeout())
                .doOnConnected(conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(llm.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(properties.getHttp().getMaxInMemorySize()))
                .build();

        log.info("OllamaClient initialized with timeout: {}s, baseUrl: {}, model: {}",
                timeoutSeconds, llm.getBaseUrl(), llm.getDefaultModel());
    }

    public String getDefaultModel() {
        return properties.getLlm().getDefaultModel();
    }

    public String getEmbeddingModel() {
        return properties.getLlm().getEmbeddingModel();
    }

    /**
     * 스트리밍 없이 한 번에 생성
     */
    public Mono<Generation> generate(String prompt, GenerationOptions options) {
        String model = options.model() != null ? options.model() : getDefaultModel();

        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("prompt", prompt);
        if (options.system() != null) {
            payload.put("system", options.system());
        }
        payload.put("options", Map.of(
                "temperature", options.temperature(),
                "num_predict", options.maxTokens()
        ));
        payload.put("stream", false);

        log.info("Generating with model {} (prompt {} chars, temperature {}, maxTokens {})",
                model, prompt.length(), options.temperature(), options.maxTokens());
        long start = System.currentTimeMillis();

        return post("/api/generate", payload)
                .map(node -> {
                    if (node.hasNonNull("error")) {
                        throw new AnalysisServiceException("Generation failed: " + node.get("error").asText());
                    }
                    String text = node.path("response").asText("");
                    if (text.isBlank()) {
                        throw AnalysisServiceException.emptyResponse("/api/generate");
                    }
                    long elapsed = System.currentTimeMillis() - start;
                    log.info("Generated {} chars in {}ms", text.length(), elapsed);
                    return new Generation(text, model, elapsed, node.path("done").asBoolean(true));
                });
    }

    /**
     * Embedding vector for the text with the configured embedding model.
     */
    public Mono<EmbeddingResult> embed(String text) {
        String model = getEmbeddingModel();
        return post("/api/embeddings", Map.of("model", model, "prompt", text))
                .map(node -> {
                    if (node.hasNonNull("error")) {
                        throw new AnalysisServiceException("Embedding failed: " + node.get("error").asText());
                    }
                    JsonNode values = node.path("embedding");
                    if (!values.isArray() || values.isEmpty()) {
                        throw AnalysisServiceException.emptyResponse("/api/embeddings");
                    }
                    float[] embedding = new float[values.size()];
                    for (int i = 0; i < values.size(); i++) {
                        embedding[i] = (float) values.get(i).asDouble();
                    }
                    return new EmbeddingResult(embedding, model, text.length());
                });
    }

    public Mono<List<ModelInfo>> listModels() {
        return ollamaWebClient.get()
                .uri("/api/tags")
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getLlm().getTimeout())
                .map(this::parseModels)
                .onErrorMap(e -> !(e instanceof AnalysisServiceException), e -> translate("/api/tags", e));
    }

    /**
     * 모델 목록 조회에 응답하면 true
     */
    public Mono<Boolean> isHealthy() {
        return listModels()
                .map(models -> true)
                .onErrorResume(e -> {
                    log.warn("Ollama health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<JsonNode> post(String endpoint, Object payload) {
        return ollamaWebClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(properties.getLlm().getTimeout())
                .switchIfEmpty(Mono.error(() -> AnalysisServiceException.emptyResponse(endpoint)))
                .map(this::readTree)
                .onErrorMap(e -> !(e instanceof AnalysisServiceException), e -> translate(endpoint, e))
                .doOnError(e -> log.error("Ollama request {} failed: {}", endpoint, e.getMessage()));
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AnalysisServiceException("Unreadable analysis service response", e);
        }
    }

    private List<ModelInfo> parseModels(String json) {
        List<ModelInfo> models = new ArrayList<>();
        for (JsonNode model : readTree(json).path("models")) {
            long size = model.path("size").asLong(0);
            models.add(new ModelInfo(
                    model.path("name").asText(),
                    size,
                    formatSize(size),
                    model.path("modified_at").asText(null)
            ));
        }
        return models;
    }

    private AnalysisServiceException translate(String endpoint, Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            return AnalysisServiceException.httpError(endpoint, wcre.getStatusCode().value(), wcre.getResponseBodyAsString());
        }
        return AnalysisServiceException.callFailed(endpoint, e);
    }

    static String formatSize(long bytes) {
        String[] units = {"B", "KB", "MB", "GB"};
        if (bytes <= 0) return "0 B";
        int i = Math.min(units.length - 1, (int) (Math.log(bytes) / Math.log(1024)));
        double value = Math.round(bytes / Math.pow(1024, i) * 100) / 100.0;
        return value + " " + units[i];
    }

    // ==================== Inner Classes ====================

    /**
     * @param model null selects the default model
     * @param system optional system prompt
     */
    public record GenerationOptions(
            String model,
            String system,
            double temperature,
            int maxTokens
    ) {
        public static GenerationOptions of(double temperature, int maxTokens) {
            return new GenerationOptions(null, null, temperature, maxTokens);
        }

        public GenerationOptions withSystem(String system) {
            return new GenerationOptions(model, system, temperature, maxTokens);
        }
    }

    public record Generation(
            String text,
            String model,
            long processingTimeMs,
            boolean done
    ) {}

    public record ModelInfo(
            String name,
            long sizeBytes,
            String size,
            String modifiedAt
    ) {}
}
