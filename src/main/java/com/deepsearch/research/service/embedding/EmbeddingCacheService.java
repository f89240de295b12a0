package com.deepsearch.research.service.embedding;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.repository.VectorStoreRepository;
import com.deepsearch.research.repository.VectorStoreRepository.CachedEmbedding;
import com.deepsearch.research.service.analysis.LlmAnalysisService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * 임베딩 캐시 서비스
 *
 * 임베딩 모델에 보내는 텍스트의 MD5 다이제스트를 키로 사용하므로 같은 텍스트는 한 번만 임베딩됩니다.
 *
 * - 캐시 조회 실패는 미스로, 저장 실패는 건너뜀으로 처리 (호출자는 실패하지 않음)
 * - 설정된 차원과 크기가 다른 벡터는 임베딩 없음으로 처리
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingCacheService {

    private final LlmAnalysisService llmAnalysisService;
    private final VectorStoreRepository vectorStoreRepository;
    private final MeterRegistry meterRegistry;
    private final DeepSearchProperties properties;

    private Counter cacheHitCounter;
    private Counter cacheMissCounter;

    @PostConstruct
    public void initMetrics() {
        cacheHitCounter = Counter.builder("deepsearch.embedding.cache.hit")
                .description("Embeddings served from the cache")
                .register(meterRegistry);

        cacheMissCounter = Counter.builder("deepsearch.embedding.cache.miss")
                .description("Embeddings computed by the model")
                .register(meterRegistry);
    }

    /**
     * Text embedded for a source: title and content, cut to the model input limit.
     */
    public String buildEmbeddingInput(String title, String content) {
        String text = (title != null ? title : "") + "\n\n" + (content != null ? content : "");
        int maxLength = properties.getEmbedding().getMaxInputLength();
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    /**
     * MD5 hex digest of the exact text
     */
    public String fingerprint(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * 캐시된 벡터를 반환하거나, 없으면 새로 계산해 캐시에 저장합니다.
     * 모델이 임베딩을 만들지 못하면 빈 Mono.
     */
    public Mono<float[]> getOrCompute(String text) {
        String hash = fingerprint(text);

        return lookup(hash).flatMap(cached -> {
            if (cached.isPresent()) {
                cacheHitCounter.increment();
                log.debug("Embedding cache hit: {}", hash);
                return Mono.just(cached.get().embedding());
            }
            cacheMissCounter.increment();
            return compute(text, hash);
        });
    }

    private Mono<Optional<CachedEmbedding>> lookup(String hash) {
        return Mono.fromCallable(() -> vectorStoreRepository.findCachedEmbedding(hash)
                        .filter(entry -> entry.embedding() != null && entry.embedding().length > 0))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Embedding cache lookup failed for {}: {}", hash, e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private Mono<float[]> compute(String text, String hash) {
        return llmAnalysisService.generateEmbedding(text)
                .filter(result -> !result.isEmpty())
                .filter(result -> hasConfiguredDimension(hash, result.embedding()))
                .flatMap(result -> store(hash, text, result.embedding(), result.model())
                        .thenReturn(result.embedding()))
                .onErrorResume(e -> {
                    log.warn("Embedding generation failed for {}: {}", hash, e.getMessage());
                    return Mono.empty();
                });
    }

    private boolean hasConfiguredDimension(String hash, float[] embedding) {
        int dimension = properties.getEmbedding().getDimension();
        if (embedding.length != dimension) {
            log.warn("Discarding embedding {}: model returned {} dims, store expects {}",
                    hash, embedding.length, dimension);
            return false;
        }
        return true;
    }

    private Mono<Void> store(String hash, String text, float[] embedding, String model) {
        int previewLength = properties.getEmbedding().getPreviewLength();
        String preview = text.length() > previewLength ? text.substring(0, previewLength) : text;

        return Mono.fromRunnable(() -> vectorStoreRepository.upsertCachedEmbedding(hash, preview, embedding, model))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(v -> log.debug("Cached embedding {} ({} dims, model {})", hash, embedding.length, model))
                .onErrorResume(e -> {
                    log.warn("Failed to cache embedding {}: {}", hash, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
