package com.deepsearch.research.service.report;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.AnalysisResult;
import com.deepsearch.research.dto.report.Report;
import com.deepsearch.research.exception.ReportGenerationException;
import com.deepsearch.research.service.analysis.LlmAnalysisService;
import com.deepsearch.research.service.session.SessionStoreService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 리포트 생성기
 *
 * 모델 호출 한 번으로 리서치 결과의 최종 Markdown 리포트를 작성합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportSynthesizer {

    private final LlmAnalysisService llmAnalysisService;
    private final SessionStoreService sessionStoreService;
    private final ReportNaming reportNaming;
    private final ObjectMapper objectMapper;
    private final DeepSearchProperties properties;

    /**
     * 모델 호출 또는 리포트 저장 실패는 모두 {@link ReportGenerationException}으로 보고합니다.
     *
     * @param sessionId 리포트를 연결할 세션, 저장하지 않는 실행이면 null
     */
    public Mono<Report> synthesize(String query, AnalysisResult analysis, UUID sessionId) {
        String sessionRef = sessionId != null ? sessionId.toString() : null;
        log.info("Generating final report for \"{}\" ({} analyzed sources)", query, analysis.successfulAnalyses());

        return Mono.fromCallable(() -> serialize(analysis))
                .flatMap(json -> llmAnalysisService.generateReport(query, json))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Model returned no report content")))
                .map(content -> buildReport(query, content, analysis))
                .flatMap(report -> saveToFile(report).thenReturn(report))
                .flatMap(report -> sessionId == null
                        ? Mono.just(report)
                        : Mono.fromCallable(() -> sessionStoreService.saveReport(sessionId, report))
                                .subscribeOn(Schedulers.boundedElastic())
                                .thenReturn(report))
                .doOnNext(report -> log.info("Report generated: {}", report.filename()))
                .onErrorMap(e -> !(e instanceof ReportGenerationException),
                        e -> ReportGenerationException.synthesisFailed(query, sessionRef, e));
    }

    private String serialize(AnalysisResult analysis) throws JsonProcessingException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("consolidatedAnalysis", analysis.consolidatedAnalysis());
        data.put("totalSources", analysis.totalSources());
        data.put("successfulAnalyses", analysis.successfulAnalyses());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
    }

    private Report buildReport(String query, String content, AnalysisResult analysis) {
        Instant now = Instant.now();
        String filename = reportNaming.filename(query, now);
        String filePath = Paths.get(properties.getReports().getDir(), filename).toString();

        return new Report(
                reportNaming.title(query),
                content,
                filename,
                filePath,
                query,
                now,
                analysis.totalSources(),
                analysis.successfulAnalyses()
        );
    }

    /**
     * Writes the Markdown to the reports directory when auto-save is on. Failures are only logged.
     */
    private Mono<Void> saveToFile(Report report) {
        if (!properties.getReports().isAutoSave()) {
            return Mono.empty();
        }

        return Mono.fromCallable(() -> {
                    Path path = Paths.get(report.filePath());
                    if (path.getParent() != null) {
                        Files.createDirectories(path.getParent());
                    }
                    return Files.writeString(path, report.content(), StandardCharsets.UTF_8);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(path -> log.info("Report saved to {}", path))
                .onErrorResume(e -> {
                    log.warn("Failed to write report file {}: {}", report.filePath(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
