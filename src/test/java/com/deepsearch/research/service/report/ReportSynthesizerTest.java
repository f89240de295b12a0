package com.deepsearch.research.service.report;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.AnalysisResult;
import com.deepsearch.research.dto.analysis.ConsolidatedSynthesis;
import com.deepsearch.research.dto.analysis.RankedItem;
import com.deepsearch.research.dto.report.Report;
import com.deepsearch.research.exception.AnalysisServiceException;
import com.deepsearch.research.exception.ReportGenerationException;
import com.deepsearch.research.service.analysis.LlmAnalysisService;
import com.deepsearch.research.service.session.SessionStoreService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportSynthesizerTest {

    @Mock
    private LlmAnalysisService llmAnalysisService;

    @Mock
    private SessionStoreService sessionStoreService;

    @TempDir
    Path reportsDir;

    private DeepSearchProperties properties;
    private ReportSynthesizer reportSynthesizer;
    private AnalysisResult analysis;

    @BeforeEach
    void setUp() {
        properties = new DeepSearchProperties();
        properties.getReports().setDir(reportsDir.toString());
        reportSynthesizer = new ReportSynthesizer(llmAnalysisService, sessionStoreService,
                new ReportNaming(properties), new ObjectMapper().findAndRegisterModules(), properties);

        ConsolidatedSynthesis synthesis = new ConsolidatedSynthesis("quantum computing", 2, 1, 1, 0,
                List.of(new RankedItem("qubits", 2)), List.of(), List.of(new RankedItem("physics", 1)), List.of());
        analysis = new AnalysisResult(List.of(), synthesis, 3, 2);
    }

    @Test
    @DisplayName("모델 응답으로 리포트를 만들고 세션에 연결한다")
    void buildsAndStoresReport() {
        // given
        UUID sessionId = UUID.randomUUID();
        when(llmAnalysisService.generateReport(eq("quantum computing"), any()))
                .thenReturn(Mono.just("# Quantum computing\n\nFindings"));

        // when / then
        StepVerifier.create(reportSynthesizer.synthesize("quantum computing", analysis, sessionId))
                .assertNext(report -> {
                    assertThat(report.title()).isEqualTo("Quantum Computing");
                    assertThat(report.content()).startsWith("# Quantum computing");
                    assertThat(report.filename()).matches("\\d{12}_quantum_computing\\.md");
                    assertThat(report.filePath()).isEqualTo(reportsDir.resolve(report.filename()).toString());
                    assertThat(report.sourceCount()).isEqualTo(3);
                    assertThat(report.successfulAnalyses()).isEqualTo(2);
                })
                .verifyComplete();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(llmAnalysisService).generateReport(eq("quantum computing"), json.capture());
        assertThat(json.getValue()).contains("\"consolidatedAnalysis\"", "\"qubits\"", "\"successfulAnalyses\" : 2");
        verify(sessionStoreService).saveReport(eq(sessionId), any(Report.class));
    }

    @Test
    @DisplayName("자동 저장 시 Markdown 파일을 기록한다")
    void autoSavesFile() throws Exception {
        properties.getReports().setAutoSave(true);
        when(llmAnalysisService.generateReport(any(), any())).thenReturn(Mono.just("# Saved report"));

        Report report = reportSynthesizer.synthesize("quantum computing", analysis, null).block();

        assertThat(report).isNotNull();
        assertThat(Files.readString(Path.of(report.filePath()))).isEqualTo("# Saved report");
        verifyNoInteractions(sessionStoreService);
    }

    @Test
    @DisplayName("모델 실패는 ReportGenerationException으로 보고된다")
    void modelFailure() {
        when(llmAnalysisService.generateReport(any(), any()))
                .thenReturn(Mono.error(AnalysisServiceException.emptyResponse("/api/generate")));

        StepVerifier.create(reportSynthesizer.synthesize("quantum computing", analysis, null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ReportGenerationException.class);
                    assertThat(e.getCause()).isInstanceOf(AnalysisServiceException.class);
                })
                .verify();
    }

    @Test
    @DisplayName("리포트 저장 실패는 합성 실패로 이어진다")
    void persistenceFailure() {
        UUID sessionId = UUID.randomUUID();
        when(llmAnalysisService.generateReport(any(), any())).thenReturn(Mono.just("# Report"));
        when(sessionStoreService.saveReport(eq(sessionId), any())).thenThrow(new IllegalStateException("db down"));

        StepVerifier.create(reportSynthesizer.synthesize("quantum computing", analysis, sessionId))
                .expectError(ReportGenerationException.class)
                .verify();
    }
}
