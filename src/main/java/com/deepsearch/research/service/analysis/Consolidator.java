package com.deepsearch.research.service.analysis;

import com.deepsearch.research.config.DeepSearchProperties;
import com.deepsearch.research.dto.analysis.AnalyzedSource;
import com.deepsearch.research.dto.analysis.ConsolidatedSynthesis;
import com.deepsearch.research.dto.analysis.RankedItem;
import com.deepsearch.research.dto.analysis.SourceAnalysis;
import com.deepsearch.research.dto.analysis.SourceSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 소스별 분석 결과를 모델 호출 없이 통합합니다.
 * 항목 빈도는 해당 항목을 낸 서로 다른 소스의 수입니다.
 * 같은 입력은 항상 같은 결과를 내며 동률은 처음 나온 순서를 유지합니다.
 */
@Component
@RequiredArgsConstructor
public class Consolidator {

    static final int HIGH_RELEVANCE = 70;
    static final int MEDIUM_RELEVANCE = 40;

    private final DeepSearchProperties properties;

    public ConsolidatedSynthesis consolidate(String query, List<AnalyzedSource> analyses) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (AnalyzedSource analyzed : analyses) {
            int relevance = analyzed.analysis().relevanceScore();
            if (relevance >= HIGH_RELEVANCE) {
                high++;
            } else if (relevance >= MEDIUM_RELEVANCE) {
                medium++;
            } else {
                low++;
            }
        }

        int limit = properties.getAnalysis().getTopItems();
        List<SourceSummary> sources = analyses.stream()
                .map(analyzed -> new SourceSummary(
                        analyzed.source().url(),
                        analyzed.source().domain(),
                        analyzed.source().title(),
                        analyzed.analysis().relevanceScore(),
                        analyzed.analysis().credibilityScore(),
                        analyzed.analysis().summary()))
                .toList();

        return new ConsolidatedSynthesis(
                query,
                analyses.size(),
                high,
                medium,
                low,
                topItems(analyses, SourceAnalysis::keyPoints, limit),
                topItems(analyses, SourceAnalysis::insights, limit),
                topItems(analyses, SourceAnalysis::topics, limit),
                sources
        );
    }

    private List<RankedItem> topItems(List<AnalyzedSource> analyses,
                                      Function<SourceAnalysis, List<String>> extractor, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        // 소스당 한 번
        for (AnalyzedSource analyzed : analyses) {
            Set<String> distinct = new LinkedHashSet<>(extractor.apply(analyzed.analysis()));
            for (String item : distinct) {
                if (item != null) {
                    counts.merge(item, 1L, Long::sum);
                }
            }
        }

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(entry -> new RankedItem(entry.getKey(), entry.getValue()))
                .toList();
    }
}
