package com.deepsearch.research.dto.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Model assessment of one scraped source. Scores are opaque 0-100 values.
 * A decoded answer that omits a score has a null score and is not usable as is.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceAnalysis(
        @JsonProperty("relevance_score") Integer relevanceScore,
        @JsonProperty("credibility_score") Integer credibilityScore,
        @JsonProperty("summary") String summary,
        @JsonProperty("key_points") List<String> keyPoints,
        @JsonProperty("insights") List<String> insights,
        @JsonProperty("topics") List<String> topics
) {
    public static final int FALLBACK_SCORE = 50;
    private static final int FALLBACK_SUMMARY_LENGTH = 500;

    public SourceAnalysis {
        relevanceScore = clamp(relevanceScore);
        credibilityScore = clamp(credibilityScore);
        summary = summary == null ? "" : summary;
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        insights = insights == null ? List.of() : List.copyOf(insights);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    @JsonIgnore
    public boolean hasScores() {
        return relevanceScore != null && credibilityScore != null;
    }

    /**
     * Neutral analysis for content the model answered on but whose answer could not be decoded.
     */
    public static SourceAnalysis fallback(String content) {
        String text = content == null ? "" : content;
        String summary = text.length() > FALLBACK_SUMMARY_LENGTH
                ? text.substring(0, FALLBACK_SUMMARY_LENGTH) + "..."
                : text;
        return new SourceAnalysis(
                FALLBACK_SCORE,
                FALLBACK_SCORE,
                summary,
                List.of("Content available for analysis"),
                List.of(),
                List.of("general")
        );
    }

    private static Integer clamp(Integer score) {
        return score == null ? null : Math.max(0, Math.min(100, score));
    }
}
