package com.deepsearch.research.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * 세션에 저장된 수집 페이지
 * The pgvector {@code embedding} column is written and queried through
 * {@link com.deepsearch.research.repository.VectorStoreRepository}, not mapped here.
 */
@Entity
@Table(name = "web_sources", indexes = {
        @Index(name = "idx_web_sources_session_id", columnList = "session_id"),
        @Index(name = "idx_web_sources_domain", columnList = "domain")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSource {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(nullable = false, columnDefinition = "text")
    private String url;

    @Column(columnDefinition = "text")
    private String title;

    @Column(columnDefinition = "text")
    private String content;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(length = 255)
    private String domain;

    @Column(name = "scraped_at")
    private LocalDateTime scrapedAt;

    /**
     * 점수와 출처 정보 (relevance, credibility, 검색어)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
