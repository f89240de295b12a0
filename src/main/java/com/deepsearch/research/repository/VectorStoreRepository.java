package com.deepsearch.research.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * pgvector access for the embedding cache and for source embeddings.
 *
 * Vector columns are not mapped by JPA; they are exchanged in pgvector's text form
 * ({@code [x1,x2,...]}) and cast with {@code ?::vector}.
 *
 * Required schema (see schema.sql):
 * embeddings_cache(content_hash UNIQUE, content_preview, embedding vector, model_used, created_at)
 * web_sources.embedding vector
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class VectorStoreRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<CachedEmbedding> findCachedEmbedding(String contentHash) {
        List<CachedEmbedding> rows = jdbcTemplate.query(
                "SELECT content_hash, content_preview, embedding::text AS embedding, model_used, created_at " +
                "FROM embeddings_cache WHERE content_hash = ?",
                (rs, rowNum) -> new CachedEmbedding(
                        rs.getString("content_hash"),
                        rs.getString("content_preview"),
                        parseVector(rs.getString("embedding")),
                        rs.getString("model_used"),
                        toLocalDateTime(rs.getTimestamp("created_at"))
                ),
                contentHash);
        return rows.stream().findFirst();
    }

    /**
     * Insert or overwrite the cached vector for a fingerprint. Last writer wins.
     */
    public void upsertCachedEmbedding(String contentHash, String contentPreview, float[] embedding, String modelUsed) {
        jdbcTemplate.update("""
                INSERT INTO embeddings_cache (content_hash, content_preview, embedding, model_used)
                VALUES (?, ?, ?::vector, ?)
                ON CONFLICT (content_hash) DO UPDATE SET
                    embedding = EXCLUDED.embedding,
                    model_used = EXCLUDED.model_used,
                    created_at = CURRENT_TIMESTAMP
                """,
                contentHash, contentPreview, toVectorLiteral(embedding), modelUsed);
    }

    public long countCachedEmbeddings() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM embeddings_cache", Long.class);
        return count != null ? count : 0L;
    }

    public boolean updateSourceEmbedding(UUID sourceId, float[] embedding) {
        int updated = jdbcTemplate.update(
                "UPDATE web_sources SET embedding = ?::vector WHERE id = ?",
                toVectorLiteral(embedding), sourceId);
        return updated > 0;
    }

    /**
     * Top-K sources by cosine similarity (1 - cosine distance), keeping only those at or
     * above the threshold.
     */
    public List<SimilarSource> findSimilarSources(float[] queryEmbedding, int limit, double threshold) {
        String vector = toVectorLiteral(queryEmbedding);
        return jdbcTemplate.query("""
                SELECT id, session_id, url, title, domain, summary,
                       1 - (embedding <=> ?::vector) AS similarity
                FROM web_sources
                WHERE embedding IS NOT NULL
                  AND 1 - (embedding <=> ?::vector) >= ?
                ORDER BY embedding <=> ?::vector
                LIMIT ?
                """,
                (rs, rowNum) -> new SimilarSource(
                        rs.getObject("id", UUID.class),
                        rs.getObject("session_id", UUID.class),
                        rs.getString("url"),
                        rs.getString("title"),
                        rs.getString("domain"),
                        rs.getString("summary"),
                        rs.getDouble("similarity")
                ),
                vector, vector, threshold, vector, limit);
    }

    public boolean isVectorExtensionAvailable() {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS(SELECT 1 FROM pg_extension WHERE extname = 'vector')", Boolean.class);
        return Boolean.TRUE.equals(exists);
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(vector[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    static float[] parseVector(String literal) {
        if (literal == null || literal.length() < 2) {
            return new float[0];
        }
        String body = literal.substring(1, literal.length() - 1).trim();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }

    // ==================== Inner Classes ====================

    public record CachedEmbedding(
            String contentHash,
            String contentPreview,
            float[] embedding,
            String modelUsed,
            LocalDateTime createdAt
    ) {}

    public record SimilarSource(
            UUID id,
            UUID sessionId,
            String url,
            String title,
            String domain,
            String summary,
            double similarity
    ) {}
}
