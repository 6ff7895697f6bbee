package com.purchasingpower.compliancekb.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.ChunkMetadata;
import com.purchasingpower.compliancekb.model.IndexedChunk;
import com.purchasingpower.compliancekb.model.IndexedRecord;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link VectorStore} on PostgreSQL with the pgvector extension.
 *
 * <p>Vectors travel as a bound pgvector literal ({@code [0.1,0.2,...]}) cast to {@code vector};
 * metadata travels as JSON cast to {@code jsonb}. {@code <=>} is pgvector's cosine distance.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PgVectorStore implements VectorStore {

    private static final String SELECT_COLUMNS = """
            c.id, c.collection, c.source_record_id, c.ref, c.title, c.chunk_index, c.content,
            CAST(c.metadata AS text) AS metadata_json
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    @Override
    public void upsert(IndexedChunk chunk) {
        Preconditions.checkNotNull(chunk.getEmbedding(), "embedding");

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("org", chunk.getOrganizationId())
                .addValue("collection", chunk.getCollection().name())
                .addValue("recordId", chunk.getSourceRecordId())
                .addValue("chunkIndex", chunk.getChunkIndex())
                .addValue("ref", chunk.getRef())
                .addValue("title", chunk.getTitle())
                .addValue("content", chunk.getContent())
                .addValue("embedding", toVectorLiteral(chunk.getEmbedding()))
                .addValue("metadata", toJson(chunk.getMetadata()))
                .addValue("lastModified", toTimestamp(chunk.getSourceLastModified()));

        jdbc.update("""
                INSERT INTO knowledge_chunks (organization_id, collection, source_record_id, chunk_index,
                    ref, title, content, embedding, metadata, source_last_modified, created_at, updated_at)
                VALUES (:org, :collection, :recordId, :chunkIndex, :ref, :title, :content,
                    CAST(:embedding AS vector), CAST(:metadata AS jsonb), :lastModified, NOW(), NOW())
                ON CONFLICT (collection, source_record_id, chunk_index) DO UPDATE SET
                    organization_id = EXCLUDED.organization_id,
                    ref = EXCLUDED.ref,
                    title = EXCLUDED.title,
                    content = EXCLUDED.content,
                    embedding = EXCLUDED.embedding,
                    metadata = EXCLUDED.metadata,
                    source_last_modified = EXCLUDED.source_last_modified,
                    updated_at = NOW()
                """, params);
    }

    @Override
    public int deleteChunksFrom(KnowledgeCollection collection, String sourceRecordId, int fromIndex) {
        return jdbc.update("""
                DELETE FROM knowledge_chunks
                WHERE collection = :collection AND source_record_id = :recordId AND chunk_index >= :fromIndex
                """, new MapSqlParameterSource()
                .addValue("collection", collection.name())
                .addValue("recordId", sourceRecordId)
                .addValue("fromIndex", fromIndex));
    }

    @Override
    public void markIndexed(IndexedRecord record) {
        jdbc.update("""
                INSERT INTO indexed_records (collection, source_record_id, organization_id, chunk_count,
                    source_last_modified, indexed_at)
                VALUES (:collection, :recordId, :org, :chunkCount, :lastModified, NOW())
                ON CONFLICT (collection, source_record_id) DO UPDATE SET
                    organization_id = EXCLUDED.organization_id,
                    chunk_count = EXCLUDED.chunk_count,
                    source_last_modified = EXCLUDED.source_last_modified,
                    indexed_at = NOW()
                """, new MapSqlParameterSource()
                .addValue("collection", record.getCollection().name())
                .addValue("recordId", record.getSourceRecordId())
                .addValue("org", record.getOrganizationId())
                .addValue("chunkCount", record.getChunkCount())
                .addValue("lastModified", toTimestamp(record.getSourceLastModified())));
    }

    @Override
    public List<ChunkMatch> search(float[] queryVector, SearchFilter filter, int limit) {
        Preconditions.checkNotNull(filter.getOrganizationId(), "organizationId is required");
        Preconditions.checkArgument(limit > 0, "limit must be positive");

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query", toVectorLiteral(queryVector))
                .addValue("org", filter.getOrganizationId())
                .addValue("limit", limit);

        StringBuilder where = new StringBuilder("c.organization_id = :org AND c.embedding IS NOT NULL");
        if (filter.getCollection() != null) {
            where.append(" AND c.collection = :collection");
            params.addValue("collection", filter.getCollection().name());
        }
        if (filter.getStatus() != null) {
            where.append(" AND c.metadata ->> 'status' = :status");
            params.addValue("status", filter.getStatus());
        }
        if (filter.getTeam() != null) {
            where.append(" AND c.metadata ->> 'team' = :team");
            params.addValue("team", filter.getTeam());
        }
        if (filter.getFolderId() != null) {
            where.append(" AND c.metadata ->> 'folderId' = :folder");
            params.addValue("folder", filter.getFolderId());
        }

        String sql = "SELECT " + SELECT_COLUMNS
                + ", (c.embedding <=> CAST(:query AS vector)) AS distance"
                + " FROM knowledge_chunks c WHERE " + where
                + " ORDER BY distance ASC, c.id ASC LIMIT :limit";

        return jdbc.query(sql, params, matchMapper());
    }

    @Override
    public List<ChunkMatch> nearestToRecord(String organizationId,
                                            KnowledgeCollection collection,
                                            String sourceRecordId,
                                            boolean excludeSelf,
                                            int limit) {
        Preconditions.checkArgument(limit > 0, "limit must be positive");

        String sql = "SELECT " + SELECT_COLUMNS + """
                , (c.embedding <=> s.embedding) AS distance
                FROM knowledge_chunks c
                JOIN (
                    SELECT embedding FROM knowledge_chunks
                    WHERE organization_id = :org AND collection = :collection
                      AND source_record_id = :recordId AND chunk_index = 0
                ) s ON s.embedding IS NOT NULL
                WHERE c.organization_id = :org AND c.collection = :collection
                  AND c.chunk_index = 0 AND c.embedding IS NOT NULL
                """
                + (excludeSelf ? " AND c.source_record_id <> :recordId" : "")
                + " ORDER BY distance ASC, c.id ASC LIMIT :limit";

        return jdbc.query(sql, new MapSqlParameterSource()
                .addValue("org", organizationId)
                .addValue("collection", collection.name())
                .addValue("recordId", sourceRecordId)
                .addValue("limit", limit), matchMapper());
    }

    @Override
    public Optional<Instant> maxWatermark(String organizationId, KnowledgeCollection collection) {
        Timestamp max = jdbc.queryForObject("""
                SELECT MAX(source_last_modified) FROM knowledge_chunks
                WHERE organization_id = :org AND collection = :collection
                """, scope(organizationId, collection), Timestamp.class);
        return Optional.ofNullable(max).map(Timestamp::toInstant);
    }

    @Override
    public long countIndexedRecords(String organizationId, KnowledgeCollection collection) {
        Long count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM indexed_records
                WHERE organization_id = :org AND collection = :collection
                """, scope(organizationId, collection), Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public long countChunks(String organizationId, KnowledgeCollection collection) {
        Long count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM knowledge_chunks
                WHERE organization_id = :org AND collection = :collection
                """, scope(organizationId, collection), Long.class);
        return count != null ? count : 0L;
    }

    private static MapSqlParameterSource scope(String organizationId, KnowledgeCollection collection) {
        return new MapSqlParameterSource()
                .addValue("org", organizationId)
                .addValue("collection", collection.name());
    }

    private RowMapper<ChunkMatch> matchMapper() {
        return (rs, rowNum) -> ChunkMatch.builder()
                .chunkId(rs.getObject("id", UUID.class))
                .collection(KnowledgeCollection.valueOf(rs.getString("collection")))
                .sourceRecordId(rs.getString("source_record_id"))
                .ref(rs.getString("ref"))
                .title(rs.getString("title"))
                .chunkIndex(rs.getInt("chunk_index"))
                .content(rs.getString("content"))
                .metadata(readMetadata(rs))
                .similarity(toSimilarity(rs.getDouble("distance")))
                .build();
    }

    private ChunkMetadata readMetadata(ResultSet rs) throws SQLException {
        String json = rs.getString("metadata_json");
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ChunkMetadata.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable chunk metadata for {}: {}", rs.getString("ref"), e.getMessage());
            return null;
        }
    }

    private String toJson(ChunkMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize chunk metadata", e);
        }
    }

    static double toSimilarity(double distance) {
        return Math.max(0.0, Math.min(1.0, 1.0 - distance));
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
