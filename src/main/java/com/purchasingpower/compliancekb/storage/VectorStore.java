package com.purchasingpower.compliancekb.storage;

import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.IndexedChunk;
import com.purchasingpower.compliancekb.model.IndexedRecord;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Chunk persistence and cosine similarity search.
 *
 * <p>Chunks are keyed by (collection, source record id, chunk index); writing the same key
 * again replaces the row. Results are ordered by cosine distance ascending, ties broken by chunk
 * id, and carry {@code similarity = 1 - distance} clamped to [0, 1].
 */
public interface VectorStore {

    void upsert(IndexedChunk chunk);

    /**
     * Removes chunks with index {@code >= fromIndex}, left over from a longer earlier version.
     *
     * @return rows deleted
     */
    int deleteChunksFrom(KnowledgeCollection collection, String sourceRecordId, int fromIndex);

    default int deleteAllChunks(KnowledgeCollection collection, String sourceRecordId) {
        return deleteChunksFrom(collection, sourceRecordId, 0);
    }

    void markIndexed(IndexedRecord record);

    List<ChunkMatch> search(float[] queryVector, SearchFilter filter, int limit);

    /**
     * Records most similar to the given one, compared on their first chunk.
     *
     * @return empty if the record has no stored chunk 0
     */
    List<ChunkMatch> nearestToRecord(String organizationId,
                                     KnowledgeCollection collection,
                                     String sourceRecordId,
                                     boolean excludeSelf,
                                     int limit);

    /**
     * Latest source last-modified time among stored chunks.
     */
    Optional<Instant> maxWatermark(String organizationId, KnowledgeCollection collection);

    long countIndexedRecords(String organizationId, KnowledgeCollection collection);

    long countChunks(String organizationId, KnowledgeCollection collection);
}
