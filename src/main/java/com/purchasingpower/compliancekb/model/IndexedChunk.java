package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A chunk ready to be written to the vector store.
 */
@Value
@Builder
public class IndexedChunk {

    String organizationId;
    KnowledgeCollection collection;
    String sourceRecordId;
    int chunkIndex;
    String ref;
    String title;
    String content;
    float[] embedding;
    ChunkMetadata metadata;

    /**
     * Last-modified timestamp of the source record when it was indexed.
     */
    Instant sourceLastModified;
}
