package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A stored chunk returned by a similarity query.
 */
@Value
@Builder
public class ChunkMatch {

    UUID chunkId;
    KnowledgeCollection collection;
    String sourceRecordId;
    String ref;
    String title;
    int chunkIndex;
    String content;
    ChunkMetadata metadata;

    /**
     * 1 - cosine distance, in [0, 1].
     */
    double similarity;
}
