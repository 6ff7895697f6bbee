package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Bookkeeping row written after all chunks of a record are stored.
 */
@Value
@Builder
public class IndexedRecord {

    String organizationId;
    KnowledgeCollection collection;
    String sourceRecordId;
    int chunkCount;
    Instant sourceLastModified;
}
