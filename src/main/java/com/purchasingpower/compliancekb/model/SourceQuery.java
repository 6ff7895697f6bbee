package com.purchasingpower.compliancekb.model;

import java.time.Instant;

/**
 * Selects the source records of one collection, optionally only those modified after a point
 * in time.
 */
public record SourceQuery(KnowledgeCollection collection, Instant modifiedAfter) {

    public static SourceQuery all(KnowledgeCollection collection) {
        return new SourceQuery(collection, null);
    }

    public static SourceQuery modifiedAfter(KnowledgeCollection collection, Instant watermark) {
        return new SourceQuery(collection, watermark);
    }

    public boolean isIncremental() {
        return modifiedAfter != null;
    }
}
