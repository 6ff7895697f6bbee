package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A ticket or document owned by a source system. Read-only to this service.
 */
@Value
@Builder
public class SourceRecord {

    KnowledgeCollection collection;

    /**
     * Stable id in the source system. Unique within a collection.
     */
    String externalId;

    /**
     * Human reference, e.g. {@code I-000123}, or the file name of a document.
     */
    String ref;

    String title;

    /**
     * Description as delivered by the source, possibly HTML. For documents, the extracted plain
     * text body.
     */
    String description;

    /**
     * Fallback plan of a change, possibly HTML. Null for incidents.
     */
    String fallbackPlan;

    Instant lastModified;

    /**
     * Why the body could not be read, when it could not. Such records are counted as errors and
     * left unindexed.
     */
    String contentError;

    @Builder.Default
    RecordAttributes attributes = RecordAttributes.empty();

    @Singular
    List<RecordLogEntry> logEntries;
}
