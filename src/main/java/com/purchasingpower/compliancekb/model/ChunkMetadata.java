package com.purchasingpower.compliancekb.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Typed side-record stored with every chunk. Copied from the source record at index time so
 * search results can be filtered and displayed without calling the source system.
 *
 * <p>Serialized as JSON. Bump {@link #CURRENT_VERSION} when fields change meaning.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkMetadata {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    int schemaVersion = CURRENT_VERSION;

    String status;
    String category;
    String priority;
    String impact;
    String urgency;
    String team;
    String agent;
    String service;
    String origin;
    String caller;
    String supervisor;
    String outage;
    String startDate;
    String folderId;
    String mimeType;
    String link;
    int logEntryCount;

    public static ChunkMetadata from(SourceRecord record) {
        RecordAttributes a = record.getAttributes() != null ? record.getAttributes() : RecordAttributes.empty();
        return ChunkMetadata.builder()
                .status(a.getStatus())
                .category(a.getCategory())
                .priority(a.getPriority())
                .impact(a.getImpact())
                .urgency(a.getUrgency())
                .team(a.getTeam())
                .agent(a.getAgent())
                .service(a.getService())
                .origin(a.getOrigin())
                .caller(a.getCaller())
                .supervisor(a.getSupervisor())
                .outage(a.getOutage())
                .startDate(a.getStartDate())
                .folderId(a.getFolderId())
                .mimeType(a.getMimeType())
                .link(a.getLink())
                .logEntryCount(record.getLogEntries() != null ? record.getLogEntries().size() : 0)
                .build();
    }
}
