package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Value;

/**
 * Attributes read from the source system. Which fields are populated depends on the
 * collection: {@code category} carries the incident severity or the change type, and only
 * documents have a folder, a MIME type and a link.
 */
@Value
@Builder
public class RecordAttributes {

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

    public static RecordAttributes empty() {
        return RecordAttributes.builder().build();
    }
}
