package com.purchasingpower.compliancekb.model;

import lombok.Builder;
import lombok.Value;

/**
 * Restricts a similarity search. Null fields are not applied; the organization is mandatory.
 */
@Value
@Builder
public class SearchFilter {

    String organizationId;
    KnowledgeCollection collection;
    String status;
    String team;
    String folderId;

    public static SearchFilter of(String organizationId, KnowledgeCollection collection) {
        return SearchFilter.builder()
                .organizationId(organizationId)
                .collection(collection)
                .build();
    }
}
