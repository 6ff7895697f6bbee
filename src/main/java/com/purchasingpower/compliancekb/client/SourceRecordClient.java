package com.purchasingpower.compliancekb.client;

import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SourceQuery;
import com.purchasingpower.compliancekb.model.SourceRecord;

import java.util.List;

/**
 * Paginated read access to a source system. Each collection is served by exactly one client.
 */
public interface SourceRecordClient {

    boolean supports(KnowledgeCollection collection);

    /**
     * Number of records the query selects.
     */
    int count(SourceQuery query);

    /**
     * One page of records, in a stable order. Pages are 1-based; a page past the end is empty.
     */
    List<SourceRecord> fetchPage(SourceQuery query, int page, int pageSize);

    boolean isConfigured();
}
