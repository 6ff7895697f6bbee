package com.purchasingpower.compliancekb.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.client.EmbeddingClient;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.RetrievalProperties;
import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;
import com.purchasingpower.compliancekb.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Semantic search over stored chunks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeRetriever {

    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;
    private final AppProperties props;

    /**
     * Embeds the query and returns the closest chunks that pass the filter.
     *
     * @param limit requested result count, null for the default; capped at the configured maximum
     */
    public List<ChunkMatch> search(String query, SearchFilter filter, Integer limit) {
        Preconditions.checkArgument(query != null && !query.isBlank(), "query is required");
        Preconditions.checkArgument(filter.getOrganizationId() != null && !filter.getOrganizationId().isBlank(),
                "organizationId is required");

        int k = resolveLimit(limit, retrieval().getDefaultTopK());
        float[] vector = embeddingClient.embedOne(query);
        List<ChunkMatch> matches = vectorStore.search(vector, filter, k);

        log.debug("🔍 Search '{}' in {} returned {} chunks", query, filter.getCollection(), matches.size());
        return matches;
    }

    /**
     * Records closest to the given one, compared on their first chunk; the record itself is
     * excluded.
     */
    public List<ChunkMatch> findSimilar(String organizationId,
                                        KnowledgeCollection collection,
                                        String sourceRecordId,
                                        Integer limit) {
        Preconditions.checkArgument(organizationId != null && !organizationId.isBlank(), "organizationId is required");
        Preconditions.checkArgument(sourceRecordId != null && !sourceRecordId.isBlank(), "recordId is required");

        int k = resolveLimit(limit, retrieval().getSimilarDefaultLimit());
        return vectorStore.nearestToRecord(organizationId, collection, sourceRecordId, true, k);
    }

    private int resolveLimit(Integer requested, int fallback) {
        int k = requested != null ? requested : fallback;
        Preconditions.checkArgument(k > 0, "limit must be positive");
        return Math.min(k, retrieval().getMaxTopK());
    }

    private RetrievalProperties retrieval() {
        return props.getRetrieval();
    }
}
