package com.purchasingpower.compliancekb.client;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.purchasingpower.compliancekb.exception.EmbeddingException;
import com.purchasingpower.compliancekb.model.CallContext;
import com.purchasingpower.compliancekb.model.ServiceType;
import com.purchasingpower.compliancekb.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Embedding client backed by a LangChain4j {@link EmbeddingModel}. Inputs are sent in
 * sequential sub-batches; retries on transient provider errors are left to the model.
 */
@Slf4j
public class LangChain4jEmbeddingClient implements EmbeddingClient {

    private final EmbeddingModel embeddingModel;
    private final int batchSize;

    public LangChain4jEmbeddingClient(EmbeddingModel embeddingModel, int batchSize) {
        Preconditions.checkNotNull(embeddingModel, "embeddingModel");
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive");
        this.embeddingModel = embeddingModel;
        this.batchSize = batchSize;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OPENAI, "embed", log);
        ctx.logRequest("Embedding texts", "count", texts.size(), "batchSize", batchSize);

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (List<String> batch : Lists.partition(texts, batchSize)) {
            List<TextSegment> segments = batch.stream()
                    .map(TextSegment::from)
                    .collect(Collectors.toList());

            Response<List<Embedding>> response;
            try {
                response = embeddingModel.embedAll(segments);
            } catch (RuntimeException e) {
                ctx.logError("Embedding batch failed after retries", e);
                throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
            }

            List<Embedding> embeddings = response != null ? response.content() : null;
            if (embeddings == null || embeddings.size() != batch.size()) {
                int got = embeddings == null ? 0 : embeddings.size();
                ctx.logError("Expected " + batch.size() + " vectors, got " + got, null);
                throw new EmbeddingException(
                        "Embedding provider returned " + got + " vectors for " + batch.size() + " inputs");
            }
            for (Embedding embedding : embeddings) {
                vectors.add(embedding.vector());
            }
        }

        ctx.logResponse("Embeddings generated", "vectors", vectors.size());
        return vectors;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }
}
