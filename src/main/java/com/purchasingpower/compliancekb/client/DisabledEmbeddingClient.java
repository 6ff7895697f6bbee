package com.purchasingpower.compliancekb.client;

import com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException;

import java.util.List;

/**
 * Used when no OpenAI API key is configured.
 */
public class DisabledEmbeddingClient implements EmbeddingClient {

    @Override
    public List<float[]> embed(List<String> texts) {
        throw new KnowledgeConfigurationException("OpenAI API key is not configured (OPENAI_API_KEY)");
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
