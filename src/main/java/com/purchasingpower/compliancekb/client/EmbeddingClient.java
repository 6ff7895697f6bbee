package com.purchasingpower.compliancekb.client;

import java.util.List;

/**
 * Turns text into embedding vectors.
 */
public interface EmbeddingClient {

    /**
     * Embeds every text. The result has the same size and order as the input; an empty input
     * returns an empty list without contacting the provider.
     *
     * @throws com.purchasingpower.compliancekb.exception.EmbeddingException if the provider fails
     *         or returns a different number of vectors
     * @throws com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException if no
     *         provider is configured
     */
    List<float[]> embed(List<String> texts);

    default float[] embedOne(String text) {
        return embed(List.of(text)).get(0);
    }

    boolean isConfigured();
}
