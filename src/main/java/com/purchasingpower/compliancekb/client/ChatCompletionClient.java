package com.purchasingpower.compliancekb.client;

/**
 * Single-turn chat completion.
 */
public interface ChatCompletionClient {

    /**
     * @return the raw model answer, possibly empty
     */
    String complete(String systemPrompt, String userPrompt);

    boolean isConfigured();
}
