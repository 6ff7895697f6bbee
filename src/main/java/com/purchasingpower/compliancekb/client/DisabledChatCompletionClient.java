package com.purchasingpower.compliancekb.client;

import com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException;

public class DisabledChatCompletionClient implements ChatCompletionClient {

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        throw new KnowledgeConfigurationException("OpenAI API key is not configured (OPENAI_API_KEY)");
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
