package com.purchasingpower.compliancekb.configuration;

import com.purchasingpower.compliancekb.client.ChatCompletionClient;
import com.purchasingpower.compliancekb.client.DisabledChatCompletionClient;
import com.purchasingpower.compliancekb.client.DisabledEmbeddingClient;
import com.purchasingpower.compliancekb.client.EmbeddingClient;
import com.purchasingpower.compliancekb.client.LangChain4jChatCompletionClient;
import com.purchasingpower.compliancekb.client.LangChain4jEmbeddingClient;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAI models through LangChain4j. Without an API key the application still starts; the
 * disabled clients reject every call so sync and ask report a configuration error.
 */
@Slf4j
@Configuration
public class LlmClientConfiguration {

    @Bean
    public EmbeddingClient embeddingClient(AppProperties props) {
        OpenAiProperties openai = props.getOpenai();
        if (!openai.isConfigured()) {
            log.warn("⚠️  OPENAI_API_KEY not set, embeddings disabled");
            return new DisabledEmbeddingClient();
        }

        log.info("🟣 Initializing OpenAI embedding model");
        log.info("   - Model: {} ({} dimensions)", openai.getEmbeddingModel(), openai.getEmbeddingDimensions());
        log.info("   - Batch size: {}", openai.getEmbeddingBatchSize());

        OpenAiEmbeddingModel model = OpenAiEmbeddingModel.builder()
                .apiKey(openai.getApiKey())
                .baseUrl(openai.getBaseUrl())
                .modelName(openai.getEmbeddingModel())
                .dimensions(openai.getEmbeddingDimensions())
                .timeout(Duration.ofSeconds(openai.getTimeoutSeconds()))
                .maxRetries(openai.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        return new LangChain4jEmbeddingClient(model, openai.getEmbeddingBatchSize());
    }

    @Bean
    public ChatCompletionClient chatCompletionClient(AppProperties props) {
        OpenAiProperties openai = props.getOpenai();
        if (!openai.isConfigured()) {
            log.warn("⚠️  OPENAI_API_KEY not set, answer synthesis disabled");
            return new DisabledChatCompletionClient();
        }

        log.info("🟣 Initializing OpenAI chat model: {} (temperature {}, max tokens {})",
                openai.getChatModel(), openai.getTemperature(), openai.getMaxTokens());

        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(openai.getApiKey())
                .baseUrl(openai.getBaseUrl())
                .modelName(openai.getChatModel())
                .temperature(openai.getTemperature())
                .maxTokens(openai.getMaxTokens())
                .timeout(Duration.ofSeconds(openai.getTimeoutSeconds()))
                .maxRetries(openai.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        return new LangChain4jChatCompletionClient(model);
    }
}
