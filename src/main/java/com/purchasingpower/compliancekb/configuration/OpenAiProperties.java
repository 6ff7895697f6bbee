package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * OpenAI settings shared by the embedding and chat-completion clients.
 *
 * <p>The API key is optional at startup. Without it the application still boots and serves
 * status reads, but every operation that needs the provider fails with a configuration error.
 */
@Data
public class OpenAiProperties {

    private String apiKey;

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    @NotBlank
    private String embeddingModel = "text-embedding-3-small";

    @NotBlank
    private String chatModel = "gpt-4o-mini";

    /**
     * Must match the dimension of the {@code knowledge_chunks.embedding} column.
     */
    @Min(1)
    private int embeddingDimensions = 1536;

    /**
     * Maximum number of texts per embedding request.
     */
    @Min(1)
    @Max(2048)
    private int embeddingBatchSize = 20;

    private double temperature = 0.2;

    @Min(1)
    private int maxTokens = 1500;

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
