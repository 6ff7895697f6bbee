package com.purchasingpower.compliancekb.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Answer prompt loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: incident-answer
 * version: 1.0
 * systemPrompt: |
 *   You are a security incident analyst...
 * userPrompt: |
 *   **Question:** {{question}}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String systemPrompt;
    private String userPrompt;
}
