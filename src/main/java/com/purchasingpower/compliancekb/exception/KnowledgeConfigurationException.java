package com.purchasingpower.compliancekb.exception;

/**
 * A required collaborator (OpenAI key, iTop endpoint) is not configured. No work was attempted.
 */
public class KnowledgeConfigurationException extends RuntimeException {

    public KnowledgeConfigurationException(String message) {
        super(message);
    }
}
