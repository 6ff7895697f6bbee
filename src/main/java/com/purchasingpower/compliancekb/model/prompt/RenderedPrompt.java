package com.purchasingpower.compliancekb.model.prompt;

public record RenderedPrompt(String systemPrompt, String userPrompt) {
}
