package com.purchasingpower.compliancekb.model;

/**
 * External collaborators, tagged in call logs.
 *
 * @see com.purchasingpower.compliancekb.util.ExternalCallLogger
 */
public enum ServiceType {
    OPENAI("🟣", "OpenAI"),
    ITOP("🟠", "iTop"),
    GOOGLE_DRIVE("🟢", "Google Drive");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
