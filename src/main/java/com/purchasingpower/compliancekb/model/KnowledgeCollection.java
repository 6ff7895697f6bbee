package com.purchasingpower.compliancekb.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * A source of indexed records. Tickets map to one iTop class each; documents are the policy files
 * of the configured Google Drive folders. Every collection has its own sync job type and answer
 * prompt.
 */
public enum KnowledgeCollection {

    INCIDENT("Incident", "incidents", "incident_embedding", "incident-answer", "Investigation Log", true),
    CHANGE("Change", "changes", "change_embedding", "change-answer", "Change Log", true),
    DOCUMENT("Document", "documents", "document_embedding", "policy-answer", null, false);

    private final String sourceClass;
    private final String pluralLabel;
    private final String jobType;
    private final String answerPrompt;
    private final String logHeading;
    private final boolean ticket;

    KnowledgeCollection(String sourceClass, String pluralLabel, String jobType, String answerPrompt,
                        String logHeading, boolean ticket) {
        this.sourceClass = sourceClass;
        this.pluralLabel = pluralLabel;
        this.jobType = jobType;
        this.answerPrompt = answerPrompt;
        this.logHeading = logHeading;
        this.ticket = ticket;
    }

    public String getSourceClass() {
        return sourceClass;
    }

    public String getPluralLabel() {
        return pluralLabel;
    }

    public String getJobType() {
        return jobType;
    }

    public String getAnswerPrompt() {
        return answerPrompt;
    }

    public String getLogHeading() {
        return logHeading;
    }

    /**
     * Tickets short enough are stored whole as one chunk; documents are always chunked.
     */
    public boolean isTicket() {
        return ticket;
    }

    /**
     * Resolves a collection from its URL form ({@code incidents}, {@code incident}, {@code CHANGE}...).
     */
    public static KnowledgeCollection fromPath(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Collection is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        String candidate = normalized;
        return Arrays.stream(values())
                .filter(c -> c.name().equals(candidate))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + value));
    }
}
