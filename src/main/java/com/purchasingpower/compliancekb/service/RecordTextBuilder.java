package com.purchasingpower.compliancekb.service;

import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.RecordAttributes;
import com.purchasingpower.compliancekb.model.RecordLogEntry;
import com.purchasingpower.compliancekb.model.SourceRecord;
import com.purchasingpower.compliancekb.util.HtmlTextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a ticket as the text that gets embedded: headline, attribute lines, a separator,
 * the normalised description and the case log.
 *
 * <pre>
 * Incident I-000123: Phishing mail reported
 * Status: resolved | Severity: high | Priority: P2
 * Team: SOC | Agent: jdoe
 * ---
 * Description: ...
 * ---
 * Investigation Log:
 * [2024-05-01 10:00:00] jdoe: blocked sender
 * </pre>
 *
 * <p>Documents carry no attributes or log; their text is the extracted body with its paragraph
 * breaks intact. Documents are always chunked, and each chunk gets the headline as prefix.
 */
@Component
public class RecordTextBuilder {

    private static final String UNKNOWN = "unknown";

    /**
     * Extracted document bodies shorter than this hold no usable text.
     */
    static final int MIN_DOCUMENT_CHARS = 10;

    public String headline(SourceRecord record) {
        String headline = record.getCollection().getSourceClass() + " " + record.getRef();
        return record.getTitle() != null && !record.getTitle().isBlank() ? headline + ": " + record.getTitle() : headline;
    }

    /**
     * Whether the record has content beyond its headline and attributes: a description, a
     * fallback plan or a non-empty log message for tickets, a body of some length for documents.
     * Records without it are indexed with zero chunks.
     */
    public boolean hasExtractableText(SourceRecord record) {
        if (record.getCollection() == KnowledgeCollection.DOCUMENT) {
            return documentBody(record).length() >= MIN_DOCUMENT_CHARS;
        }
        if (!HtmlTextNormalizer.toPlainText(record.getDescription()).isEmpty()
                || !HtmlTextNormalizer.toPlainText(record.getFallbackPlan()).isEmpty()) {
            return true;
        }
        List<RecordLogEntry> entries = record.getLogEntries();
        return entries != null && entries.stream().anyMatch(entry -> !logMessage(entry).isBlank());
    }

    public String build(SourceRecord record) {
        if (record.getCollection() == KnowledgeCollection.DOCUMENT) {
            return documentBody(record);
        }
        RecordAttributes a = record.getAttributes() != null ? record.getAttributes() : RecordAttributes.empty();
        List<String> lines = new ArrayList<>();

        lines.add(headline(record));

        List<String> meta = new ArrayList<>();
        if (record.getCollection() == KnowledgeCollection.CHANGE) {
            lines.add("Status: " + orUnknown(a.getStatus()) + " | Type: " + orUnknown(a.getCategory())
                    + " | Impact: " + orUnknown(a.getImpact()));
            addIfPresent(meta, "Team", a.getTeam());
            addIfPresent(meta, "Agent", a.getAgent());
            addIfPresent(meta, "Supervisor", a.getSupervisor());
            if (a.getOutage() != null && !a.getOutage().isBlank() && !"no".equalsIgnoreCase(a.getOutage())) {
                meta.add("Outage: " + a.getOutage());
            }
        } else {
            String priority = a.getPriority() != null ? "P" + a.getPriority() : UNKNOWN;
            lines.add("Status: " + orUnknown(a.getStatus()) + " | Severity: " + orUnknown(a.getCategory())
                    + " | Priority: " + priority);
            addIfPresent(meta, "Team", a.getTeam());
            addIfPresent(meta, "Agent", a.getAgent());
            addIfPresent(meta, "Service", a.getService());
            addIfPresent(meta, "Origin", a.getOrigin());
        }
        if (!meta.isEmpty()) {
            lines.add(String.join(" | ", meta));
        }

        lines.add("---");

        String description = HtmlTextNormalizer.toPlainText(record.getDescription());
        if (!description.isEmpty()) {
            lines.add("Description: " + description);
        }

        String fallback = HtmlTextNormalizer.toPlainText(record.getFallbackPlan());
        if (!fallback.isEmpty()) {
            lines.add("Fallback Plan: " + fallback);
        }

        List<RecordLogEntry> entries = record.getLogEntries();
        if (entries != null && !entries.isEmpty()) {
            lines.add("---");
            lines.add(record.getCollection().getLogHeading() + ":");
            for (RecordLogEntry entry : entries) {
                String message = logMessage(entry);
                if (!message.isBlank()) {
                    lines.add("[" + entry.date() + "] " + entry.author() + ": " + message);
                }
            }
        }

        return String.join("\n", lines);
    }

    private static String logMessage(RecordLogEntry entry) {
        return entry.message() != null && !entry.message().isBlank()
                ? entry.message()
                : HtmlTextNormalizer.toPlainText(entry.messageHtml());
    }

    private static String documentBody(SourceRecord record) {
        String body = record.getDescription();
        if (body == null) {
            return "";
        }
        return body.replace("\r\n", "\n").replace('\r', '\n').strip();
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : UNKNOWN;
    }

    private static void addIfPresent(List<String> meta, String label, String value) {
        if (value != null && !value.isBlank()) {
            meta.add(label + ": " + value);
        }
    }
}
