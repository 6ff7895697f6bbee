package com.purchasingpower.compliancekb.model;

/**
 * One entry of a ticket's case log. {@code message} is plain text when the source provides it,
 * otherwise {@code messageHtml} is normalised.
 */
public record RecordLogEntry(String date, String author, String message, String messageHtml) {
}
