package com.purchasingpower.compliancekb.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Attribution entry returned with an answer. {@code link} points at the source document and is
 * only set for documents.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerSource(String ref, String title, double similarity, String snippet, String link) {
}
