package com.purchasingpower.compliancekb.model;

import java.util.List;

public record KnowledgeAnswer(String answer, List<AnswerSource> sources) {
}
