package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class RetrievalProperties {

    @Min(1)
    private int defaultTopK = 10;

    @Min(1)
    private int maxTopK = 50;

    /**
     * Chunks placed in the context of an answer.
     */
    @Min(1)
    private int askTopK = 8;

    /**
     * Sources returned alongside an answer.
     */
    @Min(1)
    private int answerSources = 5;

    @Min(1)
    private int snippetLength = 200;

    @Min(1)
    private int similarDefaultLimit = 5;
}
