package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Chunk budget expressed in approximate tokens. Character budgets are derived with
 * {@link #charsPerToken}.
 */
@Data
public class ChunkingProperties {

    @Min(1)
    private int chunkSizeTokens = 800;

    @Min(0)
    private int overlapTokens = 200;

    @Min(1)
    private int charsPerToken = 4;

    public int chunkSizeChars() {
        return chunkSizeTokens * charsPerToken;
    }

    public int overlapChars() {
        return overlapTokens * charsPerToken;
    }
}
