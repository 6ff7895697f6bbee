package com.purchasingpower.compliancekb.service;

import com.purchasingpower.compliancekb.model.TextChunk;

import java.util.List;

/**
 * Splits text into overlapping chunks sized for the embedding model.
 */
public interface Chunker {

    /**
     * @return chunks in order; empty for blank input
     */
    List<TextChunk> chunk(String text);
}
