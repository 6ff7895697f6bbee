package com.purchasingpower.compliancekb.model;

/**
 * A slice of normalised text produced by the chunker.
 *
 * @param content     the chunk text
 * @param startOffset inclusive start in the normalised text
 * @param endOffset   exclusive end in the normalised text
 * @param chunkIndex  zero-based position in emission order
 */
public record TextChunk(String content, int startOffset, int endOffset, int chunkIndex) {
}
