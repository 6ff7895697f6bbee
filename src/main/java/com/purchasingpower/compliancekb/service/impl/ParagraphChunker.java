package com.purchasingpower.compliancekb.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.ChunkingProperties;
import com.purchasingpower.compliancekb.model.TextChunk;
import com.purchasingpower.compliancekb.service.Chunker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paragraph-based chunker.
 *
 * <p>Paragraphs (separated by blank lines) are trimmed and rejoined with {@code "\n\n"}; this is
 * the normalised text that chunk offsets refer to. Paragraphs accumulate until the next one would
 * push the buffer over the character budget. The buffer is then emitted and a new one starts with
 * the last {@code overlap} characters of the emitted buffer followed by the triggering paragraph.
 * A paragraph larger than the budget is never split.
 *
 * <p>Because every buffer is a contiguous range of the normalised text, each chunk's content is
 * exactly {@code normalised.substring(startOffset, endOffset)}.
 */
@Component
public class ParagraphChunker implements Chunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String SEPARATOR = "\n\n";

    private final int budgetChars;
    private final int overlapChars;

    @Autowired
    public ParagraphChunker(AppProperties properties) {
        this(properties.getChunking());
    }

    public ParagraphChunker(ChunkingProperties chunking) {
        this(chunking.chunkSizeChars(), chunking.overlapChars());
    }

    public ParagraphChunker(int budgetChars, int overlapChars) {
        Preconditions.checkArgument(budgetChars > 0, "chunk size must be positive");
        Preconditions.checkArgument(overlapChars >= 0 && overlapChars < budgetChars,
                "overlap must be in [0, chunk size)");
        this.budgetChars = budgetChars;
        this.overlapChars = overlapChars;
    }

    @Override
    public List<TextChunk> chunk(String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        List<String> paragraphs = new ArrayList<>();
        for (String raw : PARAGRAPH_BREAK.split(text)) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                paragraphs.add(trimmed);
            }
        }
        String normalised = String.join(SEPARATOR, paragraphs);

        int bufferStart = -1;
        int bufferEnd = -1;
        int paragraphStart = 0;

        for (String paragraph : paragraphs) {
            int paragraphEnd = paragraphStart + paragraph.length();

            if (bufferStart < 0) {
                bufferStart = paragraphStart;
            } else if ((bufferEnd - bufferStart) + paragraph.length() > budgetChars) {
                chunks.add(emit(normalised, bufferStart, bufferEnd, chunks.size()));
                bufferStart = overlapStart(normalised, bufferStart, bufferEnd, paragraphStart);
            }
            bufferEnd = paragraphEnd;
            paragraphStart = paragraphEnd + SEPARATOR.length();
        }

        if (bufferStart >= 0) {
            chunks.add(emit(normalised, bufferStart, bufferEnd, chunks.size()));
        }
        return chunks;
    }

    private int overlapStart(String normalised, int bufferStart, int bufferEnd, int nextParagraphStart) {
        int start = Math.max(bufferStart, bufferEnd - overlapChars);
        while (start < bufferEnd && Character.isWhitespace(normalised.charAt(start))) {
            start++;
        }
        // no overlap left: the new buffer is just the next paragraph
        return start < bufferEnd ? start : nextParagraphStart;
    }

    private static TextChunk emit(String normalised, int start, int end, int index) {
        return new TextChunk(normalised.substring(start, end), start, end, index);
    }
}
