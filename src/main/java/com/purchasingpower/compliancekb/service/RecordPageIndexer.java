package com.purchasingpower.compliancekb.service;

import com.purchasingpower.compliancekb.client.EmbeddingClient;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.model.ChunkMetadata;
import com.purchasingpower.compliancekb.model.IndexedChunk;
import com.purchasingpower.compliancekb.model.IndexedRecord;
import com.purchasingpower.compliancekb.model.SourceRecord;
import com.purchasingpower.compliancekb.model.TextChunk;
import com.purchasingpower.compliancekb.model.sync.PageIndexResult;
import com.purchasingpower.compliancekb.storage.VectorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one page of source records into stored chunks.
 *
 * <p>Records without extractable text get no chunks; their old chunks are removed and they are
 * marked indexed with a chunk count of 0. Ticket texts up to the single-chunk limit are stored
 * whole as chunk 0. Longer tickets and all documents are chunked and
 * every chunk is prefixed with the record headline so it stays attributable on its own. All texts
 * of the page are embedded with a single client call. A failed chunk write or bookkeeping step is
 * logged and counted; the record is then left unmarked so a later full sync picks it up again.
 * Embedding failures are not caught and end the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordPageIndexer {

    private final RecordTextBuilder textBuilder;
    private final Chunker chunker;
    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;
    private final AppProperties props;

    public PageIndexResult indexPage(String organizationId, List<SourceRecord> records) {
        List<List<PendingChunk>> byRecord = new ArrayList<>(records.size());
        List<String> texts = new ArrayList<>();

        for (SourceRecord record : records) {
            List<PendingChunk> pending = record.getContentError() == null ? splitRecord(record) : List.of();
            byRecord.add(pending);
            for (PendingChunk chunk : pending) {
                texts.add(chunk.content());
            }
        }

        List<float[]> vectors = embeddingClient.embed(texts);

        int errors = 0;
        int written = 0;
        int vectorIndex = 0;
        for (int r = 0; r < records.size(); r++) {
            SourceRecord record = records.get(r);
            List<PendingChunk> pending = byRecord.get(r);
            if (record.getContentError() != null) {
                log.error("Skipping {}: {}", record.getRef(), record.getContentError());
                errors++;
                continue;
            }
            ChunkMetadata metadata = ChunkMetadata.from(record);
            boolean recordFailed = false;

            for (PendingChunk chunk : pending) {
                float[] vector = vectors.get(vectorIndex++);
                try {
                    vectorStore.upsert(IndexedChunk.builder()
                            .organizationId(organizationId)
                            .collection(record.getCollection())
                            .sourceRecordId(record.getExternalId())
                            .chunkIndex(chunk.chunkIndex())
                            .ref(record.getRef())
                            .title(record.getTitle())
                            .content(chunk.content())
                            .embedding(vector)
                            .metadata(metadata)
                            .sourceLastModified(record.getLastModified())
                            .build());
                    written++;
                } catch (RuntimeException e) {
                    log.error("Failed to upsert {} chunk {}: {}", record.getRef(), chunk.chunkIndex(), e.getMessage());
                    errors++;
                    recordFailed = true;
                }
            }

            if (recordFailed) {
                continue;
            }
            int chunkCount = pending.size();
            try {
                int removed = vectorStore.deleteChunksFrom(record.getCollection(), record.getExternalId(), chunkCount);
                if (removed > 0) {
                    log.debug("Removed {} stale chunks of {}", removed, record.getRef());
                }
                vectorStore.markIndexed(IndexedRecord.builder()
                        .organizationId(organizationId)
                        .collection(record.getCollection())
                        .sourceRecordId(record.getExternalId())
                        .chunkCount(chunkCount)
                        .sourceLastModified(record.getLastModified())
                        .build());
            } catch (RuntimeException e) {
                log.error("Failed to finalize index of {}: {}", record.getRef(), e.getMessage());
                errors++;
            }
        }

        return new PageIndexResult(records.size(), errors, written);
    }

    private List<PendingChunk> splitRecord(SourceRecord record) {
        List<PendingChunk> pending = new ArrayList<>();
        if (!textBuilder.hasExtractableText(record)) {
            log.debug("No extractable text in {}", record.getRef());
            return pending;
        }
        String text = textBuilder.build(record);
        if (record.getCollection().isTicket() && text.length() <= props.getSync().getSingleChunkMaxChars()) {
            pending.add(new PendingChunk(0, text));
            return pending;
        }
        String prefix = textBuilder.headline(record) + "\n";
        for (TextChunk chunk : chunker.chunk(text)) {
            pending.add(new PendingChunk(chunk.chunkIndex(), prefix + chunk.content()));
        }
        return pending;
    }

    private record PendingChunk(int chunkIndex, String content) {
    }
}
