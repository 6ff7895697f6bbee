package com.purchasingpower.compliancekb.model.sync;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class KnowledgeBaseStatus {

    long indexedCount;
    long totalChunks;

    /**
     * Latest job of the collection in any state, or null before the first sync.
     */
    LastSync lastSync;

    /**
     * Progress of the latest finished run that stopped before its total, or null.
     */
    IncompleteSync incompleteSync;

    public record LastSync(UUID id,
                           SyncJobStatus status,
                           int progress,
                           int total,
                           Instant startedAt,
                           Instant completedAt,
                           String error) {

        public static LastSync of(SyncJobEntity job) {
            return new LastSync(job.getId(), job.getStatus(), job.getProgress(), job.getTotal(),
                    job.getStartedAt(), job.getCompletedAt(), job.getError());
        }
    }

    public record IncompleteSync(int progress, int total) {
    }
}
