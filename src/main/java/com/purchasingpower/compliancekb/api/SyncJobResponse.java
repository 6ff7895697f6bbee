package com.purchasingpower.compliancekb.api;

import com.purchasingpower.compliancekb.model.sync.SyncJobEntity;
import com.purchasingpower.compliancekb.model.sync.SyncJobStatus;
import com.purchasingpower.compliancekb.model.sync.SyncMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Public view of a sync job; the internal lock column is not exposed.
 */
@Value
@Builder
public class SyncJobResponse {

    UUID id;
    String organizationId;
    String type;
    SyncMode mode;
    SyncJobStatus status;
    int total;
    int progress;
    String error;
    Instant startedAt;
    Instant updatedAt;
    Instant completedAt;

    public static SyncJobResponse from(SyncJobEntity job) {
        return SyncJobResponse.builder()
            .id(job.getId())
            .organizationId(job.getOrganizationId())
            .type(job.getType())
            .mode(job.getMode())
            .status(job.getStatus())
            .total(job.getTotal())
            .progress(job.getProgress())
            .error(job.getError())
            .startedAt(job.getStartedAt())
            .updatedAt(job.getUpdatedAt())
            .completedAt(job.getCompletedAt())
            .build();
    }
}
