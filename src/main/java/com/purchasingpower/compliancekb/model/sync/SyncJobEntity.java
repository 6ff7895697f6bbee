package com.purchasingpower.compliancekb.model.sync;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One ingestion run of a collection.
 *
 * <p>{@code activeLock} holds {@code organizationId:type} while the job is RUNNING and is
 * cleared when it terminates. The column is unique, so the database admits at most one
 * running job per organization and type. Rows are never deleted.
 */
@Entity
@Table(name = "sync_jobs", indexes = {
        @Index(name = "idx_sync_jobs_org_type", columnList = "organization_id, type, started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncJobEntity {

    @Id
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(nullable = false, length = 50)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncJobStatus status;

    @Column(nullable = false)
    private int total;

    @Column(nullable = false)
    private int progress;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "active_lock", unique = true)
    private String activeLock;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (startedAt == null) {
            startedAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    public static String lockKey(String organizationId, String type) {
        return organizationId + ":" + type;
    }

    public boolean hasUnfinishedProgress() {
        return total > 0 && progress < total;
    }
}
