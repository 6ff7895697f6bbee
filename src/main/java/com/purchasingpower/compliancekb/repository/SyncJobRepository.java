package com.purchasingpower.compliancekb.repository;

import com.purchasingpower.compliancekb.model.sync.SyncJobEntity;
import com.purchasingpower.compliancekb.model.sync.SyncJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sync job history. Rows are only inserted and updated.
 */
@Repository
public interface SyncJobRepository extends JpaRepository<SyncJobEntity, UUID> {

    /**
     * The running job holding the lock for an organization and type.
     */
    Optional<SyncJobEntity> findByActiveLock(String activeLock);

    /**
     * Latest finished job, used for the cooldown window and the last sync time.
     */
    Optional<SyncJobEntity> findFirstByOrganizationIdAndTypeAndStatusInOrderByCompletedAtDesc(
            String organizationId,
            String type,
            Collection<SyncJobStatus> statuses
    );

    Optional<SyncJobEntity> findFirstByOrganizationIdAndTypeOrderByStartedAtDesc(String organizationId, String type);

    /**
     * Latest finished job that had work to do, used to detect an interrupted run.
     */
    @Query("SELECT j FROM SyncJobEntity j " +
           "WHERE j.organizationId = :orgId AND j.type = :type " +
           "AND j.status IN :statuses AND j.total > 0 " +
           "ORDER BY j.startedAt DESC")
    List<SyncJobEntity> findFinishedWithWork(
            @Param("orgId") String organizationId,
            @Param("type") String type,
            @Param("statuses") Collection<SyncJobStatus> statuses
    );

    /**
     * Running jobs whose heartbeat is older than the cutoff.
     */
    List<SyncJobEntity> findByStatusAndUpdatedAtBefore(SyncJobStatus status, Instant cutoff);
}
