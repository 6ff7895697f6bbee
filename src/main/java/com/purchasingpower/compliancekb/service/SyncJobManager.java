package com.purchasingpower.compliancekb.service;

import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.sync.KnowledgeBaseStatus;
import com.purchasingpower.compliancekb.model.sync.SyncJobEntity;
import com.purchasingpower.compliancekb.model.sync.SyncMode;
import com.purchasingpower.compliancekb.model.sync.SyncStartResult;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs and tracks ingestion of a collection from the source system into the vector store.
 *
 * <p>A job goes RUNNING then COMPLETED or FAILED. At most one job per organization and
 * collection is RUNNING at any time; an interrupted run is resumed by the next incremental
 * trigger that finds nothing new.
 */
public interface SyncJobManager {

    /**
     * Starts a run, or returns the one already running.
     *
     * @throws com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException if the
     *         embedding provider or source system is not configured
     * @throws com.purchasingpower.compliancekb.exception.SyncCooldownException if the previous run
     *         finished too recently
     */
    SyncStartResult startSync(String organizationId, KnowledgeCollection collection, SyncMode mode);

    Optional<SyncJobEntity> getJob(UUID jobId);

    KnowledgeBaseStatus getKnowledgeBaseStatus(String organizationId, KnowledgeCollection collection);

    /**
     * Marks RUNNING jobs without a recent heartbeat as FAILED.
     *
     * @return number of jobs marked
     */
    int failStaleJobs();
}
