package com.purchasingpower.compliancekb.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.client.EmbeddingClient;
import com.purchasingpower.compliancekb.client.SourceRecordClient;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.AsyncConfig;
import com.purchasingpower.compliancekb.configuration.SyncProperties;
import com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException;
import com.purchasingpower.compliancekb.exception.SyncCooldownException;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SourceQuery;
import com.purchasingpower.compliancekb.model.SourceRecord;
import com.purchasingpower.compliancekb.model.sync.KnowledgeBaseStatus;
import com.purchasingpower.compliancekb.model.sync.PageIndexResult;
import com.purchasingpower.compliancekb.model.sync.SyncJobEntity;
import com.purchasingpower.compliancekb.model.sync.SyncJobStatus;
import com.purchasingpower.compliancekb.model.sync.SyncMode;
import com.purchasingpower.compliancekb.model.sync.SyncStartResult;
import com.purchasingpower.compliancekb.repository.SyncJobRepository;
import com.purchasingpower.compliancekb.service.RecordPageIndexer;
import com.purchasingpower.compliancekb.service.SyncJobManager;
import com.purchasingpower.compliancekb.storage.VectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Database-backed sync job state machine.
 *
 * <p>The {@code sync_jobs} table is the only record of which runs are active: a RUNNING row holds
 * a unique {@code active_lock}, so two triggers racing for the same organization and collection
 * cannot both insert one. Runs execute on the sync executor and process pages strictly in order,
 * persisting progress and a heartbeat after every page.
 */
@Slf4j
@Service
public class SyncJobManagerImpl implements SyncJobManager {

    private static final Set<SyncJobStatus> FINISHED = EnumSet.of(SyncJobStatus.COMPLETED, SyncJobStatus.FAILED);

    private final SyncJobRepository jobRepository;
    private final List<SourceRecordClient> sourceClients;
    private final EmbeddingClient embeddingClient;
    private final VectorStore vectorStore;
    private final RecordPageIndexer pageIndexer;
    private final SyncProperties syncProps;
    private final Executor syncExecutor;
    private final Clock clock;

    /**
     * Completion handles of runs executing in this process.
     */
    private final Map<UUID, CompletableFuture<SyncJobEntity>> localRuns = new ConcurrentHashMap<>();

    public SyncJobManagerImpl(SyncJobRepository jobRepository,
                              List<SourceRecordClient> sourceClients,
                              EmbeddingClient embeddingClient,
                              VectorStore vectorStore,
                              RecordPageIndexer pageIndexer,
                              AppProperties props,
                              @Qualifier(AsyncConfig.SYNC_EXECUTOR) Executor syncExecutor,
                              Clock clock) {
        this.jobRepository = jobRepository;
        this.sourceClients = sourceClients;
        this.embeddingClient = embeddingClient;
        this.vectorStore = vectorStore;
        this.pageIndexer = pageIndexer;
        this.syncProps = props.getSync();
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    @Override
    public SyncStartResult startSync(String organizationId, KnowledgeCollection collection, SyncMode mode) {
        Preconditions.checkArgument(organizationId != null && !organizationId.isBlank(), "organizationId is required");
        Preconditions.checkNotNull(collection, "collection");
        Preconditions.checkNotNull(mode, "mode");

        if (!embeddingClient.isConfigured()) {
            throw new KnowledgeConfigurationException("OpenAI API key is not configured (OPENAI_API_KEY)");
        }
        SourceRecordClient sourceClient = sourceClientFor(collection);
        if (!sourceClient.isConfigured()) {
            String settings = collection.isTicket()
                    ? "ITOP_BASE_URL"
                    : "GOOGLE_DRIVE_FOLDER_IDS and GOOGLE_SERVICE_ACCOUNT_KEY_PATH";
            throw new KnowledgeConfigurationException("Source of " + collection.getPluralLabel()
                    + " is not configured (" + settings + ")");
        }

        String type = collection.getJobType();
        String lockKey = SyncJobEntity.lockKey(organizationId, type);

        Optional<SyncJobEntity> running = jobRepository.findByActiveLock(lockKey)
                .filter(job -> !failIfStale(job));
        if (running.isPresent()) {
            log.info("🔁 {} sync already running for org {}: {}", collection, organizationId, running.get().getId());
            return reused(running.get());
        }

        checkCooldown(organizationId, type);

        SourceQuery query;
        SyncMode effectiveMode = mode;
        if (mode == SyncMode.INCREMENTAL) {
            Optional<Instant> watermark = vectorStore.maxWatermark(organizationId, collection);
            if (watermark.isPresent()) {
                query = SourceQuery.modifiedAfter(collection, watermark.get());
            } else {
                log.info("No indexed {} records for org {}, falling back to full sync", collection, organizationId);
                effectiveMode = SyncMode.FULL;
                query = SourceQuery.all(collection);
            }
        } else {
            query = SourceQuery.all(collection);
        }

        int total = sourceClient.count(query);

        if (mode == SyncMode.INCREMENTAL && total == 0) {
            Optional<SyncJobEntity> interrupted = jobRepository.findFinishedWithWork(organizationId, type, FINISHED)
                    .stream()
                    .findFirst()
                    .filter(SyncJobEntity::hasUnfinishedProgress);

            if (interrupted.isPresent()) {
                SyncJobEntity previous = interrupted.get();
                SourceQuery fullQuery = SourceQuery.all(collection);
                int fullTotal = sourceClient.count(fullQuery);
                int startPage = previous.getProgress() / syncProps.getPageSize() + 1;

                log.info("⏯️  Resuming {} sync for org {} from page {} (previously indexed {}/{})",
                        collection, organizationId, startPage, previous.getProgress(), previous.getTotal());

                return launch(organizationId, collection, SyncMode.FULL, fullQuery, fullTotal, startPage);
            }

            SyncJobEntity upToDate = recordUpToDate(organizationId, type, mode);
            log.info("✅ Incremental {} sync: knowledge base is up to date for org {}", collection, organizationId);
            return new SyncStartResult(upToDate.getId(), false, CompletableFuture.completedFuture(upToDate));
        }

        log.info("🚀 Starting {} {} sync for org {}: {} records", effectiveMode, collection, organizationId, total);
        return launch(organizationId, collection, effectiveMode, query, total, 1);
    }

    @Override
    public Optional<SyncJobEntity> getJob(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Override
    public KnowledgeBaseStatus getKnowledgeBaseStatus(String organizationId, KnowledgeCollection collection) {
        String type = collection.getJobType();

        KnowledgeBaseStatus.IncompleteSync incomplete = jobRepository
                .findFinishedWithWork(organizationId, type, FINISHED)
                .stream()
                .findFirst()
                .filter(SyncJobEntity::hasUnfinishedProgress)
                .map(job -> new KnowledgeBaseStatus.IncompleteSync(job.getProgress(), job.getTotal()))
                .orElse(null);

        KnowledgeBaseStatus.LastSync lastSync = jobRepository
                .findFirstByOrganizationIdAndTypeOrderByStartedAtDesc(organizationId, type)
                .map(KnowledgeBaseStatus.LastSync::of)
                .orElse(null);

        return KnowledgeBaseStatus.builder()
                .indexedCount(vectorStore.countIndexedRecords(organizationId, collection))
                .totalChunks(vectorStore.countChunks(organizationId, collection))
                .lastSync(lastSync)
                .incompleteSync(incomplete)
                .build();
    }

    @Override
    public int failStaleJobs() {
        Instant cutoff = clock.instant().minus(syncProps.getStaleAfter());
        List<SyncJobEntity> stale = jobRepository.findByStatusAndUpdatedAtBefore(SyncJobStatus.RUNNING, cutoff);
        int failed = 0;
        for (SyncJobEntity job : stale) {
            if (failIfStale(job)) {
                failed++;
            }
        }
        return failed;
    }

    /**
     * Applies the staleness policy to a RUNNING job.
     *
     * @return true if the job was marked FAILED
     */
    private boolean failIfStale(SyncJobEntity job) {
        if (job.getStatus() != SyncJobStatus.RUNNING || localRuns.containsKey(job.getId())) {
            return false;
        }
        Instant now = clock.instant();
        if (!job.getUpdatedAt().isBefore(now.minus(syncProps.getStaleAfter()))) {
            return false;
        }
        log.warn("⚠️  Sync job {} has not reported progress since {}, marking it abandoned",
                job.getId(), job.getUpdatedAt());
        job.setStatus(SyncJobStatus.FAILED);
        job.setError("Sync abandoned: no progress since " + job.getUpdatedAt());
        job.setActiveLock(null);
        // ended at its last heartbeat, so the cooldown does not hold back the resume
        job.setCompletedAt(job.getUpdatedAt());
        job.setUpdatedAt(now);
        jobRepository.save(job);
        return true;
    }

    private SourceRecordClient sourceClientFor(KnowledgeCollection collection) {
        return sourceClients.stream()
                .filter(client -> client.supports(collection))
                .findFirst()
                .orElseThrow(() -> new KnowledgeConfigurationException("No source client for " + collection.getPluralLabel()));
    }

    private void checkCooldown(String organizationId, String type) {
        Optional<SyncJobEntity> latest = jobRepository
                .findFirstByOrganizationIdAndTypeAndStatusInOrderByCompletedAtDesc(organizationId, type, FINISHED);
        if (latest.isEmpty() || latest.get().getCompletedAt() == null) {
            return;
        }
        Duration elapsed = Duration.between(latest.get().getCompletedAt(), clock.instant());
        Duration remaining = syncProps.getCooldown().minus(elapsed);
        if (!remaining.isNegative() && !remaining.isZero()) {
            long seconds = (remaining.toMillis() + 999) / 1000;
            throw new SyncCooldownException(seconds);
        }
    }

    private SyncJobEntity recordUpToDate(String organizationId, String type, SyncMode mode) {
        Instant now = clock.instant();
        return jobRepository.save(SyncJobEntity.builder()
                .organizationId(organizationId)
                .type(type)
                .mode(mode)
                .status(SyncJobStatus.COMPLETED)
                .total(0)
                .progress(0)
                .startedAt(now)
                .updatedAt(now)
                .completedAt(now)
                .build());
    }

    private SyncStartResult launch(String organizationId,
                                   KnowledgeCollection collection,
                                   SyncMode mode,
                                   SourceQuery query,
                                   int total,
                                   int startPage) {
        String type = collection.getJobType();
        // records on the pages before startPage count as done
        int initialProgress = Math.min((startPage - 1) * syncProps.getPageSize(), total);
        String lockKey = SyncJobEntity.lockKey(organizationId, type);
        Instant now = clock.instant();

        SyncJobEntity job;
        try {
            job = jobRepository.saveAndFlush(SyncJobEntity.builder()
                    .organizationId(organizationId)
                    .type(type)
                    .mode(mode)
                    .status(SyncJobStatus.RUNNING)
                    .total(total)
                    .progress(initialProgress)
                    .activeLock(lockKey)
                    .startedAt(now)
                    .updatedAt(now)
                    .build());
        } catch (DataIntegrityViolationException e) {
            // another trigger inserted its RUNNING row first
            SyncJobEntity winner = jobRepository.findByActiveLock(lockKey).orElseThrow(() -> e);
            log.info("🔁 Lost start race for {} sync of org {}, reusing {}", collection, organizationId, winner.getId());
            return reused(winner);
        }

        UUID jobId = job.getId();
        CompletableFuture<SyncJobEntity> completion = new CompletableFuture<>();
        localRuns.put(jobId, completion);
        try {
            syncExecutor.execute(() -> {
                try {
                    completion.complete(runJob(jobId, organizationId, query, total, startPage));
                } catch (RuntimeException e) {
                    completion.completeExceptionally(e);
                } finally {
                    localRuns.remove(jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            localRuns.remove(jobId);
            SyncJobEntity failed = finish(jobId, SyncJobStatus.FAILED, initialProgress, "Sync executor rejected the job");
            completion.complete(failed);
            throw new IllegalStateException("Sync executor is saturated, try again later", e);
        }

        return new SyncStartResult(jobId, false, completion);
    }

    SyncJobEntity runJob(UUID jobId,
                         String organizationId,
                         SourceQuery query,
                         int total,
                         int startPage) {
        SourceRecordClient sourceClient = sourceClientFor(query.collection());
        int pageSize = syncProps.getPageSize();
        int totalPages = (total + pageSize - 1) / pageSize;
        int processed = (startPage - 1) * pageSize;
        int errors = 0;
        KnowledgeCollection collection = query.collection();

        try {
            for (int page = startPage; page <= totalPages; page++) {
                List<SourceRecord> records = sourceClient.fetchPage(query, page, pageSize);
                if (records.isEmpty()) {
                    log.info("Page {} of {} is empty, stopping early", page, collection);
                    break;
                }

                PageIndexResult result = pageIndexer.indexPage(organizationId, records);
                processed += result.processed();
                errors += result.errors();

                if (!heartbeat(jobId, Math.min(processed, total))) {
                    log.warn("⚠️  Sync job {} is no longer running, stopping", jobId);
                    return jobRepository.findById(jobId).orElseThrow();
                }

                log.info("📦 Sync progress: {}/{} {} records processed ({} errors), page {}/{}",
                        Math.min(processed, total), total, collection, errors, page, totalPages);

                if (page < totalPages) {
                    pause();
                }
            }

            String message = errors > 0 ? "Completed with " + errors + " errors" : null;
            log.info("✅ Sync {} completed: {} {} records, {} errors", jobId, processed, collection, errors);
            return finish(jobId, SyncJobStatus.COMPLETED, Math.min(processed, total), message);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sync {} interrupted after {} records", jobId, processed);
            return finish(jobId, SyncJobStatus.FAILED, Math.min(processed, total), "Sync interrupted");
        } catch (RuntimeException e) {
            log.error("❌ Sync {} failed after {} records: {}", jobId, processed, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return finish(jobId, SyncJobStatus.FAILED, Math.min(processed, total), message);
        }
    }

    private void pause() throws InterruptedException {
        long millis = syncProps.getPageDelay().toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    /**
     * Persists progress and refreshes {@code updatedAt}.
     *
     * @return false if the job is no longer RUNNING
     */
    private boolean heartbeat(UUID jobId, int progress) {
        SyncJobEntity job = jobRepository.findById(jobId).orElseThrow();
        if (job.getStatus().isTerminal()) {
            return false;
        }
        job.setProgress(progress);
        job.setUpdatedAt(clock.instant());
        jobRepository.save(job);
        return true;
    }

    private SyncJobEntity finish(UUID jobId, SyncJobStatus status, int progress, String error) {
        SyncJobEntity job = jobRepository.findById(jobId).orElseThrow();
        Instant now = clock.instant();
        job.setStatus(status);
        job.setProgress(progress);
        job.setError(error);
        job.setActiveLock(null);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        return jobRepository.save(job);
    }

    private SyncStartResult reused(SyncJobEntity job) {
        CompletableFuture<SyncJobEntity> completion = localRuns.get(job.getId());
        if (completion == null) {
            // run owned by another process; only a snapshot is available here
            completion = CompletableFuture.completedFuture(job);
        }
        return new SyncStartResult(job.getId(), true, completion);
    }
}
