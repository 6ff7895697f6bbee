package com.purchasingpower.compliancekb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails RUNNING jobs whose process died, so their lock is released and the next
 * incremental trigger can resume them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSyncJobReaper {

    private final SyncJobManager syncJobManager;

    @Scheduled(fixedDelayString = "${app.sync.reaper-interval:PT5M}",
               initialDelayString = "${app.sync.reaper-interval:PT5M}")
    public void reap() {
        int failed = syncJobManager.failStaleJobs();
        if (failed > 0) {
            log.warn("Marked {} stale sync job(s) as failed", failed);
        }
    }
}
