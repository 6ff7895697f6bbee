package com.purchasingpower.compliancekb.model.sync;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Returned by a sync trigger. {@code completion} finishes with the terminal job; it is already
 * complete for a trivial up-to-date run and mirrors the existing run when {@code reused} is true.
 */
public record SyncStartResult(UUID jobId, boolean reused, CompletableFuture<SyncJobEntity> completion) {
}
