package com.purchasingpower.compliancekb.api;

import java.util.UUID;

public record SyncStartResponse(UUID jobId, boolean reused) {
}
