package com.purchasingpower.compliancekb.model.sync;

public enum SyncJobStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
