package com.purchasingpower.compliancekb.exception;

import lombok.Getter;

@Getter
public class SyncCooldownException extends RuntimeException {

    private final long remainingSeconds;

    public SyncCooldownException(long remainingSeconds) {
        super("Please wait " + remainingSeconds + " seconds before starting another sync");
        this.remainingSeconds = remainingSeconds;
    }
}
