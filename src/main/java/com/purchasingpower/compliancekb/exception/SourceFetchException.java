package com.purchasingpower.compliancekb.exception;

import lombok.Getter;

/**
 * The source system rejected or failed a request.
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final String operation;

    public SourceFetchException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public SourceFetchException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }
}
