package com.purchasingpower.compliancekb.configuration;

import lombok.Data;

import java.util.List;

/**
 * Exponential backoff for transient failures of a source system.
 */
@Data
public class HttpRetryProperties {

    private int maxAttempts = 3;

    private long initialBackoffSeconds = 2;

    private long maxBackoffSeconds = 30;

    /**
     * HTTP status codes that trigger a retry. Anything else fails the call immediately.
     */
    private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);
}
