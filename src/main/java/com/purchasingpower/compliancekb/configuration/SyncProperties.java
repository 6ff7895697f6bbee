package com.purchasingpower.compliancekb.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Settings for background ingestion runs.
 */
@Data
public class SyncProperties {

    /**
     * Records fetched from the source per page. Resume positions are derived from it, so
     * changing it between a failed run and its resumption shifts the resume page.
     */
    @Min(1)
    private int pageSize = 500;

    /**
     * Pause between two pages to bound the load on the source system.
     */
    @NotNull
    private Duration pageDelay = Duration.ofSeconds(2);

    /**
     * Minimum time between the end of one run and the start of the next for the same collection.
     */
    @NotNull
    private Duration cooldown = Duration.ofSeconds(30);

    /**
     * A running job without a heartbeat for this long is treated as abandoned.
     */
    @NotNull
    private Duration staleAfter = Duration.ofMinutes(30);

    /**
     * How often stale RUNNING jobs are looked for. Read by the scheduler as {@code app.sync.reaper-interval}.
     */
    @NotNull
    private Duration reaperInterval = Duration.ofMinutes(5);

    /**
     * Records whose text fits in this many characters are embedded as a single chunk.
     */
    @Min(1)
    private int singleChunkMaxChars = 24_000;
}
