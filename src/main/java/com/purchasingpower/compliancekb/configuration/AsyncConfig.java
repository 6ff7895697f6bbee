package com.purchasingpower.compliancekb.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Thread pool for background sync runs.
 *
 * A run processes its pages sequentially on one thread, so the pool size bounds how many
 * collections can be ingested at the same time.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    public static final String SYNC_EXECUTOR = "syncExecutor";

    @Bean(name = SYNC_EXECUTOR)
    @Override
    public Executor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("kb-sync-");

        // Let in-flight pages finish; an interrupted run is resumable anyway
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Sync executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }

    /**
     * Time source for sync cooldown and staleness checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
