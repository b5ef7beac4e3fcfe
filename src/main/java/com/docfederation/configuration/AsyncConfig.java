package com.docfederation.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for repository syncs.
 *
 * The pool size is the global concurrency limit. Per-repository serialization
 * is enforced by the coordinator, so the queue only ever holds one task per
 * repository.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(AppProperties appProperties) {
        int workers = appProperties.getSync().getMaxConcurrentSyncs();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("doc-sync-");

        // Let in-flight syncs finish their commit on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Sync executor configured: workers={}", workers);

        return executor;
    }
}
