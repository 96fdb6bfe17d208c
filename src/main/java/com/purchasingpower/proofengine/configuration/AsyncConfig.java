package com.purchasingpower.proofengine.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for running the independent analysis passes of one proof concurrently.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "proofAnalysisExecutor")
    public ThreadPoolTaskExecutor proofAnalysisExecutor(ProofAnalysisProperties properties) {
        ProofAnalysisProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("proof-analysis-");

        // Passes are short and CPU-bound; finish them on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Proof analysis executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                settings.getQueueCapacity());

        return executor;
    }
}
