package com.marketpulse.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the per-symbol fan-out in screening and market scans.
 *
 * <p>Work is CPU-bound and has no shared state, so a bounded pool with caller-runs
 * back-pressure is enough; a saturated pool degrades to running on the request thread.
 */
@Configuration
public class ScreenerExecutorConfig {

    @Bean("screenerExecutor")
    public ThreadPoolTaskExecutor screenerExecutor(ScreenerConfig screenerConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(screenerConfig.getCorePoolSize());
        executor.setMaxPoolSize(screenerConfig.getMaxPoolSize());
        executor.setQueueCapacity(screenerConfig.getQueueCapacity());
        executor.setThreadNamePrefix("screener-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
