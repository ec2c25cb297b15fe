package com.positionledger.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor backing {@code PositionLedgerService#buildLedgerWithin}. Each submitted task is
 * one whole pipeline run, so a small pool is enough; the fold itself is never split.
 *
 * <p>A saturated pool rejects new runs instead of running them on the caller, so every
 * accepted run stays under the compute timeout.
 */
@Configuration
public class LedgerExecutorConfig {

    @Bean("ledgerExecutor")
    public ThreadPoolTaskExecutor ledgerExecutor(LedgerProperties properties) {
        LedgerProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("ledger-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
