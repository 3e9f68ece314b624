package com.phiguard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for rotation work.
 *
 * Row re-encryption is CPU bound (AES-GCM) plus one short database round trip per row, so a
 * bounded platform thread pool sized by configuration is used. When the queue is full the
 * stepping thread runs the row itself, which throttles the batch instead of failing it.
 */
@Configuration
@EnableScheduling
@Slf4j
public class RotationExecutorConfiguration {

    @Bean(name = "rotationWorkerExecutor")
    public Executor rotationWorkerExecutor(PhiGuardProperties properties) {
        PhiGuardProperties.Rotation rotation = properties.getRotation();
        int workers = Math.max(1, rotation.getParallelism());
        log.info("Configuring rotation worker pool with {} threads", workers);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(rotation.getBatchSize(), 1) * 2);
        executor.setThreadNamePrefix("rotation-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }
}
