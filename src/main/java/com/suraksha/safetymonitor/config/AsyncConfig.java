package com.suraksha.safetymonitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for work that must never run on the request thread's critical path.
 *
 *  broadcastTaskExecutor    - drains in-process subscriber queues (SSE streams).
 *                             AbortPolicy: a rejected drain closes that subscriber,
 *                             the publisher is never blocked.
 *  collaboratorTaskExecutor - fire-and-forget calls to the ledger service.
 *                             CallerRunsPolicy: if the queue is full the caller
 *                             does the call itself, bounded by the HTTP read timeout.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean("broadcastTaskExecutor")
    public Executor broadcastTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("broadcast-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("collaboratorTaskExecutor")
    public Executor collaboratorTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("collaborator-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /** Single time source for every timestamp the service assigns. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
