package com.memoryvault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for asynchronous access checks.
 *
 * Voice verification and secret decryption may call out to slow
 * collaborators (embedding models, key services). They run on a bounded
 * platform-thread pool so one slow comparison does not stall unrelated
 * sessions. When the queue is full the caller runs the task itself.
 */
@Configuration
@Slf4j
public class AsyncConfiguration {

    @Bean(name = "accessCheckExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor accessCheckExecutor(VaultProperties properties) {
        log.info("Configuring access-check executor with {} threads", properties.getWorkerThreads());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerThreads());
        executor.setMaxPoolSize(properties.getWorkerThreads());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("access-check-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
