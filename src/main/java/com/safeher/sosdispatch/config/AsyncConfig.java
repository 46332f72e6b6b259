package com.safeher.sosdispatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configures the async thread pool used for emergency-contact fan-out, plus scheduling
 * for the expiry sweeper.
 *
 * Alert creation hands contact SMS/calls to this pool so the SOS response never waits on
 * the gateway.
 * - Core: 5 threads
 * - Max: 20 threads
 * - Queue: 200 tasks
 * - Saturation: the task is dropped and logged at ERROR, the submitting thread never sends
 */
@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig {

    @Value("${notification.executor.core-pool-size:5}")
    private int corePoolSize;

    @Value("${notification.executor.max-pool-size:20}")
    private int maxPoolSize;

    @Value("${notification.executor.queue-capacity:200}")
    private int queueCapacity;

    @Bean("notificationTaskExecutor")
    public Executor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-async-");
        executor.setRejectedExecutionHandler(new DropAndLogPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Rejection handler for a saturated notification pool. The contact fan-out is
     * best-effort, so the task is discarded instead of running on the request thread.
     */
    static class DropAndLogPolicy implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor pool) {
            log.error("DISPATCH: notification pool saturated (active={}, queued={}), contact fan-out dropped",
                    pool.getActiveCount(), pool.getQueue().size());
        }
    }
}
