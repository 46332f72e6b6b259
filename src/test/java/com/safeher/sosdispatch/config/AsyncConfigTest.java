package com.safeher.sosdispatch.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for the notification executor's saturation behaviour.
 *
 * Cases:
 * 1. A saturated pool drops the task without running it on the submitting thread
 * 2. The rejection handler itself neither runs the task nor throws
 */
class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Saturated pool → task dropped, submitting thread does not run it")
    void notificationTaskExecutor_saturated_dropsTask() throws Exception {
        AsyncConfig config = new AsyncConfig();
        ReflectionTestUtils.setField(config, "corePoolSize", 1);
        ReflectionTestUtils.setField(config, "maxPoolSize", 1);
        ReflectionTestUtils.setField(config, "queueCapacity", 1);
        executor = (ThreadPoolTaskExecutor) config.notificationTaskExecutor();

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        Runnable blocking = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            completed.incrementAndGet();
        };

        executor.execute(blocking);              // occupies the only worker
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(completed::incrementAndGet);   // fills the queue

        Thread caller = Thread.currentThread();
        AtomicBoolean ranOnCaller = new AtomicBoolean(false);
        assertThatCode(() -> executor.execute(() -> ranOnCaller.set(Thread.currentThread() == caller)))
                .doesNotThrowAnyException();
        assertThat(ranOnCaller).isFalse();

        release.countDown();
        executor.getThreadPoolExecutor().shutdown();
        assertThat(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(2);
        assertThat(ranOnCaller).isFalse();
    }

    @Test
    @DisplayName("DropAndLogPolicy never runs the rejected task")
    void dropAndLogPolicy_doesNotRunTask() {
        AtomicBoolean ran = new AtomicBoolean(false);
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>());
        try {
            new AsyncConfig.DropAndLogPolicy().rejectedExecution(() -> ran.set(true), pool);
        } finally {
            pool.shutdown();
        }

        assertThat(ran).isFalse();
    }
}
