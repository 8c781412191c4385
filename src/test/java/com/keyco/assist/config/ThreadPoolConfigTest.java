package com.keyco.assist.config;

import com.keyco.assist.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateTransportExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        Executor executor = config.transportExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        // Check against default property values
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(2);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("transport-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void shouldRejectWhenSaturatedInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getTransport().setCorePoolSize(1);
        properties.getTransport().setMaxPoolSize(1);
        properties.getTransport().setQueueCapacity(1);
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).transportExecutor();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> overflowThread = new AtomicReference<>();

        executor.execute(() -> {
            started.countDown();
            awaitQuietly(release);
        });
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        executor.execute(() -> awaitQuietly(release));

        assertThatThrownBy(() -> executor.execute(() -> overflowThread.set(Thread.currentThread().getName())))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(overflowThread.get()).isNull();
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);

        release.countDown();
        executor.shutdown();
    }

    @Test
    void shouldPropagateThreadContextToWorker() throws InterruptedException {
        ThreadPoolTaskExecutor executor =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).transportExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("sessionId", "s-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
        assertThat(threadName.get()).startsWith("transport-pool-");
        executor.shutdown();
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() -> ThreadContext.put("extra", "x"));
        ThreadContext.clearAll();
        ThreadContext.put("requestId", "worker");

        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker");
        assertThat(ThreadContext.get("extra")).isNull();
    }

    @Test
    void shouldCreateSchedulerWithPrefix() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).assistScheduler();

        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("assist-timer-");
        assertThat(scheduler.getScheduledThreadPoolExecutor().getRemoveOnCancelPolicy()).isTrue();
        scheduler.shutdown();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
