package com.keyco.assist.service.debounce;

import com.keyco.assist.config.ThreadPoolConfig;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ExecutorDelaySchedulerTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private ExecutorDelayScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.initialize();
        scheduler = new ExecutorDelayScheduler(taskScheduler, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void shouldRunActionAfterDelay() {
        AtomicInteger runs = new AtomicInteger();

        scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(20));

        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() == 1);
    }

    @Test
    void shouldNotRunCancelledAction() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();

        ScheduledTask task = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(200));
        task.cancel();
        Thread.sleep(400);

        assertThat(task.isCancelled()).isTrue();
        assertThat(runs.get()).isZero();
    }

    @Test
    void shouldCarryLogContextFromSchedulingThreadToTimer() {
        ExecutorDelayScheduler decorated = new ExecutorDelayScheduler(taskScheduler, Clock.systemUTC(),
                ThreadPoolConfig.mdcPropagatingDecorator());
        AtomicReference<String> seen = new AtomicReference<>();

        ThreadContext.put("sessionId", "s-7");
        try {
            decorated.schedule(() -> seen.set(ThreadContext.get("sessionId")), Duration.ofMillis(10));
        } finally {
            ThreadContext.clearAll();
        }

        await().atMost(Duration.ofSeconds(2)).until(() -> seen.get() != null);
        assertThat(seen.get()).isEqualTo("s-7");
    }
}
