package com.keyco.assist.config;

import com.keyco.assist.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by request orchestration.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool for blocking backend HTTP calls.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.transport.*} properties:
     * <ul>
     *   <li>Core pool: default 2 - one call per active session is typical</li>
     *   <li>Max pool: default 4 - handles several sessions at once</li>
     *   <li>Queue: default 20 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * Callers submit from timer threads, which must never run a blocking HTTP call. When the
     * pool and queue are full the submission is rejected and the transport fails the attempt.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request/session correlation IDs in async logs.
     *
     * @return Configured executor for backend calls
     */
    @Bean(name = "transportExecutor")
    public Executor transportExecutor() {
        ThreadPoolProperties.TransportPoolProperties props = threadPoolProperties.getTransport();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // In-flight calls are cancelled by session teardown; nothing worth waiting for
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for debounce and retry-backoff timers. Timer tasks are short and never block.
     * Log context is carried by {@code ExecutorDelayScheduler}, which decorates each task with
     * {@link #mdcPropagatingDecorator()}.
     *
     * @return Configured scheduler
     */
    @Bean(name = "assistScheduler")
    public ThreadPoolTaskScheduler assistScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Propagates the submitting thread's Log4j2 ThreadContext to the worker and restores the
     * worker's previous context afterwards.
     */
    public static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
