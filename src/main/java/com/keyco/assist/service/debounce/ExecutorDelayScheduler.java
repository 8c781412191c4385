package com.keyco.assist.service.debounce;

import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DelayScheduler} backed by Spring's {@link TaskScheduler} ({@code assistScheduler}).
 *
 * <p>Each action is wrapped by the {@link TaskDecorator} at schedule time, so state captured
 * from the scheduling thread (log context) is visible when the timer fires.
 */
public class ExecutorDelayScheduler implements DelayScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final TaskDecorator decorator;

    public ExecutorDelayScheduler(TaskScheduler taskScheduler, Clock clock) {
        this(taskScheduler, clock, runnable -> runnable);
    }

    public ExecutorDelayScheduler(TaskScheduler taskScheduler, Clock clock, TaskDecorator decorator) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.decorator = Objects.requireNonNull(decorator, "decorator");
    }

    @Override
    public ScheduledTask schedule(Runnable action, Duration delay) {
        Objects.requireNonNull(action, "action");
        Duration effective = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;
        ScheduledFuture<?> future = taskScheduler.schedule(decorator.decorate(action),
                clock.instant().plus(effective));
        return new FutureTask(future);
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
