package com.keyco.assist.testutil;

import com.keyco.assist.service.debounce.DelayScheduler;
import com.keyco.assist.service.debounce.ScheduledTask;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Virtual-time {@link DelayScheduler}. Nothing runs until {@link #advance} is called; due tasks
 * then run on the calling thread in due order, including tasks scheduled while advancing.
 *
 * <p>When given a {@link MutableClock}, the clock is moved to each task's due time before the
 * task runs, so code that reads the clock sees consistent time.
 */
public class ManualDelayScheduler implements DelayScheduler {

    private final MutableClock clock;
    private final List<Task> tasks = new ArrayList<>();
    private Duration now = Duration.ZERO;
    private long order;

    public ManualDelayScheduler() {
        this(null);
    }

    public ManualDelayScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable action, Duration delay) {
        Duration effective = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;
        Task task = new Task(action, now.plus(effective), order++);
        tasks.add(task);
        return task;
    }

    public void advance(Duration by) {
        Duration target;
        synchronized (this) {
            target = now.plus(by);
        }
        while (true) {
            Task next;
            synchronized (this) {
                tasks.removeIf(Task::isCancelled);
                next = tasks.stream()
                        .filter(t -> t.due.compareTo(target) <= 0)
                        .min(Comparator.comparing((Task t) -> t.due).thenComparingLong(t -> t.order))
                        .orElse(null);
                if (next == null) {
                    break;
                }
                tasks.remove(next);
                moveTo(next.due);
            }
            next.action.run();
        }
        synchronized (this) {
            moveTo(target);
        }
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /** Number of scheduled tasks that are neither cancelled nor run. */
    public synchronized int pendingCount() {
        return (int) tasks.stream().filter(t -> !t.isCancelled()).count();
    }

    private void moveTo(Duration time) {
        if (time.compareTo(now) > 0) {
            if (clock != null) {
                clock.advance(time.minus(now));
            }
            now = time;
        }
    }

    private static final class Task implements ScheduledTask {
        private final Runnable action;
        private final Duration due;
        private final long order;
        private volatile boolean cancelled;

        private Task(Runnable action, Duration due, long order) {
            this.action = action;
            this.due = due;
            this.order = order;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
