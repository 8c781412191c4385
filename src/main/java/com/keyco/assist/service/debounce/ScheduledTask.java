package com.keyco.assist.service.debounce;

/**
 * Handle to a delayed action. Cancelling is idempotent; cancelling a task that already ran is a no-op.
 */
public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
