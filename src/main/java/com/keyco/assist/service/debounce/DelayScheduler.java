package com.keyco.assist.service.debounce;

import java.time.Duration;

/**
 * Source of cancellable delays for debounce and backoff timers.
 *
 * <p>Every suspension point in the orchestration layer goes through this interface, so a single
 * teardown can cancel all of them and tests can drive time explicitly.
 */
public interface DelayScheduler {

    /**
     * Runs {@code action} once after {@code delay}.
     *
     * @param action work to run, must not block
     * @param delay non-negative delay
     * @return handle that cancels the action if it has not started
     */
    ScheduledTask schedule(Runnable action, Duration delay);
}
