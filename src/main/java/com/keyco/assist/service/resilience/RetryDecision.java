package com.keyco.assist.service.resilience;

import com.keyco.assist.domain.FailureKind;

import java.time.Duration;

/**
 * Outcome of {@link RetryScheduler#nextDelay}: either wait and try attempt {@code nextAttempt},
 * or give up.
 *
 * @param retry whether another attempt should be made
 * @param nextAttempt 1-based number of the attempt that would follow, 0 when giving up
 * @param delay wait before the next attempt, {@link Duration#ZERO} when giving up
 * @param reason failure that prompted the decision
 */
public record RetryDecision(boolean retry, int nextAttempt, Duration delay, FailureKind reason) {

    public static RetryDecision retryAfter(int nextAttempt, Duration delay, FailureKind reason) {
        return new RetryDecision(true, nextAttempt, delay, reason);
    }

    public static RetryDecision giveUp(FailureKind reason) {
        return new RetryDecision(false, 0, Duration.ZERO, reason);
    }
}
