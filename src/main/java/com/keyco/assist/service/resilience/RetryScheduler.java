package com.keyco.assist.service.resilience;

import com.keyco.assist.config.properties.RetryProperties;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter.
 *
 * <p>Delay for the retry after attempt {@code n} is {@code base * 2^(n-1)}, scaled by a random
 * factor in {@code [1 - jitter, 1 + jitter]} and clamped to {@code [min-delay, max-delay]}.
 * Rate-limited failures use the backend's retry hint when one is present. Gives up when the kind
 * is not retryable, the attempt budget is spent, or waiting would exceed the elapsed-time budget.
 *
 * <p>Stateless; safe to share.
 */
public class RetryScheduler {

    private static final Logger LOG = LogManager.getLogger(RetryScheduler.class);

    private final RetryProperties props;
    private final DoubleSupplier random;

    public RetryScheduler(RetryProperties props) {
        this(props, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1); a constant 0.5 removes jitter
     */
    public RetryScheduler(RetryProperties props, DoubleSupplier random) {
        this.props = Objects.requireNonNull(props, "props");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Decides what to do after a failed attempt.
     *
     * @param attemptsMade attempts made so far, at least 1
     * @param reason classification of the last failure
     * @param retryAfterHint backend retry hint, nullable
     * @param elapsed time since the candidate's first attempt started
     * @return retry-after decision or give-up
     */
    public RetryDecision nextDelay(int attemptsMade, FailureKind reason, Duration retryAfterHint, Duration elapsed) {
        Objects.requireNonNull(reason, "reason");
        if (!reason.isRetryable()) {
            return RetryDecision.giveUp(reason);
        }
        if (attemptsMade >= props.getMaxAttempts()) {
            LOG.debug("Retry budget spent after {} attempts ({})", attemptsMade, reason.tag());
            return RetryDecision.giveUp(reason);
        }

        Duration delay = reason == FailureKind.RATE_LIMITED && retryAfterHint != null && !retryAfterHint.isNegative()
                ? TimeUtils.max(retryAfterHint, props.minDelay())
                : backoff(Math.max(1, attemptsMade));

        // Compared against what is left so an arbitrarily large hint cannot overflow
        Duration spent = elapsed == null || elapsed.isNegative() ? Duration.ZERO : elapsed;
        Duration remaining = props.maxElapsed().minus(spent);
        if (delay.compareTo(remaining) > 0) {
            LOG.debug("Retry would exceed elapsed budget: spent={}, delay={}, budget={}",
                    spent, delay, props.maxElapsed());
            return RetryDecision.giveUp(reason);
        }
        return RetryDecision.retryAfter(attemptsMade + 1, delay, reason);
    }

    private Duration backoff(int attempt) {
        double exponential = props.baseDelay().toMillis() * Math.pow(2, attempt - 1);
        double factor = 1.0 + props.getJitter() * (2.0 * random.getAsDouble() - 1.0);
        long millis = Math.round(exponential * factor);
        long clamped = Math.max(props.getMinDelayMs(), Math.min(props.getMaxDelayMs(), millis));
        return Duration.ofMillis(clamped);
    }
}
