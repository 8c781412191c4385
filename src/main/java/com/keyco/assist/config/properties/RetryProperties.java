package com.keyco.assist.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the retry scheduler.
 */
@ConfigurationProperties(prefix = "assist.retry")
@Validated
public class RetryProperties {

    /** Total transport attempts per candidate, including the first. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    /** Delay before the first retry, doubled per further attempt, in milliseconds. */
    @Positive(message = "Base delay must be positive")
    private long baseDelayMs = 1000;

    /** Upper bound for a single backoff delay, in milliseconds. */
    @Positive(message = "Max delay must be positive")
    private long maxDelayMs = 8000;

    /** Lower bound for a single backoff delay, in milliseconds. */
    @Positive(message = "Min delay must be positive")
    private long minDelayMs = 100;

    /** Jitter ratio applied symmetrically around the exponential delay (0.3 = +/-30%). */
    @DecimalMin(value = "0.0", message = "Jitter must be >= 0")
    @DecimalMax(value = "1.0", message = "Jitter must be <= 1")
    private double jitter = 0.3;

    /** Total time budget for one candidate's resolution, in milliseconds. */
    @Positive(message = "Max elapsed must be positive")
    private long maxElapsedMs = 20_000;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public long getMinDelayMs() {
        return minDelayMs;
    }

    public void setMinDelayMs(long minDelayMs) {
        this.minDelayMs = minDelayMs;
    }

    public double getJitter() {
        return jitter;
    }

    public void setJitter(double jitter) {
        this.jitter = jitter;
    }

    public long getMaxElapsedMs() {
        return maxElapsedMs;
    }

    public void setMaxElapsedMs(long maxElapsedMs) {
        this.maxElapsedMs = maxElapsedMs;
    }

    public Duration baseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration maxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public Duration minDelay() {
        return Duration.ofMillis(minDelayMs);
    }

    public Duration maxElapsed() {
        return Duration.ofMillis(maxElapsedMs);
    }
}
