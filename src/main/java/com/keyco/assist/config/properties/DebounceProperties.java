package com.keyco.assist.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the debounce gate.
 */
@ConfigurationProperties(prefix = "assist.debounce")
@Validated
public class DebounceProperties {

    /** Quiet interval a burst of edits must pause for before a candidate fires, in milliseconds. */
    @Positive(message = "Quiet interval must be positive")
    private long quietIntervalMs = 300;

    public long getQuietIntervalMs() {
        return quietIntervalMs;
    }

    public void setQuietIntervalMs(long quietIntervalMs) {
        this.quietIntervalMs = quietIntervalMs;
    }

    public Duration quietInterval() {
        return Duration.ofMillis(quietIntervalMs);
    }
}
