package com.keyco.assist.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Lifetime of sessions a client stopped talking to without closing them.
 */
@ConfigurationProperties(prefix = "assist.session")
@Validated
public class SessionProperties {

    /** A session not touched for this long is closed by the sweep; 0 disables expiry. */
    @Min(value = 0, message = "Idle timeout minutes must not be negative")
    private long idleTimeoutMinutes = 30;

    /** How often the idle sweep runs, in milliseconds. */
    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 60_000;

    public long getIdleTimeoutMinutes() {
        return idleTimeoutMinutes;
    }

    public void setIdleTimeoutMinutes(long idleTimeoutMinutes) {
        this.idleTimeoutMinutes = idleTimeoutMinutes;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Duration idleTimeout() {
        return Duration.ofMinutes(idleTimeoutMinutes);
    }
}
