package com.keyco.assist.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the per-endpoint circuit breakers.
 *
 * <p>The same settings apply to every endpoint; each endpoint still gets its own state.
 */
@ConfigurationProperties(prefix = "assist.circuit-breaker")
@Validated
public class CircuitBreakerProperties {

    /** Failures within the rolling window that trip the breaker. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 5;

    /** Rolling window for counting failures, in seconds. */
    @Positive(message = "Window seconds must be positive")
    private int windowSeconds = 60;

    /** Cooldown after the first trip, in seconds. */
    @Positive(message = "Cooldown seconds must be positive")
    private int cooldownSeconds = 30;

    /** Factor applied to the cooldown for every consecutive trip without a recovery. */
    @DecimalMin(value = "1.0", message = "Cooldown multiplier must be at least 1.0")
    private double cooldownMultiplier = 2.0;

    /** Upper bound for the extended cooldown, in seconds. */
    @Positive(message = "Max cooldown seconds must be positive")
    private int maxCooldownSeconds = 300;

    /** A half-open probe that has not reported within this time frees its slot, in seconds. */
    @Positive(message = "Probe timeout seconds must be positive")
    private int probeTimeoutSeconds = 5;

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(int cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public double getCooldownMultiplier() {
        return cooldownMultiplier;
    }

    public void setCooldownMultiplier(double cooldownMultiplier) {
        this.cooldownMultiplier = cooldownMultiplier;
    }

    public int getMaxCooldownSeconds() {
        return maxCooldownSeconds;
    }

    public void setMaxCooldownSeconds(int maxCooldownSeconds) {
        this.maxCooldownSeconds = maxCooldownSeconds;
    }

    public int getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
        this.probeTimeoutSeconds = probeTimeoutSeconds;
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    public Duration cooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public Duration maxCooldown() {
        return Duration.ofSeconds(maxCooldownSeconds);
    }

    public Duration probeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }
}
