package com.keyco.assist.service.resilience;

/**
 * Circuit breaker states.
 *
 * <pre>
 * CLOSED    → OPEN      (failure threshold reached within the rolling window)
 * OPEN      → HALF_OPEN (cooldown elapsed, checked lazily on next use)
 * HALF_OPEN → CLOSED    (probe succeeded)
 * HALF_OPEN → OPEN      (probe failed, cooldown extended)
 * any       → CLOSED    (explicit reset)
 * </pre>
 */
public enum CircuitState { CLOSED, OPEN, HALF_OPEN }
