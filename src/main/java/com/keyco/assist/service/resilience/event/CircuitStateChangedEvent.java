package com.keyco.assist.service.resilience.event;

import com.keyco.assist.service.resilience.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * Published after a breaker changes state. Emitted outside the breaker's lock.
 *
 * @param endpoint breaker endpoint
 * @param from previous state
 * @param to new state
 * @param at transition time
 * @param consecutiveFailures failure count at transition time
 * @param cooldown cooldown in effect when {@code to} is OPEN, otherwise {@link Duration#ZERO}
 */
public record CircuitStateChangedEvent(
        String endpoint,
        CircuitState from,
        CircuitState to,
        Instant at,
        int consecutiveFailures,
        Duration cooldown
) {
    public CircuitStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
        if (cooldown == null) {
            cooldown = Duration.ZERO;
        }
    }
}
