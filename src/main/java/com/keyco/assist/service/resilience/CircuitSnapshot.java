package com.keyco.assist.service.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one breaker, safe to hand to other threads.
 *
 * @param endpoint breaker endpoint
 * @param state current state
 * @param consecutiveFailures failures counted in the rolling window
 * @param openedAt when the breaker last opened, {@code null} if never or since reset
 * @param cooldown cooldown applied to the current or last trip
 * @param probeInFlight whether the half-open probe slot is taken
 * @param trips consecutive trips without a recovery
 */
public record CircuitSnapshot(
        String endpoint,
        CircuitState state,
        int consecutiveFailures,
        Instant openedAt,
        Duration cooldown,
        boolean probeInFlight,
        int trips
) {
}
