package com.keyco.assist.service.resilience;

import java.time.Instant;

/**
 * Permission to make one logical call through a breaker. The holder must report the call's
 * resolution exactly once: {@link CircuitBreaker#recordSuccess}, {@link CircuitBreaker#recordFailure}
 * or {@link CircuitBreaker#release}.
 *
 * @param endpoint breaker endpoint that issued the permit
 * @param probe {@code true} for the single half-open probe
 * @param token unique per permit, matches the active probe when {@code probe} is set
 * @param epoch breaker epoch at issue time; reports from an earlier epoch are ignored
 * @param issuedAt issue time
 */
public record CallPermit(String endpoint, boolean probe, long token, long epoch, Instant issuedAt) {
}
