package com.keyco.assist.service.orchestration;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.config.properties.CircuitBreakerProperties;
import com.keyco.assist.config.properties.DebounceProperties;
import com.keyco.assist.config.properties.RequestProperties;
import com.keyco.assist.config.properties.RetryProperties;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.resilience.CircuitBreaker;
import com.keyco.assist.service.resilience.CircuitBreakerRegistry;
import com.keyco.assist.service.resilience.RetryScheduler;
import com.keyco.assist.service.sequence.FingerprintCalculator;
import com.keyco.assist.testutil.ControllableTransport;
import com.keyco.assist.testutil.ManualDelayScheduler;
import com.keyco.assist.testutil.MutableClock;
import com.keyco.assist.testutil.RecordingResultSink;

import java.time.Duration;

/**
 * Deterministic wiring for orchestration tests: virtual time, a transport the test answers by
 * hand, jitter-free retries and a recording sink.
 *
 * <p>Defaults: 300ms quiet interval, 3 attempts with 1s/2s backoff, breaker threshold 5 with a
 * 30s cooldown and a 40s probe lease. Each mode's breaker endpoint is its wire name.
 */
final class OrchestrationTestFixture {

    final MutableClock clock = MutableClock.atEpoch();
    final ManualDelayScheduler scheduler = new ManualDelayScheduler(clock);
    final ControllableTransport transport = new ControllableTransport();
    final RecordingResultSink sink = new RecordingResultSink();
    final DebounceProperties debounceProperties = new DebounceProperties();
    final RequestProperties requestProperties = new RequestProperties();
    final RetryProperties retryProperties = new RetryProperties();
    final CircuitBreakerProperties breakerProperties = new CircuitBreakerProperties();
    final BackendProperties backendProperties = new BackendProperties();
    final CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(breakerProperties,
            CircuitBreakerRegistry.probeLeaseFor(backendProperties, retryProperties), clock, null);
    final ResponseCache cache = new ResponseCache(64, clock);

    SessionDependencies deps() {
        return new SessionDependencies(
                transport,
                breakers,
                cache,
                new RetryScheduler(retryProperties, () -> 0.5),
                scheduler,
                sink,
                null,
                new FingerprintCalculator(),
                debounceProperties,
                requestProperties,
                clock);
    }

    AssistSession session(Mode mode) {
        return new AssistSession("session-1", mode, deps());
    }

    CircuitBreaker breaker(Mode mode) {
        return breakers.forEndpoint(mode.wireName());
    }

    void tripBreaker(Mode mode) {
        CircuitBreaker breaker = breaker(mode);
        for (int i = 0; i < breakerProperties.getFailureThreshold(); i++) {
            breaker.recordFailure(breaker.tryAcquire().orElseThrow());
        }
    }

    void quiet() {
        scheduler.advance(Duration.ofMillis(debounceProperties.getQuietIntervalMs()));
    }
}
