package com.keyco.assist.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for request orchestration.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Resolution latency per mode, from first attempt to publish</li>
 *   <li>Published results per mode, tagged with whether they came from the cache</li>
 *   <li>Published failures per mode and failure kind</li>
 *   <li>Cancellations, retries and circuit transitions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AssistMetrics {

    private static final String METRIC_PREFIX = "keyco.assist";

    private final MeterRegistry registry;

    public AssistMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records time from the first transport attempt to the published outcome.
     *
     * @param mode mode wire name
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String mode, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to resolve a fired candidate")
                .tag("mode", mode)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String mode, boolean fromCache) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of published results")
                .tag("mode", mode)
                .tag("cached", Boolean.toString(fromCache))
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param mode mode wire name
     * @param kind failure kind tag (network, timeout, rate_limited, ...)
     */
    public void incrementFailure(String mode, String kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of published failures")
                .tag("mode", mode)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementCancelled(String mode) {
        Counter.builder(METRIC_PREFIX + ".cancelled")
                .description("Number of in-flight calls cancelled by newer input")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void incrementRetry(String mode, String reason) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of scheduled retries")
                .tag("mode", mode)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a breaker state change.
     *
     * @param endpoint breaker endpoint
     * @param to new state name
     */
    public void recordCircuitTransition(String endpoint, String to) {
        Counter.builder(METRIC_PREFIX + ".circuit.transition")
                .description("Number of circuit breaker state transitions")
                .tag("endpoint", endpoint)
                .tag("to", to)
                .register(registry)
                .increment();
    }
}
