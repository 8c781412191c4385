package com.keyco.assist.service.orchestration;

import com.keyco.assist.config.properties.DebounceProperties;
import com.keyco.assist.config.properties.RequestProperties;
import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.debounce.DelayScheduler;
import com.keyco.assist.service.metrics.AssistMetricsPublisher;
import com.keyco.assist.service.resilience.CircuitBreakerRegistry;
import com.keyco.assist.service.resilience.RetryScheduler;
import com.keyco.assist.service.sequence.FingerprintCalculator;
import com.keyco.assist.service.sink.ResultSink;
import com.keyco.assist.service.transport.BackendTransport;

import java.time.Clock;
import java.util.Objects;

/**
 * Groups the process-wide collaborators every session is built from.
 * Keeps {@link AssistSessionRegistry} and the coordinator constructors short.
 */
public final class SessionDependencies {

    private final BackendTransport transport;
    private final CircuitBreakerRegistry breakers;
    private final ResponseCache cache;
    private final RetryScheduler retryScheduler;
    private final DelayScheduler delayScheduler;
    private final ResultSink sink;
    private final AssistMetricsPublisher metrics;
    private final FingerprintCalculator fingerprints;
    private final DebounceProperties debounceProperties;
    private final RequestProperties requestProperties;
    private final Clock clock;

    /**
     * @param cache response cache, {@code null} when caching is disabled
     * @param metrics metrics publisher, {@code null} for {@link AssistMetricsPublisher#NOOP}
     */
    public SessionDependencies(BackendTransport transport,
                               CircuitBreakerRegistry breakers,
                               ResponseCache cache,
                               RetryScheduler retryScheduler,
                               DelayScheduler delayScheduler,
                               ResultSink sink,
                               AssistMetricsPublisher metrics,
                               FingerprintCalculator fingerprints,
                               DebounceProperties debounceProperties,
                               RequestProperties requestProperties,
                               Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.cache = cache;
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler");
        this.delayScheduler = Objects.requireNonNull(delayScheduler, "delayScheduler");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = metrics == null ? AssistMetricsPublisher.NOOP : metrics;
        this.fingerprints = Objects.requireNonNull(fingerprints, "fingerprints");
        this.debounceProperties = Objects.requireNonNull(debounceProperties, "debounceProperties");
        this.requestProperties = Objects.requireNonNull(requestProperties, "requestProperties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BackendTransport getTransport() {
        return transport;
    }

    public CircuitBreakerRegistry getBreakers() {
        return breakers;
    }

    /** May be {@code null}. */
    public ResponseCache getCache() {
        return cache;
    }

    public RetryScheduler getRetryScheduler() {
        return retryScheduler;
    }

    public DelayScheduler getDelayScheduler() {
        return delayScheduler;
    }

    public ResultSink getSink() {
        return sink;
    }

    public AssistMetricsPublisher getMetrics() {
        return metrics;
    }

    public FingerprintCalculator getFingerprints() {
        return fingerprints;
    }

    public DebounceProperties getDebounceProperties() {
        return debounceProperties;
    }

    public RequestProperties getRequestProperties() {
        return requestProperties;
    }

    public Clock getClock() {
        return clock;
    }
}
