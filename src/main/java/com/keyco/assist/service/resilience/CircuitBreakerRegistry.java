package com.keyco.assist.service.resilience;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.config.properties.CircuitBreakerProperties;
import com.keyco.assist.config.properties.RetryProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide owner of one {@link CircuitBreaker} per backend endpoint.
 *
 * <p>Created at startup, reset only on explicit user action ({@link #resetAll()}, e.g. sign-out).
 */
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerProperties props;
    private final Duration minProbeLease;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(CircuitBreakerProperties props, Clock clock, ApplicationEventPublisher publisher) {
        this(props, Duration.ZERO, clock, publisher);
    }

    public CircuitBreakerRegistry(CircuitBreakerProperties props,
                                  Duration minProbeLease,
                                  Clock clock,
                                  ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.minProbeLease = minProbeLease == null ? Duration.ZERO : minProbeLease;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
    }

    /**
     * Longest a single call can legitimately run, retries included: connect plus read timeout
     * for the last attempt on top of the whole retry budget.
     */
    public static Duration probeLeaseFor(BackendProperties backend, RetryProperties retry) {
        return backend.connectTimeout().plus(backend.requestTimeout()).plus(retry.maxElapsed());
    }

    public CircuitBreaker forEndpoint(String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return breakers.computeIfAbsent(endpoint, name -> {
            LOG.debug("Creating circuit breaker for endpoint {}", name);
            return new CircuitBreaker(name, props, minProbeLease, clock, publisher);
        });
    }

    public List<CircuitSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitSnapshot::endpoint))
                .toList();
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        LOG.info("All circuit breakers reset: {}", breakers.keySet());
    }
}
