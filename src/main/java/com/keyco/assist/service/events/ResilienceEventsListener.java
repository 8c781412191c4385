package com.keyco.assist.service.events;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.service.metrics.AssistMetrics;
import com.keyco.assist.service.resilience.CircuitState;
import com.keyco.assist.service.resilience.event.CircuitStateChangedEvent;
import com.keyco.assist.service.sink.event.AssistFailurePublishedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for breaker transitions and surfaced failures. Records transition metrics
 * and logs operator-facing warnings, privacy-safe and throttled to avoid log spam while a
 * backend is down.
 */
@Component
class ResilienceEventsListener {
    private static final Logger LOG = LogManager.getLogger(ResilienceEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final AssistMetrics metrics;

    ResilienceEventsListener(AssistMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onCircuitStateChanged(CircuitStateChangedEvent e) {
        metrics.recordCircuitTransition(e.endpoint(), e.to().name().toLowerCase(Locale.ROOT));
        if (e.to() == CircuitState.OPEN) {
            if (shouldLog("circuit-open-" + e.endpoint())) {
                LOG.warn("Circuit for {} is OPEN after {} failures; failing fast for {}s",
                        e.endpoint(), e.consecutiveFailures(), e.cooldown().toSeconds());
            }
        } else if (e.to() == CircuitState.CLOSED && e.from() != CircuitState.CLOSED) {
            LOG.info("Circuit for {} recovered ({} -> CLOSED)", e.endpoint(), e.from());
        }
    }

    @EventListener
    void onFailurePublished(AssistFailurePublishedEvent e) {
        AssistFailure failure = e.failure();
        FailureKind kind = failure.kind();
        if (kind == FailureKind.CLIENT_ERROR || kind == FailureKind.CANCELLED) {
            return;
        }
        String key = "failure-" + failure.mode().wireName() + '-' + kind.tag();
        if (shouldLog(key)) {
            LOG.warn("Surfaced {} failure: mode={}, attempts={}, status={}. Check backend availability.",
                    kind.tag(), failure.mode().wireName(), failure.attempts(), failure.statusCode());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
