package com.keyco.assist.service.events;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.service.metrics.AssistMetrics;
import com.keyco.assist.service.resilience.CircuitState;
import com.keyco.assist.service.resilience.event.CircuitStateChangedEvent;
import com.keyco.assist.service.sink.event.AssistFailurePublishedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ResilienceEventsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ResilienceEventsListener listener = new ResilienceEventsListener(new AssistMetrics(registry));

    @Test
    void throttlesRepeatLogs() {
        // shouldLog allows first occurrence
        assertThat(listener.shouldLog("circuit-open-/api/chat")).isTrue();
        // but rejects immediately repeated
        assertThat(listener.shouldLog("circuit-open-/api/chat")).isFalse();
        assertThat(listener.shouldLog("circuit-open-/api/rewrite")).isTrue();
    }

    @Test
    void recordsTransitionMetric() {
        listener.onCircuitStateChanged(new CircuitStateChangedEvent("/api/chat", CircuitState.CLOSED,
                CircuitState.OPEN, Instant.now(), 5, Duration.ofSeconds(30)));
        listener.onCircuitStateChanged(new CircuitStateChangedEvent("/api/chat", CircuitState.HALF_OPEN,
                CircuitState.CLOSED, Instant.now(), 0, Duration.ZERO));

        assertThat(registry.find("keyco.assist.circuit.transition").tag("to", "open").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("keyco.assist.circuit.transition").tag("to", "closed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void handlesSurfacedFailuresWithoutThrowing() {
        AssistFailure timeout = new AssistFailure("s", 1, Mode.COMPOSE, FailureKind.TIMEOUT, null, null,
                3, 0, null, Instant.now());
        AssistFailure client = new AssistFailure("s", 2, Mode.COMPOSE, FailureKind.CLIENT_ERROR, null, null,
                1, 400, null, Instant.now());

        assertThatCode(() -> {
            listener.onFailurePublished(new AssistFailurePublishedEvent(timeout));
            listener.onFailurePublished(new AssistFailurePublishedEvent(client));
        }).doesNotThrowAnyException();
        assertThat(listener.shouldLog("failure-compose-timeout")).isFalse();
        assertThat(listener.shouldLog("failure-compose-client_error")).isTrue();
    }
}
