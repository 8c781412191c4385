package com.keyco.assist.service.health;

import com.keyco.assist.service.transport.BackendHealthClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the remote AI backend, based on its {@code /api/health} endpoint.
 *
 * <p>Exposed via /actuator/health endpoint. Informational: circuit breakers do not consult it.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final BackendHealthClient client;

    public BackendHealthIndicator(BackendHealthClient client) {
        this.client = client;
    }

    @Override
    public Health health() {
        BackendHealthClient.BackendHealth health = client.check();
        Health.Builder builder = health.up() ? Health.up() : Health.down();
        return builder
                .withDetail("status", health.detail())
                .withDetail("httpStatus", health.statusCode())
                .withDetail("latencyMs", health.latencyMs())
                .build();
    }
}
