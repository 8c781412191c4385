package com.keyco.assist.service.health;

import com.keyco.assist.service.resilience.CircuitBreakerRegistry;
import com.keyco.assist.service.resilience.CircuitSnapshot;
import com.keyco.assist.service.resilience.CircuitState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the per-endpoint circuit breakers.
 *
 * <ul>
 *   <li>UP: every breaker closed (or none created yet)</li>
 *   <li>DEGRADED: at least one breaker open or half-open, at least one closed</li>
 *   <li>DOWN: no breaker closed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry registry;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        List<CircuitSnapshot> snapshots = registry.snapshots();
        Map<String, Object> details = new LinkedHashMap<>();
        long closed = 0;
        for (CircuitSnapshot s : snapshots) {
            details.put(s.endpoint(), s.state().name().toLowerCase(Locale.ROOT)
                    + " (failures=" + s.consecutiveFailures() + ")");
            if (s.state() == CircuitState.CLOSED) {
                closed++;
            }
        }

        Health.Builder builder;
        if (closed == snapshots.size()) {
            builder = Health.up();
        } else if (closed > 0) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.down();
        }
        return builder.withDetails(details).build();
    }
}
