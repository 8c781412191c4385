package com.keyco.assist.presentation.controller;

import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.resilience.CircuitBreakerRegistry;
import com.keyco.assist.service.resilience.CircuitSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breaker inspection and the explicit reset used on sign-out.
 */
@RestController
@RequestMapping("/api/resilience")
class ResilienceController {

    private static final Logger LOG = LogManager.getLogger(ResilienceController.class);

    private final CircuitBreakerRegistry breakers;
    private final ResponseCache cache;

    ResilienceController(CircuitBreakerRegistry breakers, ResponseCache cache) {
        this.breakers = breakers;
        this.cache = cache;
    }

    @GetMapping("/circuits")
    ResponseEntity<List<Map<String, Object>>> circuits() {
        return ResponseEntity.ok(breakers.snapshots().stream().map(ResilienceController::toBody).toList());
    }

    /**
     * Resets every breaker to CLOSED and clears the response cache.
     */
    @PostMapping("/reset")
    ResponseEntity<Void> reset() {
        LOG.info("Resilience reset requested");
        breakers.resetAll();
        cache.clear();
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Object> toBody(CircuitSnapshot s) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("endpoint", s.endpoint());
        body.put("state", s.state().name());
        body.put("consecutiveFailures", s.consecutiveFailures());
        body.put("openedAt", s.openedAt() == null ? null : s.openedAt().toString());
        body.put("cooldownSeconds", s.cooldown().toSeconds());
        body.put("probeInFlight", s.probeInFlight());
        body.put("trips", s.trips());
        return body;
    }
}
