package com.keyco.assist.presentation.controller;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RewriteOptions;
import com.keyco.assist.exception.InvalidAssistRequestException;
import com.keyco.assist.service.orchestration.AssistSession;
import com.keyco.assist.service.orchestration.AssistSessionRegistry;
import com.keyco.assist.service.sink.SessionOutcomeStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local REST adapter through which the input surface drives its session.
 *
 * <p>Commands return 202: outcomes are produced asynchronously and fetched with
 * {@code GET /api/sessions/{id}/outcome}.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final AssistSessionRegistry registry;
    private final SessionOutcomeStore outcomes;

    SessionController(AssistSessionRegistry registry, SessionOutcomeStore outcomes) {
        this.registry = registry;
        this.outcomes = outcomes;
    }

    record CreateSessionRequest(String mode) {}

    record TextRequest(@NotNull(message = "text is required") String text) {}

    record ModeRequest(@NotBlank(message = "mode is required") String mode) {}

    record OptionsRequest(Double tone, Double length, String preset, String locale) {}

    @PostMapping
    ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) CreateSessionRequest body) {
        Mode mode = body == null || body.mode() == null ? Mode.COMPOSE : parseMode(body.mode());
        AssistSession session = registry.create(mode);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "sessionId", session.id(),
                "mode", mode.wireName()));
    }

    @PutMapping("/{id}/text")
    ResponseEntity<Void> text(@PathVariable String id, @Valid @RequestBody TextRequest body) {
        registry.get(id).textChanged(body.text());
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/{id}/mode")
    ResponseEntity<Void> mode(@PathVariable String id, @Valid @RequestBody ModeRequest body) {
        AssistSession session = registry.get(id);
        session.modeChanged(parseMode(body.mode()));
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/{id}/options")
    ResponseEntity<Void> options(@PathVariable String id, @RequestBody OptionsRequest body) {
        AssistSession session = registry.get(id);
        RewriteOptions current = session.options();
        RewriteOptions next = new RewriteOptions(
                body.tone() == null ? current.tone() : body.tone(),
                body.length() == null ? current.length() : body.length(),
                body.preset() == null ? current.preset() : body.preset(),
                body.locale() == null ? current.locale() : body.locale());
        session.optionsChanged(next);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/refresh")
    ResponseEntity<Void> refresh(@PathVariable String id) {
        registry.get(id).refresh();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/outcome")
    ResponseEntity<Map<String, Object>> outcome(@PathVariable String id) {
        registry.get(id);
        return outcomes.latest(id)
                .map(o -> ResponseEntity.ok(o.isSuccess() ? toBody(o.result()) : toBody(o.failure())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> close(@PathVariable String id) {
        registry.close(id);
        return ResponseEntity.noContent().build();
    }

    private static Mode parseMode(String value) {
        try {
            return Mode.fromWireName(value);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected mode value: {}", e.getMessage());
            throw new InvalidAssistRequestException("unknown mode '" + value + "'", e);
        }
    }

    private static Map<String, Object> toBody(AssistResult r) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("sessionId", r.sessionId());
        body.put("sequence", r.sequence());
        body.put("mode", r.mode().wireName());
        body.put("text", r.text());
        body.put("fromCache", r.fromCache());
        body.put("usage", Map.of(
                "promptTokens", r.usage().promptTokens(),
                "completionTokens", r.usage().completionTokens(),
                "totalTokens", r.usage().totalTokens()));
        body.put("completedAt", r.completedAt().toString());
        return body;
    }

    private static Map<String, Object> toBody(AssistFailure f) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "failure");
        body.put("sessionId", f.sessionId());
        body.put("sequence", f.sequence());
        body.put("mode", f.mode().wireName());
        body.put("kind", f.kind().tag());
        body.put("message", f.userMessage());
        body.put("attempts", f.attempts());
        if (f.retryAfter() != null) {
            body.put("retryAfterSeconds", f.retryAfter().toSeconds());
        }
        body.put("failedAt", f.failedAt().toString());
        return body;
    }
}
