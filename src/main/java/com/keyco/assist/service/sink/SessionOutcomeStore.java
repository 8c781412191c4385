package com.keyco.assist.service.sink;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.service.sink.event.AssistFailurePublishedEvent;
import com.keyco.assist.service.sink.event.AssistResultPublishedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps the latest published outcome per session so the REST adapter can serve it on demand.
 *
 * <p>An outcome is exactly one of a result or a failure. Outcomes are only replaced by outcomes
 * with a higher sequence, so event reordering cannot resurrect an older answer.
 */
@Component
public class SessionOutcomeStore {

    /**
     * Latest outcome of a session; exactly one of {@code result} and {@code failure} is set.
     */
    public record Outcome(long sequence, AssistResult result, AssistFailure failure) {

        static Outcome of(AssistResult result) {
            return new Outcome(result.sequence(), result, null);
        }

        static Outcome of(AssistFailure failure) {
            return new Outcome(failure.sequence(), null, failure);
        }

        public boolean isSuccess() {
            return result != null;
        }
    }

    private final ConcurrentMap<String, Outcome> latest = new ConcurrentHashMap<>();

    @EventListener
    public void onResult(AssistResultPublishedEvent event) {
        record(event.result().sessionId(), Outcome.of(event.result()));
    }

    @EventListener
    public void onFailure(AssistFailurePublishedEvent event) {
        record(event.failure().sessionId(), Outcome.of(event.failure()));
    }

    public Optional<Outcome> latest(String sessionId) {
        return Optional.ofNullable(latest.get(sessionId));
    }

    public void forget(String sessionId) {
        latest.remove(sessionId);
    }

    private void record(String sessionId, Outcome outcome) {
        latest.merge(sessionId, outcome, (prev, next) -> next.sequence() >= prev.sequence() ? next : prev);
    }
}
