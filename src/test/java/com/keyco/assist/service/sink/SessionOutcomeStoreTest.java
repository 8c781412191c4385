package com.keyco.assist.service.sink;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Fingerprint;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.Usage;
import com.keyco.assist.service.sink.event.AssistFailurePublishedEvent;
import com.keyco.assist.service.sink.event.AssistResultPublishedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionOutcomeStoreTest {

    private final SessionOutcomeStore store = new SessionOutcomeStore();

    private static AssistResult result(long seq, String text) {
        return new AssistResult("s", seq, new Fingerprint(Mode.COMPOSE, "ab"), Mode.COMPOSE, text,
                Usage.NONE, false, Instant.now());
    }

    private static AssistFailure failure(long seq) {
        return new AssistFailure("s", seq, Mode.COMPOSE, FailureKind.SERVER_ERROR, null, "boom",
                3, 503, null, Instant.now());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertThat(store.latest("s")).isEmpty();
    }

    @Test
    void shouldKeepNewestOutcomeBySequence() {
        store.onResult(new AssistResultPublishedEvent(result(1, "first")));
        store.onFailure(new AssistFailurePublishedEvent(failure(2)));

        SessionOutcomeStore.Outcome outcome = store.latest("s").orElseThrow();
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failure().kind()).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(outcome.sequence()).isEqualTo(2);
    }

    @Test
    void shouldNotLetOlderOutcomeReplaceNewer() {
        store.onResult(new AssistResultPublishedEvent(result(5, "newer")));
        store.onResult(new AssistResultPublishedEvent(result(4, "older")));

        assertThat(store.latest("s").orElseThrow().result().text()).isEqualTo("newer");
    }

    @Test
    void shouldForgetSession() {
        store.onResult(new AssistResultPublishedEvent(result(1, "x")));

        store.forget("s");

        assertThat(store.latest("s")).isEmpty();
    }
}
