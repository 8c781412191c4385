package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RewriteOptions;
import com.keyco.assist.service.resilience.CircuitState;
import com.keyco.assist.service.transport.BackendResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end behaviour of one session over virtual time: debounce, single flight, staleness,
 * caching, retries and breaker interaction.
 */
class AssistSessionTest {

    private OrchestrationTestFixture f;
    private AssistSession session;

    @BeforeEach
    void setUp() {
        f = new OrchestrationTestFixture();
        session = f.session(Mode.COMPOSE);
    }

    @Test
    void shouldSendOneRequestForBurstOfEdits() {
        // Arrange: an edit every 50ms for one second
        for (int i = 1; i <= 20; i++) {
            session.textChanged("draft " + i);
            f.scheduler.advanceMillis(50);
        }

        // Act
        f.quiet();

        // Assert
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.transport.lastCall().request().text()).isEqualTo("draft 20");
        assertThat(f.transport.lastCall().request().contextLength()).isEqualTo("draft 20".length());
    }

    @Test
    void shouldPublishResultForLatestCandidate() {
        session.textChanged("hello");
        f.quiet();

        f.transport.completeLast("Hello there.");

        AssistResult result = f.sink.lastResult();
        assertThat(f.sink.outcomes()).hasSize(1);
        assertThat(result.text()).isEqualTo("Hello there.");
        assertThat(result.sequence()).isEqualTo(session.latestSequence());
        assertThat(result.fromCache()).isFalse();
        assertThat(result.sessionId()).isEqualTo("session-1");
    }

    @Test
    void shouldCancelInFlightCallWhenNewerInputArrives() {
        session.textChanged("first");
        f.quiet();
        var first = f.transport.lastCall();

        session.textChanged("second");

        assertThat(first.future().isCancelled()).isTrue();
        assertThat(f.transport.outstanding()).isZero();
    }

    @Test
    void shouldNeverPublishSupersededResponse() {
        session.textChanged("first");
        f.quiet();
        var first = f.transport.lastCall();
        session.textChanged("second");
        f.quiet();
        var second = f.transport.lastCall();

        // Late answer for the superseded call
        first.future().complete(new BackendResponse("stale", null));
        second.future().complete(new BackendResponse("fresh", null));

        assertThat(f.sink.results()).extracting(AssistResult::text).containsExactly("fresh");
        assertThat(f.sink.failures()).isEmpty();
    }

    @Test
    void shouldNotCountCancellationAsBreakerFailure() {
        for (int i = 0; i < 10; i++) {
            session.textChanged("edit " + i);
            f.quiet();
        }

        assertThat(f.transport.callCount()).isEqualTo(10);
        assertThat(f.breaker(Mode.COMPOSE).snapshot().consecutiveFailures()).isZero();
        assertThat(f.breaker(Mode.COMPOSE).state()).isEqualTo(CircuitState.CLOSED);
        assertThat(f.sink.failures()).isEmpty();
    }

    @Test
    void shouldServeRepeatedInputFromCacheWithoutNetwork() {
        session.textChanged("hello");
        f.quiet();
        f.transport.completeLast("Hi!");
        session.textChanged("something else");
        f.quiet();
        f.transport.completeLast("Else.");

        session.textChanged("  hello ");
        f.quiet();

        assertThat(f.transport.callCount()).isEqualTo(2);
        AssistResult cached = f.sink.lastResult();
        assertThat(cached.text()).isEqualTo("Hi!");
        assertThat(cached.fromCache()).isTrue();
    }

    @Test
    void shouldSwitchModeImmediatelyAndDropPendingEdit() {
        session.textChanged("hello");

        session.modeChanged(Mode.SEARCH_QUERY);

        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.transport.lastCall().request().mode()).isEqualTo(Mode.SEARCH_QUERY);
        f.quiet();
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(session.mode()).isEqualTo(Mode.SEARCH_QUERY);
    }

    @Test
    void shouldIgnoreSwitchToCurrentMode() {
        session.textChanged("hello");
        f.quiet();

        session.modeChanged(Mode.COMPOSE);

        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.transport.outstanding()).isEqualTo(1);
    }

    @Test
    void shouldResendImmediatelyWhenOptionsChange() {
        session.textChanged("hello");
        f.quiet();
        f.transport.completeLast("Hello.");

        session.optionsChanged(new RewriteOptions(0.9, 0.5, "friendly", null));

        assertThat(f.transport.callCount()).isEqualTo(2);
        assertThat(f.transport.lastCall().request().options().preset()).isEqualTo("friendly");
    }

    @Test
    void shouldSupersedeWithoutSendingWhenTextCleared() {
        session.textChanged("hello");
        f.quiet();
        var inFlight = f.transport.lastCall();

        session.textChanged("   ");
        f.quiet();

        assertThat(inFlight.future().isCancelled()).isTrue();
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.sink.outcomes()).isEmpty();
    }

    @Test
    void shouldRetryAfterBackoffAndPublishSuccess() {
        session.textChanged("hello");
        f.quiet();

        f.transport.failLast(FailureKind.SERVER_ERROR);
        f.scheduler.advanceMillis(999);
        assertThat(f.transport.callCount()).isEqualTo(1);
        f.scheduler.advanceMillis(1);
        assertThat(f.transport.callCount()).isEqualTo(2);
        f.transport.completeLast("Recovered.");

        assertThat(f.sink.results()).extracting(AssistResult::text).containsExactly("Recovered.");
        assertThat(f.sink.failures()).isEmpty();
        assertThat(f.breaker(Mode.COMPOSE).snapshot().consecutiveFailures()).isZero();
    }

    @Test
    void shouldReportRetriesInFailureMessageWhenAttemptsExhausted() {
        session.textChanged("hello");
        f.quiet();

        f.transport.failLast(FailureKind.TIMEOUT);
        f.scheduler.advanceMillis(1000);
        f.transport.failLast(FailureKind.TIMEOUT);
        f.scheduler.advanceMillis(2000);
        f.transport.failLast(FailureKind.TIMEOUT);

        AssistFailure failure = f.sink.lastFailure();
        assertThat(f.transport.callCount()).isEqualTo(3);
        assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.userMessage()).endsWith("Retried 2 times without success.");
        // One logical failure, not three
        assertThat(f.breaker(Mode.COMPOSE).snapshot().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void shouldFailImmediatelyOnClientError() {
        session.textChanged("hello");
        f.quiet();

        f.transport.failLast(FailureKind.CLIENT_ERROR);

        AssistFailure failure = f.sink.lastFailure();
        assertThat(failure.kind()).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(failure.attempts()).isEqualTo(1);
        assertThat(failure.userMessage()).isEqualTo(FailureKind.CLIENT_ERROR.userMessage());
        assertThat(f.scheduler.pendingCount()).isZero();
        assertThat(f.breaker(Mode.COMPOSE).snapshot().consecutiveFailures()).isZero();
    }

    @Test
    void shouldKeepRateLimitOutOfBreakerAndOtherModesAvailable() {
        session.textChanged("hello");
        f.quiet();
        Duration hint = Duration.ofSeconds(2);

        f.transport.failLastRateLimited(hint);
        f.scheduler.advance(hint);
        f.transport.failLastRateLimited(hint);
        f.scheduler.advance(hint);
        f.transport.failLastRateLimited(hint);

        AssistFailure failure = f.sink.lastFailure();
        assertThat(failure.kind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(failure.retryAfter()).isEqualTo(hint);
        assertThat(f.breaker(Mode.COMPOSE).state()).isEqualTo(CircuitState.CLOSED);
        assertThat(f.breaker(Mode.COMPOSE).snapshot().consecutiveFailures()).isZero();

        session.modeChanged(Mode.CONVERSATIONAL);
        assertThat(f.transport.lastCall().request().mode()).isEqualTo(Mode.CONVERSATIONAL);
    }

    @Test
    void shouldFailFastWhileCircuitOpen() {
        f.tripBreaker(Mode.COMPOSE);

        session.textChanged("hello");
        f.quiet();

        AssistFailure failure = f.sink.lastFailure();
        assertThat(f.transport.callCount()).isZero();
        assertThat(failure.kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
        assertThat(failure.attempts()).isZero();
    }

    @Test
    void shouldStillAnswerOtherModesWhileOneCircuitOpen() {
        f.tripBreaker(Mode.COMPOSE);

        session.modeChanged(Mode.SEARCH_QUERY);
        session.textChanged("pizza");
        f.quiet();

        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.transport.lastCall().request().mode()).isEqualTo(Mode.SEARCH_QUERY);
    }

    @Test
    void shouldAbandonRetriesWhenCircuitOpensDuringBackoff() {
        session.textChanged("hello");
        f.quiet();
        f.transport.failLast(FailureKind.NETWORK);

        f.tripBreaker(Mode.COMPOSE);
        f.scheduler.advanceMillis(1000);

        AssistFailure failure = f.sink.lastFailure();
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(failure.kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
        assertThat(failure.detail()).isEqualTo("Circuit opened during retries");
        assertThat(failure.attempts()).isEqualTo(1);
    }

    @Test
    void shouldKeepSlowProbeOwningHalfOpenSlotUntilItsRetriesFail() {
        AssistSession other = new AssistSession("session-2", Mode.COMPOSE, f.deps());
        f.tripBreaker(Mode.COMPOSE);
        f.scheduler.advance(Duration.ofSeconds(31));
        session.textChanged("hello");
        f.quiet();

        f.scheduler.advance(Duration.ofSeconds(6));
        other.textChanged("world");
        f.quiet();

        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.transport.outstanding()).isEqualTo(1);
        assertThat(f.sink.lastFailure().sessionId()).isEqualTo("session-2");
        assertThat(f.sink.lastFailure().kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);

        // Probe times out on every attempt
        f.transport.failLast(FailureKind.TIMEOUT);
        f.scheduler.advance(Duration.ofSeconds(2));
        f.transport.failLast(FailureKind.TIMEOUT);
        f.scheduler.advance(Duration.ofSeconds(3));
        f.transport.failLast(FailureKind.TIMEOUT);

        AssistFailure failure = f.sink.lastFailure();
        assertThat(f.transport.callCount()).isEqualTo(3);
        assertThat(failure.sessionId()).isEqualTo("session-1");
        assertThat(failure.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(f.breaker(Mode.COMPOSE).snapshot().state()).isEqualTo(CircuitState.OPEN);
        assertThat(f.breaker(Mode.COMPOSE).snapshot().trips()).isEqualTo(2);
        assertThat(f.breaker(Mode.COMPOSE).snapshot().probeInFlight()).isFalse();
    }

    @Test
    void shouldRejectOutOfRangeOptionsWithoutSending() {
        session.textChanged("hello");
        f.quiet();
        f.transport.completeLast("Hello.");

        session.optionsChanged(new RewriteOptions(1.5, 0.5, null, null));

        AssistFailure failure = f.sink.lastFailure();
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(failure.kind()).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(failure.attempts()).isZero();
    }

    @Test
    void shouldRejectOverlongTextWithoutSending() {
        f.requestProperties.setMaxTextLength(10);
        AssistSession strict = f.session(Mode.CONVERSATIONAL);

        strict.textChanged("this is far too long");
        f.quiet();

        assertThat(f.transport.callCount()).isZero();
        assertThat(f.sink.lastFailure().kind()).isEqualTo(FailureKind.CLIENT_ERROR);
    }

    @Test
    void shouldBypassCacheOnRefresh() {
        session.textChanged("hello");
        f.quiet();
        f.transport.completeLast("Hello.");

        session.refresh();

        assertThat(f.transport.callCount()).isEqualTo(2);
        f.transport.completeLast("Hi, hello.");
        assertThat(f.sink.lastResult().text()).isEqualTo("Hi, hello.");
        assertThat(f.sink.lastResult().fromCache()).isFalse();
    }

    @Test
    void shouldCancelEverythingOnClose() {
        session.textChanged("hello");
        f.quiet();
        var inFlight = f.transport.lastCall();

        session.close();
        session.textChanged("after close");
        f.quiet();

        assertThat(session.isClosed()).isTrue();
        assertThat(inFlight.future().isCancelled()).isTrue();
        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.sink.outcomes()).isEmpty();
    }

    @Test
    void shouldCancelPendingRetryOnClose() {
        session.textChanged("hello");
        f.quiet();
        f.transport.failLast(FailureKind.SERVER_ERROR);

        session.close();
        f.scheduler.advance(Duration.ofSeconds(10));

        assertThat(f.transport.callCount()).isEqualTo(1);
        assertThat(f.sink.outcomes()).isEmpty();
        assertThat(f.scheduler.pendingCount()).isZero();
    }

    @Test
    void shouldCancelPendingDebounceOnClose() {
        session.textChanged("hello");

        session.close();
        f.quiet();

        assertThat(f.transport.callCount()).isZero();
    }
}
