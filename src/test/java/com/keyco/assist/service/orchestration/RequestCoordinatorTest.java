package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RequestCandidate;
import com.keyco.assist.service.resilience.CircuitState;
import com.keyco.assist.service.sequence.CandidateSequencer;
import com.keyco.assist.service.sequence.FingerprintCalculator;
import com.keyco.assist.service.sink.ResultSink;
import com.keyco.assist.service.transport.BackendResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCoordinatorTest {

    private OrchestrationTestFixture f;
    private CandidateSequencer sequencer;
    private RequestCoordinator coordinator;

    @BeforeEach
    void setUp() {
        f = new OrchestrationTestFixture();
        sequencer = new CandidateSequencer(new FingerprintCalculator(), f.clock);
        coordinator = new RequestCoordinator("s-1", Mode.CONVERSATIONAL, f.deps());
    }

    private RequestCandidate issue(String text) {
        RequestCandidate c = sequencer.stamp(Mode.CONVERSATIONAL, text, null, false);
        coordinator.candidateIssued(c);
        return c;
    }

    @Test
    void shouldDropCandidateThatIsNoLongerLatest() {
        RequestCandidate old = issue("old");
        issue("new");

        coordinator.handle(old);

        assertThat(f.transport.callCount()).isZero();
        assertThat(f.sink.outcomes()).isEmpty();
    }

    @Test
    void shouldIgnoreOutOfOrderIssue() {
        RequestCandidate older = sequencer.stamp(Mode.CONVERSATIONAL, "older", null, false);
        RequestCandidate newer = issue("newer");

        coordinator.candidateIssued(older);

        assertThat(coordinator.latestIssued()).isEqualTo(newer.sequence());
    }

    @Test
    void shouldKeepAtMostOneCallInFlight() {
        RequestCandidate first = issue("first");
        coordinator.handle(first);
        assertThat(coordinator.inFlightSequence()).isEqualTo(first.sequence());

        RequestCandidate second = issue("second");
        coordinator.handle(second);

        assertThat(f.transport.outstanding()).isEqualTo(1);
        assertThat(coordinator.inFlightSequence()).isEqualTo(second.sequence());
    }

    @Test
    void shouldPublishAtMostOncePerSequence() {
        RequestCandidate c = issue("hello");
        coordinator.handle(c);
        f.transport.completeLast("Hi.");

        // A duplicate fire would be a cache hit; it must not publish twice
        coordinator.handle(c);

        assertThat(f.sink.results()).hasSize(1);
        assertThat(f.transport.callCount()).isEqualTo(1);
    }

    @Test
    void shouldClearInFlightAfterResolution() {
        coordinator.handle(issue("hello"));

        f.transport.completeLast("Hi.");

        assertThat(coordinator.inFlightSequence()).isZero();
    }

    @Test
    void shouldTreatUnclassifiedTransportErrorAsNetworkFailure() {
        coordinator.handle(issue("hello"));

        f.transport.failLast(new IOException("connection reset"));
        f.scheduler.advance(Duration.ofSeconds(1));

        assertThat(f.transport.callCount()).isEqualTo(2);
    }

    @Test
    void shouldGiveUpOnAbsurdRetryAfterWithoutCountingBreakerFailure() {
        coordinator.handle(issue("hello"));

        f.transport.failLastRateLimited(Duration.ofSeconds(Long.MAX_VALUE));

        AssistFailure failure = f.sink.lastFailure();
        assertThat(failure.kind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(failure.attempts()).isEqualTo(1);
        assertThat(coordinator.inFlightSequence()).isZero();
        assertThat(f.scheduler.pendingCount()).isZero();
        assertThat(f.breaker(Mode.CONVERSATIONAL).snapshot().consecutiveFailures()).isZero();
    }

    @Test
    void shouldCloseBreakerWhenProbeSucceeds() {
        f.tripBreaker(Mode.CONVERSATIONAL);
        f.clock.advance(Duration.ofSeconds(30));

        coordinator.handle(issue("hello"));
        f.transport.completeLast("Back.");

        assertThat(f.breaker(Mode.CONVERSATIONAL).state()).isEqualTo(CircuitState.CLOSED);
        assertThat(f.sink.lastResult()).extracting(AssistResult::text).isEqualTo("Back.");
    }

    @Test
    void shouldReleaseProbeSlotWhenProbeIsSuperseded() {
        f.tripBreaker(Mode.CONVERSATIONAL);
        f.clock.advance(Duration.ofSeconds(30));
        coordinator.handle(issue("hello"));
        assertThat(f.breaker(Mode.CONVERSATIONAL).snapshot().probeInFlight()).isTrue();

        RequestCandidate next = issue("hello again");

        assertThat(f.breaker(Mode.CONVERSATIONAL).snapshot().probeInFlight()).isFalse();
        coordinator.handle(next);
        assertThat(f.transport.callCount()).isEqualTo(2);
    }

    @Test
    void shouldSurviveFailingSink() {
        ResultSink throwing = new ResultSink() {
            @Override
            public void publish(AssistResult result) {
                throw new IllegalStateException("surface gone");
            }

            @Override
            public void publish(AssistFailure failure) {
                throw new IllegalStateException("surface gone");
            }
        };
        SessionDependencies base = f.deps();
        RequestCoordinator withBrokenSink = new RequestCoordinator("s-2", Mode.CONVERSATIONAL,
                new SessionDependencies(base.getTransport(), base.getBreakers(), base.getCache(),
                        base.getRetryScheduler(), base.getDelayScheduler(), throwing, base.getMetrics(),
                        base.getFingerprints(), base.getDebounceProperties(), base.getRequestProperties(),
                        base.getClock()));
        RequestCandidate c = sequencer.stamp(Mode.CONVERSATIONAL, "hello", null, false);
        withBrokenSink.candidateIssued(c);

        withBrokenSink.handle(c);
        f.transport.completeLast("Hi.");

        assertThat(withBrokenSink.inFlightSequence()).isZero();
        assertThat(f.breaker(Mode.CONVERSATIONAL).state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldPublishNothingAfterClose() {
        coordinator.handle(issue("hello"));
        var call = f.transport.lastCall();

        coordinator.close();
        call.future().complete(new BackendResponse("late", null));

        assertThat(coordinator.isClosed()).isTrue();
        assertThat(f.sink.outcomes()).isEmpty();
    }

    @Test
    void shouldComposeUserMessageWithRetryCount() {
        assertThat(RequestCoordinator.userMessage(FailureKind.SERVER_ERROR, 1))
                .isEqualTo(FailureKind.SERVER_ERROR.userMessage());
        assertThat(RequestCoordinator.userMessage(FailureKind.SERVER_ERROR, 2))
                .endsWith("Retried 1 time without success.");
        assertThat(RequestCoordinator.userMessage(FailureKind.CLIENT_ERROR, 3))
                .isEqualTo(FailureKind.CLIENT_ERROR.userMessage());
    }
}
