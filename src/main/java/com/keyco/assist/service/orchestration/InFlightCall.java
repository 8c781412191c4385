package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.RequestCandidate;
import com.keyco.assist.service.debounce.ScheduledTask;
import com.keyco.assist.service.resilience.CallPermit;
import com.keyco.assist.service.resilience.CircuitBreaker;
import com.keyco.assist.service.transport.BackendRequest;
import com.keyco.assist.service.transport.BackendResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One candidate's resolution: every transport attempt and backoff wait made on its behalf.
 *
 * <p>{@link #resolve()} succeeds exactly once, whichever of success, terminal failure or
 * cancellation gets there first. Only the winner reports to the circuit breaker, which is what
 * makes breaker reporting exactly-once.
 */
final class InFlightCall {

    private final RequestCandidate candidate;
    private final BackendRequest request;
    private final CircuitBreaker breaker;
    private final CallPermit permit;
    private final Instant startedAt;
    private final long startedNanos;

    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicBoolean resolved = new AtomicBoolean();
    private volatile CompletableFuture<BackendResponse> current;
    private volatile ScheduledTask retryTimer;

    InFlightCall(RequestCandidate candidate,
                 BackendRequest request,
                 CircuitBreaker breaker,
                 CallPermit permit,
                 Instant startedAt,
                 long startedNanos) {
        this.candidate = candidate;
        this.request = request;
        this.breaker = breaker;
        this.permit = permit;
        this.startedAt = startedAt;
        this.startedNanos = startedNanos;
    }

    RequestCandidate candidate() {
        return candidate;
    }

    BackendRequest request() {
        return request;
    }

    CircuitBreaker breaker() {
        return breaker;
    }

    CallPermit permit() {
        return permit;
    }

    Instant startedAt() {
        return startedAt;
    }

    long startedNanos() {
        return startedNanos;
    }

    int nextAttempt() {
        return attempts.incrementAndGet();
    }

    int attempts() {
        return attempts.get();
    }

    /**
     * @return {@code true} for the single caller that gets to decide this call's outcome
     */
    boolean resolve() {
        return resolved.compareAndSet(false, true);
    }

    boolean isResolved() {
        return resolved.get();
    }

    void attach(CompletableFuture<BackendResponse> future) {
        current = future;
        if (isResolved()) {
            future.cancel(true);
        }
    }

    void attach(ScheduledTask timer) {
        retryTimer = timer;
        if (isResolved()) {
            timer.cancel();
        }
    }

    /** Best-effort abort of whatever is outstanding. Late completions are ignored by the caller. */
    void abort() {
        ScheduledTask timer = retryTimer;
        if (timer != null) {
            timer.cancel();
        }
        CompletableFuture<BackendResponse> future = current;
        if (future != null) {
            future.cancel(true);
        }
    }
}
