package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RequestCandidate;
import com.keyco.assist.domain.Usage;
import com.keyco.assist.exception.TransportException;
import com.keyco.assist.service.cache.CacheEntry;
import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.resilience.CallPermit;
import com.keyco.assist.service.resilience.CircuitBreaker;
import com.keyco.assist.service.resilience.CircuitState;
import com.keyco.assist.service.resilience.RetryDecision;
import com.keyco.assist.service.transport.BackendRequest;
import com.keyco.assist.service.transport.BackendResponse;
import com.keyco.assist.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight dispatcher for one session.
 *
 * <p><b>Resolution of a fired candidate:</b>
 * <ol>
 *   <li>Drop it unless it is still the session's latest issued candidate.</li>
 *   <li>Fail fast with a client error if it cannot be sent (options out of range, text too long).</li>
 *   <li>Serve a cache hit without touching the breaker or the network.</li>
 *   <li>Ask the endpoint's breaker for a permit; publish {@code circuitOpen} at once if refused.</li>
 *   <li>Call the transport; on failure ask the retry scheduler for a delay and try again, re-checking
 *       the breaker before each retry; give up with a terminal failure otherwise.</li>
 * </ol>
 *
 * <p><b>Invariants:</b>
 * <ul>
 *   <li>At most one call is in flight per session. Issuing a newer candidate cancels it
 *       synchronously; its late response is discarded and never reported to the breaker.</li>
 *   <li>An outcome is published only if its sequence equals the latest issued sequence at publish
 *       time, and at most once per sequence.</li>
 *   <li>Each call reports to its breaker exactly once: success, failure, or a neutral release for
 *       cancellations, rate limits and client errors.</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> session state is guarded by a {@link ReentrantLock}. Transport
 * completions and retry timers arrive on other threads. The result sink and the breaker are never
 * called while the lock is held.
 */
public final class RequestCoordinator {

    private static final Logger LOG = LogManager.getLogger(RequestCoordinator.class);

    private final String sessionId;
    private final SessionDependencies deps;
    private final Lock lock = new ReentrantLock();
    private final SessionState state;

    public RequestCoordinator(String sessionId, Mode initialMode, SessionDependencies deps) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.deps = Objects.requireNonNull(deps, "deps");
        this.state = new SessionState(Objects.requireNonNull(initialMode, "initialMode"));
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Records a freshly stamped candidate as the session's latest intent and cancels any in-flight
     * call it supersedes. Must be called for every stamped candidate, including blank ones, before
     * the candidate is debounced.
     */
    public void candidateIssued(RequestCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        InFlightCall superseded = null;
        lock.lock();
        try {
            if (state.closed || candidate.sequence() <= state.latestIssued) {
                return;
            }
            state.latestIssued = candidate.sequence();
            state.mode = candidate.mode();
            if (state.inFlight != null) {
                superseded = state.inFlight;
                state.inFlight = null;
            }
        } finally {
            lock.unlock();
        }
        if (superseded != null) {
            cancel(superseded, "superseded by seq=" + candidate.sequence());
        }
    }

    /**
     * Resolves a candidate released by the debounce gate.
     */
    public void handle(RequestCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("sessionId", sessionId)) {
            if (!isCurrent(candidate)) {
                LOG.debug("Dropping stale candidate seq={}", candidate.sequence());
                return;
            }
            if (candidate.isBlank()) {
                return;
            }
            Optional<String> invalid = validate(candidate);
            if (invalid.isPresent()) {
                publishFailure(candidate, FailureKind.CLIENT_ERROR, null, invalid.get(), 0, 0, null);
                return;
            }
            if (serveFromCache(candidate)) {
                return;
            }
            dispatch(candidate);
        }
    }

    /**
     * Cancels timers and in-flight work. Nothing is published after this returns.
     */
    public void close() {
        InFlightCall outstanding;
        lock.lock();
        try {
            if (state.closed) {
                return;
            }
            state.closed = true;
            outstanding = state.inFlight;
            state.inFlight = null;
        } finally {
            lock.unlock();
        }
        if (outstanding != null) {
            cancel(outstanding, "session closed");
        }
    }

    public Mode currentMode() {
        lock.lock();
        try {
            return state.mode;
        } finally {
            lock.unlock();
        }
    }

    public long latestIssued() {
        lock.lock();
        try {
            return state.latestIssued;
        } finally {
            lock.unlock();
        }
    }

    /** Sequence of the candidate currently in flight, or 0. */
    public long inFlightSequence() {
        lock.lock();
        try {
            return state.inFlight == null ? 0 : state.inFlight.candidate().sequence();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return state.closed;
        } finally {
            lock.unlock();
        }
    }

    private Optional<String> validate(RequestCandidate candidate) {
        if (candidate.mode() == Mode.COMPOSE && !candidate.options().isValid()) {
            return Optional.of("Rewrite options out of range: " + candidate.options().canonical());
        }
        int max = deps.getRequestProperties().getMaxTextLength();
        if (candidate.text().length() > max) {
            return Optional.of("Text length " + candidate.text().length() + " exceeds limit " + max);
        }
        return Optional.empty();
    }

    private boolean serveFromCache(RequestCandidate candidate) {
        ResponseCache cache = deps.getCache();
        if (cache == null) {
            return false;
        }
        Optional<CacheEntry> hit = cache.lookup(candidate.fingerprint());
        if (hit.isEmpty()) {
            return false;
        }
        LOG.debug("Cache hit seq={} fp={}", candidate.sequence(), candidate.fingerprint());
        publishResult(candidate, hit.get().text(), hit.get().usage(), true, System.nanoTime());
        return true;
    }

    private void dispatch(RequestCandidate candidate) {
        CircuitBreaker breaker = deps.getBreakers().forEndpoint(deps.getTransport().endpointFor(candidate.mode()));
        Optional<CallPermit> permit = breaker.tryAcquire();
        if (permit.isEmpty()) {
            LOG.debug("Circuit {} rejected seq={}", breaker.endpoint(), candidate.sequence());
            publishFailure(candidate, FailureKind.CIRCUIT_OPEN, null,
                    "Circuit open for endpoint " + breaker.endpoint(), 0, 0, null);
            return;
        }

        BackendRequest request = new BackendRequest(candidate.mode(), candidate.text(),
                candidate.text().length(), candidate.options());
        InFlightCall call = new InFlightCall(candidate, request, breaker, permit.get(),
                deps.getClock().instant(), System.nanoTime());

        InFlightCall superseded = null;
        boolean accepted;
        lock.lock();
        try {
            accepted = state.isCurrent(candidate.sequence());
            if (accepted) {
                superseded = state.inFlight;
                state.inFlight = call;
            }
        } finally {
            lock.unlock();
        }
        if (!accepted) {
            // Superseded between the staleness check and now
            if (call.resolve()) {
                breaker.release(call.permit());
            }
            return;
        }
        if (superseded != null) {
            cancel(superseded, "replaced by seq=" + candidate.sequence());
        }
        attempt(call);
    }

    private void attempt(InFlightCall call) {
        if (call.isResolved()) {
            return;
        }
        int attempt = call.nextAttempt();
        LOG.debug("Attempt {} seq={} endpoint={}", attempt, call.candidate().sequence(), call.breaker().endpoint());
        CompletableFuture<BackendResponse> future;
        try {
            future = deps.getTransport().send(call.request());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        call.attach(future);
        future.whenComplete((response, error) -> onAttemptComplete(call, response, error));
    }

    private void onAttemptComplete(InFlightCall call, BackendResponse response, Throwable error) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("sessionId", sessionId)) {
            if (call.isResolved()) {
                LOG.debug("Discarding late completion for seq={}", call.candidate().sequence());
                return;
            }
            if (error == null) {
                onSuccess(call, response);
            } else {
                onFailure(call, unwrap(error));
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error resolving seq={}", call.candidate().sequence(), e);
            terminate(call, FailureKind.SERVER_ERROR, e.toString(), 0, null);
        }
    }

    private void onSuccess(InFlightCall call, BackendResponse response) {
        if (!call.resolve()) {
            return;
        }
        call.breaker().recordSuccess(call.permit());
        ResponseCache cache = deps.getCache();
        if (cache != null) {
            cache.store(call.candidate().fingerprint(), response.text(), response.usage());
        }
        clearInFlight(call);
        publishResult(call.candidate(), response.text(), response.usage(), false, call.startedNanos());
    }

    private void onFailure(InFlightCall call, Throwable error) {
        if (error instanceof CancellationException) {
            // Only we cancel transport futures, and only after resolving the call
            return;
        }
        TransportException failure = classify(error);
        FailureKind kind = failure.getKind();
        Duration elapsed = Duration.between(call.startedAt(), deps.getClock().instant());
        RetryDecision decision = deps.getRetryScheduler()
                .nextDelay(call.attempts(), kind, failure.getRetryAfter(), elapsed);

        if (!decision.retry()) {
            terminate(call, kind, failure.getMessage(), failure.getStatusCode(), failure.getRetryAfter());
            return;
        }
        LOG.info("Attempt {} seq={} failed ({}); retrying in {}ms",
                call.attempts(), call.candidate().sequence(), kind.tag(), decision.delay().toMillis());
        deps.getMetrics().recordRetry(call.candidate().mode(), kind);
        call.attach(deps.getDelayScheduler().schedule(() -> retry(call), decision.delay()));
    }

    private void retry(InFlightCall call) {
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("sessionId", sessionId)) {
            if (call.isResolved()) {
                return;
            }
            if (!call.breaker().stillPermits(call.permit())) {
                if (call.resolve()) {
                    call.breaker().release(call.permit());
                    clearInFlight(call);
                    CircuitState state = call.breaker().state();
                    String detail = state == CircuitState.HALF_OPEN
                            ? "Circuit probe lease expired during retries"
                            : "Circuit opened during retries";
                    LOG.info("Circuit {} is {} while seq={} was backing off; giving up",
                            call.breaker().endpoint(), state, call.candidate().sequence());
                    publishFailure(call.candidate(), FailureKind.CIRCUIT_OPEN, null,
                            detail, call.attempts(), 0, null);
                }
                return;
            }
            attempt(call);
        }
    }

    private void terminate(InFlightCall call, FailureKind kind, String detail, int status, Duration retryAfter) {
        if (!call.resolve()) {
            return;
        }
        if (kind.countsAsBreakerFailure()) {
            call.breaker().recordFailure(call.permit());
        } else {
            call.breaker().release(call.permit());
        }
        clearInFlight(call);
        LOG.warn("Giving up on seq={} after {} attempt(s): {}", call.candidate().sequence(), call.attempts(), kind.tag());
        publishFailure(call.candidate(), kind, userMessage(kind, call.attempts()), detail,
                call.attempts(), status, retryAfter);
    }

    private void cancel(InFlightCall call, String reason) {
        if (!call.resolve()) {
            return;
        }
        call.abort();
        call.breaker().release(call.permit());
        deps.getMetrics().recordCancelled(call.candidate().mode());
        LOG.debug("Cancelled seq={} ({})", call.candidate().sequence(), reason);
    }

    private void clearInFlight(InFlightCall call) {
        lock.lock();
        try {
            if (state.inFlight == call) {
                state.inFlight = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean isCurrent(RequestCandidate candidate) {
        lock.lock();
        try {
            return state.isCurrent(candidate.sequence());
        } finally {
            lock.unlock();
        }
    }

    /** Claims the right to publish for {@code sequence}; succeeds at most once per sequence. */
    private boolean claimPublish(long sequence) {
        lock.lock();
        try {
            if (!state.isCurrent(sequence) || sequence <= state.lastPublished) {
                return false;
            }
            state.lastPublished = sequence;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void publishResult(RequestCandidate candidate, String text, Usage usage, boolean fromCache, long startedNanos) {
        if (!claimPublish(candidate.sequence())) {
            LOG.debug("Result for seq={} is stale; discarded", candidate.sequence());
            return;
        }
        AssistResult result = new AssistResult(sessionId, candidate.sequence(), candidate.fingerprint(),
                candidate.mode(), text, usage, fromCache, deps.getClock().instant());
        deps.getMetrics().recordSuccess(candidate.mode(), System.nanoTime() - startedNanos, fromCache);
        if (!fromCache) {
            LOG.info("Published result seq={} mode={} in {}ms", candidate.sequence(), candidate.mode().wireName(),
                    TimeUtils.nanosToMillis(System.nanoTime() - startedNanos));
        }
        try {
            deps.getSink().publish(result);
        } catch (RuntimeException e) {
            LOG.error("Result sink failed for seq={}", candidate.sequence(), e);
        }
    }

    private void publishFailure(RequestCandidate candidate, FailureKind kind, String userMessage, String detail,
                                int attempts, int status, Duration retryAfter) {
        if (!claimPublish(candidate.sequence())) {
            LOG.debug("Failure for seq={} is stale; discarded", candidate.sequence());
            return;
        }
        AssistFailure failure = new AssistFailure(sessionId, candidate.sequence(), candidate.mode(), kind,
                userMessage, detail, attempts, status, retryAfter, deps.getClock().instant());
        deps.getMetrics().recordFailure(candidate.mode(), kind);
        try {
            deps.getSink().publish(failure);
        } catch (RuntimeException e) {
            LOG.error("Result sink failed for seq={}", candidate.sequence(), e);
        }
    }

    static String userMessage(FailureKind kind, int attempts) {
        int retries = attempts - 1;
        if (retries <= 0 || !kind.isRetryable()) {
            return kind.userMessage();
        }
        return kind.userMessage() + " Retried " + retries + (retries == 1 ? " time" : " times") + " without success.";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static TransportException classify(Throwable error) {
        if (error instanceof TransportException te) {
            return te;
        }
        return new TransportException(FailureKind.NETWORK, "Transport failed: " + error, error);
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "RequestCoordinator{session=" + sessionId + ", mode=" + state.mode.wireName()
                    + ", latestIssued=" + state.latestIssued + ", inFlight="
                    + (state.inFlight == null ? "none" : state.inFlight.candidate().sequence())
                    + ", closed=" + state.closed + '}';
        } finally {
            lock.unlock();
        }
    }
}
