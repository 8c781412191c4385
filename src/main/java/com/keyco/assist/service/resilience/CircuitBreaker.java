package com.keyco.assist.service.resilience;

import com.keyco.assist.config.properties.CircuitBreakerProperties;
import com.keyco.assist.service.resilience.event.CircuitStateChangedEvent;
import com.keyco.assist.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Failure-tracking gate for one backend endpoint.
 *
 * <p>Failures are tracked in a sliding time window; reaching the threshold opens the breaker.
 * While open every call is rejected without touching the network. Once the cooldown has elapsed
 * (checked lazily on the next call, no timer involved) exactly one probe is let through. The
 * cooldown grows by {@code cooldown-multiplier} for every trip that is not followed by a recovery.
 *
 * <p>A probe holds its slot for a lease: the larger of {@code probe-timeout} and the minimum lease
 * given at construction, which callers size to cover a probe's full retry budget. A probe that
 * never reports (host suspended mid-request) frees its slot once the lease runs out; its late
 * report is then ignored.
 *
 * <p><b>Thread Safety:</b> all transitions happen under a per-breaker {@link ReentrantLock}.
 * State-change events are published after the lock is released.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String endpoint;
    private final CircuitBreakerProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final Duration probeLease;

    private final Lock lock = new ReentrantLock();
    private final AtomicLong tokens = new AtomicLong();

    private CircuitState state = CircuitState.CLOSED;
    private final Deque<Instant> failures = new ArrayDeque<>();
    private Instant openedAt;
    private Duration currentCooldown = Duration.ZERO;
    private int trips;
    private long activeProbeToken = -1;
    private Instant probeStartedAt;
    private long epoch;

    /**
     * @param endpoint breaker endpoint name
     * @param props thresholds and cooldowns
     * @param clock time source
     * @param publisher event publisher, may be {@code null}
     */
    public CircuitBreaker(String endpoint,
                          CircuitBreakerProperties props,
                          Clock clock,
                          ApplicationEventPublisher publisher) {
        this(endpoint, props, Duration.ZERO, clock, publisher);
    }

    /**
     * @param minProbeLease lower bound for how long a probe owns the half-open slot
     */
    public CircuitBreaker(String endpoint,
                          CircuitBreakerProperties props,
                          Duration minProbeLease,
                          Clock clock,
                          ApplicationEventPublisher publisher) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
        this.probeLease = minProbeLease == null
                ? props.probeTimeout()
                : TimeUtils.max(minProbeLease, props.probeTimeout());
    }

    public String endpoint() {
        return endpoint;
    }

    public Duration probeLease() {
        return probeLease;
    }

    /**
     * Asks for permission to make a call.
     *
     * @return a permit, or empty when the breaker is open or the probe slot is taken
     */
    public Optional<CallPermit> tryAcquire() {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        Optional<CallPermit> permit;
        lock.lock();
        try {
            Instant now = clock.instant();
            refreshLocked(now, transitions);
            permit = switch (state) {
                case CLOSED -> Optional.of(new CallPermit(endpoint, false, tokens.incrementAndGet(), epoch, now));
                case OPEN -> Optional.empty();
                case HALF_OPEN -> {
                    if (activeProbeToken >= 0) {
                        yield Optional.empty();
                    }
                    long token = tokens.incrementAndGet();
                    activeProbeToken = token;
                    probeStartedAt = now;
                    LOG.info("Circuit {} half-open: probe {} permitted", endpoint, token);
                    yield Optional.of(new CallPermit(endpoint, true, token, epoch, now));
                }
            };
        } finally {
            lock.unlock();
        }
        publish(transitions);
        return permit;
    }

    /**
     * Whether a permit issued earlier may still be used for a retry. A regular permit loses its
     * validity once the breaker has opened; a probe keeps it while it owns the probe slot.
     */
    public boolean stillPermits(CallPermit permit) {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        boolean permitted;
        lock.lock();
        try {
            refreshLocked(clock.instant(), transitions);
            if (permit.epoch() != epoch) {
                permitted = state == CircuitState.CLOSED;
            } else if (permit.probe()) {
                permitted = state == CircuitState.HALF_OPEN && activeProbeToken == permit.token();
            } else {
                permitted = state == CircuitState.CLOSED;
            }
        } finally {
            lock.unlock();
        }
        publish(transitions);
        return permitted;
    }

    public void recordSuccess(CallPermit permit) {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        lock.lock();
        try {
            if (isStaleLocked(permit)) {
                return;
            }
            Instant now = clock.instant();
            if (permit.probe()) {
                if (state == CircuitState.HALF_OPEN && activeProbeToken == permit.token()) {
                    closeLocked(now, transitions);
                    LOG.info("Circuit {} closed: probe succeeded", endpoint);
                }
            } else if (state == CircuitState.CLOSED) {
                failures.clear();
            }
        } finally {
            lock.unlock();
        }
        publish(transitions);
    }

    public void recordFailure(CallPermit permit) {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        lock.lock();
        try {
            if (isStaleLocked(permit)) {
                return;
            }
            Instant now = clock.instant();
            if (permit.probe()) {
                if (state == CircuitState.HALF_OPEN && activeProbeToken == permit.token()) {
                    failures.addLast(now);
                    tripLocked(now, transitions);
                }
            } else if (state == CircuitState.CLOSED) {
                failures.addLast(now);
                pruneOld(now);
                if (failures.size() >= props.getFailureThreshold()) {
                    tripLocked(now, transitions);
                }
            }
            // Failures of calls admitted before an earlier trip change nothing
        } finally {
            lock.unlock();
        }
        publish(transitions);
    }

    /**
     * Reports a resolution that says nothing about backend health (cancelled, rate limited,
     * client error). Frees the probe slot if this permit held it.
     */
    public void release(CallPermit permit) {
        lock.lock();
        try {
            if (isStaleLocked(permit)) {
                return;
            }
            if (permit.probe() && activeProbeToken == permit.token()) {
                activeProbeToken = -1;
                probeStartedAt = null;
                LOG.debug("Circuit {} probe {} released without verdict", endpoint, permit.token());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the breaker back to CLOSED and invalidates every outstanding permit.
     */
    public void reset() {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        lock.lock();
        try {
            epoch++;
            closeLocked(clock.instant(), transitions);
        } finally {
            lock.unlock();
        }
        publish(transitions);
    }

    public CircuitSnapshot snapshot() {
        List<CircuitStateChangedEvent> transitions = new ArrayList<>(1);
        CircuitSnapshot snapshot;
        lock.lock();
        try {
            Instant now = clock.instant();
            refreshLocked(now, transitions);
            if (state == CircuitState.CLOSED) {
                pruneOld(now);
            }
            snapshot = new CircuitSnapshot(endpoint, state, failures.size(), openedAt, currentCooldown,
                    activeProbeToken >= 0, trips);
        } finally {
            lock.unlock();
        }
        publish(transitions);
        return snapshot;
    }

    public CircuitState state() {
        return snapshot().state();
    }

    private void refreshLocked(Instant now, List<CircuitStateChangedEvent> transitions) {
        if (state == CircuitState.OPEN && !now.isBefore(openedAt.plus(currentCooldown))) {
            transitionLocked(CircuitState.HALF_OPEN, now, transitions);
            activeProbeToken = -1;
            probeStartedAt = null;
        }
        if (state == CircuitState.HALF_OPEN && activeProbeToken >= 0
                && !now.isBefore(probeStartedAt.plus(probeLease))) {
            LOG.warn("Circuit {} probe {} did not report within {}; reclaiming slot",
                    endpoint, activeProbeToken, probeLease);
            activeProbeToken = -1;
            probeStartedAt = null;
        }
    }

    private void tripLocked(Instant now, List<CircuitStateChangedEvent> transitions) {
        trips++;
        currentCooldown = cooldownForTrip(trips);
        openedAt = now;
        activeProbeToken = -1;
        probeStartedAt = null;
        transitionLocked(CircuitState.OPEN, now, transitions);
        LOG.warn("Circuit {} opened after {} failures (trip {}); cooldown {}",
                endpoint, failures.size(), trips, currentCooldown);
    }

    private void closeLocked(Instant now, List<CircuitStateChangedEvent> transitions) {
        failures.clear();
        trips = 0;
        openedAt = null;
        currentCooldown = Duration.ZERO;
        activeProbeToken = -1;
        probeStartedAt = null;
        transitionLocked(CircuitState.CLOSED, now, transitions);
    }

    private void transitionLocked(CircuitState to, Instant now, List<CircuitStateChangedEvent> transitions) {
        CircuitState from = state;
        if (from == to) {
            return;
        }
        state = to;
        Duration cooldown = to == CircuitState.OPEN ? currentCooldown : Duration.ZERO;
        transitions.add(new CircuitStateChangedEvent(endpoint, from, to, now, failures.size(), cooldown));
    }

    private Duration cooldownForTrip(int trip) {
        double factor = Math.pow(props.getCooldownMultiplier(), Math.max(0, trip - 1));
        double millis = props.cooldown().toMillis() * factor;
        long capped = (long) Math.min(millis, (double) props.maxCooldown().toMillis());
        return Duration.ofMillis(capped);
    }

    private boolean isStaleLocked(CallPermit permit) {
        Objects.requireNonNull(permit, "permit");
        if (permit.epoch() != epoch) {
            LOG.debug("Ignoring report for circuit {} from epoch {} (current {})", endpoint, permit.epoch(), epoch);
            return true;
        }
        return false;
    }

    private void pruneOld(Instant now) {
        Instant cutoff = now.minus(props.window());
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
            failures.removeFirst();
        }
    }

    private void publish(List<CircuitStateChangedEvent> transitions) {
        if (publisher == null) {
            return;
        }
        for (CircuitStateChangedEvent event : transitions) {
            try {
                publisher.publishEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Failed to publish circuit event for {}: {}", endpoint, e.toString());
            }
        }
    }
}
