package com.keyco.assist.service.debounce;

import com.keyco.assist.domain.RequestCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Coalesces bursts of candidates into one fire per quiet period.
 *
 * <p>Holds at most one pending candidate. Each {@link #schedule} replaces the pending candidate
 * and restarts the quiet interval; a replaced candidate never fires. {@link #fireNow} bypasses the
 * delay for explicit user intent (mode switch, option change, refresh) and also discards anything
 * pending.
 *
 * <p>The gate is sequence-aware: a candidate older than the newest one it has seen is ignored, so
 * callers racing on different threads cannot let an older candidate displace a newer one.
 *
 * <p><b>Thread Safety:</b> state is guarded by a {@link ReentrantLock}. The fire callback is
 * always invoked outside the lock.
 */
public final class DebounceGate {

    private static final Logger LOG = LogManager.getLogger(DebounceGate.class);

    private final DelayScheduler scheduler;
    private final Duration quietInterval;
    private final Consumer<RequestCandidate> onFire;

    private final Lock lock = new ReentrantLock();
    private RequestCandidate pending;
    private ScheduledTask timer;
    private long generation;
    private long newestSequence;

    public DebounceGate(DelayScheduler scheduler, Duration quietInterval, Consumer<RequestCandidate> onFire) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.quietInterval = Objects.requireNonNull(quietInterval, "quietInterval");
        this.onFire = Objects.requireNonNull(onFire, "onFire");
        if (quietInterval.isNegative() || quietInterval.isZero()) {
            throw new IllegalArgumentException("quietInterval must be positive");
        }
    }

    /**
     * Replaces any pending candidate and restarts the quiet interval.
     *
     * @param candidate candidate to fire once input pauses
     * @return {@code false} if the candidate was older than one already seen and was ignored
     */
    public boolean schedule(RequestCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        lock.lock();
        try {
            if (!acceptLocked(candidate)) {
                return false;
            }
            cancelTimerLocked();
            pending = candidate;
            long token = ++generation;
            timer = scheduler.schedule(() -> expire(token), quietInterval);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards anything pending and fires {@code candidate} on the calling thread.
     *
     * @return {@code false} if the candidate was older than one already seen and was ignored
     */
    public boolean fireNow(RequestCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        lock.lock();
        try {
            if (!acceptLocked(candidate)) {
                return false;
            }
            cancelTimerLocked();
            generation++;
        } finally {
            lock.unlock();
        }
        onFire.accept(candidate);
        return true;
    }

    /**
     * Records {@code candidate} as the newest input without ever firing it, dropping whatever is
     * pending. Used for input that must supersede earlier edits but has nothing to send.
     *
     * @return {@code false} if the candidate was older than one already seen and was ignored
     */
    public boolean supersede(RequestCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        lock.lock();
        try {
            if (!acceptLocked(candidate)) {
                return false;
            }
            cancelTimerLocked();
            generation++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the pending candidate, if any, without firing it.
     *
     * @return {@code true} if something was pending
     */
    public boolean cancel() {
        lock.lock();
        try {
            boolean hadPending = pending != null;
            cancelTimerLocked();
            generation++;
            return hadPending;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }

    private void expire(long token) {
        RequestCandidate toFire;
        lock.lock();
        try {
            // A timer that lost a cancel race must not fire a superseded candidate
            if (token != generation || pending == null) {
                return;
            }
            toFire = pending;
            pending = null;
            timer = null;
        } finally {
            lock.unlock();
        }
        LOG.debug("Debounce expired: seq={}, fp={}", toFire.sequence(), toFire.fingerprint());
        onFire.accept(toFire);
    }

    private boolean acceptLocked(RequestCandidate candidate) {
        if (candidate.sequence() < newestSequence) {
            LOG.debug("Ignoring out-of-order candidate seq={} (newest {})", candidate.sequence(), newestSequence);
            return false;
        }
        newestSequence = candidate.sequence();
        return true;
    }

    private void cancelTimerLocked() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        pending = null;
    }
}
