package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.Mode;

/**
 * Mutable per-session bookkeeping owned by one {@link RequestCoordinator}.
 *
 * <p>Not thread-safe on its own: every read and write happens under the coordinator's lock.
 */
final class SessionState {

    Mode mode;
    long latestIssued;
    long lastPublished;
    InFlightCall inFlight;
    boolean closed;

    SessionState(Mode initialMode) {
        this.mode = initialMode;
    }

    boolean isCurrent(long sequence) {
        return !closed && sequence == latestIssued;
    }
}
