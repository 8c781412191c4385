package com.keyco.assist.service.orchestration;

import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RequestCandidate;
import com.keyco.assist.domain.RewriteOptions;
import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.debounce.DebounceGate;
import com.keyco.assist.service.sequence.CandidateSequencer;
import com.keyco.assist.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One input surface instance: the entry point for edits, mode switches and option changes.
 *
 * <p>Wires the per-session pipeline: {@link CandidateSequencer} → {@link RequestCoordinator}
 * (supersede) → {@link DebounceGate} → {@link RequestCoordinator#handle}. Text edits are
 * debounced; mode switches, option changes and refresh are explicit intent and fire immediately.
 * Blank input supersedes earlier work but never fires.
 *
 * <p>{@link #close()} is the single teardown call: it cancels the debounce timer, any retry timer
 * and the in-flight call.
 */
public final class AssistSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(AssistSession.class);

    private final String id;
    private final CandidateSequencer sequencer;
    private final RequestCoordinator coordinator;
    private final DebounceGate gate;
    private final ResponseCache cache;

    private final Lock inputLock = new ReentrantLock();
    private Mode mode;
    private String text = "";
    private RewriteOptions options = RewriteOptions.DEFAULTS;

    public AssistSession(String id, Mode initialMode, SessionDependencies deps) {
        this.id = Objects.requireNonNull(id, "id");
        this.mode = Objects.requireNonNull(initialMode, "initialMode");
        this.sequencer = new CandidateSequencer(deps.getFingerprints(), deps.getClock());
        this.coordinator = new RequestCoordinator(id, initialMode, deps);
        this.gate = new DebounceGate(deps.getDelayScheduler(),
                deps.getDebounceProperties().quietInterval(), coordinator::handle);
        this.cache = deps.getCache();
    }

    public String id() {
        return id;
    }

    /** Debounced: fires once the user pauses typing. */
    public void textChanged(String newText) {
        RequestCandidate candidate;
        inputLock.lock();
        try {
            text = newText == null ? "" : newText;
            candidate = sequencer.stamp(mode, text, options, false);
        } finally {
            inputLock.unlock();
        }
        LOG.debug("Session {} text changed ({}), seq={}", id, LogSanitizer.describe(candidate.text()), candidate.sequence());
        submit(candidate);
    }

    /** Immediate: re-stamps the current text in the new mode. No-op if the mode is unchanged. */
    public void modeChanged(Mode newMode) {
        Objects.requireNonNull(newMode, "newMode");
        RequestCandidate candidate;
        inputLock.lock();
        try {
            if (newMode == mode) {
                return;
            }
            mode = newMode;
            candidate = sequencer.stamp(mode, text, options, true);
        } finally {
            inputLock.unlock();
        }
        LOG.info("Session {} switched to mode {}, seq={}", id, newMode.wireName(), candidate.sequence());
        submit(candidate);
    }

    /** Immediate: re-stamps the current text with new rewrite options. No-op if unchanged. */
    public void optionsChanged(RewriteOptions newOptions) {
        Objects.requireNonNull(newOptions, "newOptions");
        RequestCandidate candidate;
        inputLock.lock();
        try {
            if (newOptions.equals(options)) {
                return;
            }
            options = newOptions;
            candidate = sequencer.stamp(mode, text, options, true);
        } finally {
            inputLock.unlock();
        }
        LOG.debug("Session {} options changed ({}), seq={}", id, newOptions.canonical(), candidate.sequence());
        submit(candidate);
    }

    /**
     * Regenerates: drops the cached answer for the current input and re-issues it immediately.
     */
    public void refresh() {
        RequestCandidate candidate;
        inputLock.lock();
        try {
            candidate = sequencer.stamp(mode, text, options, true);
        } finally {
            inputLock.unlock();
        }
        if (cache != null && cache.invalidate(candidate.fingerprint())) {
            LOG.debug("Session {} refresh invalidated {}", id, candidate.fingerprint());
        }
        submit(candidate);
    }

    public Mode mode() {
        inputLock.lock();
        try {
            return mode;
        } finally {
            inputLock.unlock();
        }
    }

    public RewriteOptions options() {
        inputLock.lock();
        try {
            return options;
        } finally {
            inputLock.unlock();
        }
    }

    public long latestSequence() {
        return coordinator.latestIssued();
    }

    public boolean isClosed() {
        return coordinator.isClosed();
    }

    /** Visible for tests. */
    RequestCoordinator coordinator() {
        return coordinator;
    }

    /** Visible for tests. */
    DebounceGate gate() {
        return gate;
    }

    @Override
    public void close() {
        gate.cancel();
        coordinator.close();
        LOG.info("Session {} closed", id);
    }

    private void submit(RequestCandidate candidate) {
        if (coordinator.isClosed()) {
            return;
        }
        coordinator.candidateIssued(candidate);
        if (candidate.isBlank()) {
            gate.supersede(candidate);
        } else if (candidate.immediate()) {
            gate.fireNow(candidate);
        } else {
            gate.schedule(candidate);
        }
    }
}
