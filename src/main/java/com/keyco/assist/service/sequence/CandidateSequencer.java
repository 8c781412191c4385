package com.keyco.assist.service.sequence;

import com.keyco.assist.domain.Fingerprint;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RequestCandidate;
import com.keyco.assist.domain.RewriteOptions;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-scoped stamping of request candidates.
 *
 * <p>Every call to {@link #stamp} issues a new sequence number, even when the fingerprint is
 * unchanged, so staleness can be detected independently of content equality. Incrementing the
 * counter is the only side effect.
 */
public class CandidateSequencer {

    private final FingerprintCalculator fingerprints;
    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();

    public CandidateSequencer(FingerprintCalculator fingerprints, Clock clock) {
        this.fingerprints = Objects.requireNonNull(fingerprints, "fingerprints");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stamps a new candidate.
     *
     * @param mode current mode
     * @param text raw text, {@code null} treated as empty
     * @param options rewrite options in effect, {@code null} for defaults
     * @param immediate whether the candidate must bypass debounce
     * @return a candidate with the next sequence number
     */
    public RequestCandidate stamp(Mode mode, String text, RewriteOptions options, boolean immediate) {
        Objects.requireNonNull(mode, "mode");
        String raw = text == null ? "" : text;
        RewriteOptions effective = options == null ? RewriteOptions.DEFAULTS : options;
        Fingerprint fingerprint = fingerprints.compute(mode, raw, effective);
        long sequence = counter.incrementAndGet();
        return new RequestCandidate(fingerprint, sequence, mode, raw, effective, clock.instant(), immediate);
    }

    /** Last issued sequence, 0 before the first stamp. */
    public long lastIssued() {
        return counter.get();
    }
}
