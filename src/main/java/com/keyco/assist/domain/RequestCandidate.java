package com.keyco.assist.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable request candidate stamped on every qualifying edit or mode change.
 *
 * <p>Superseded candidates are discarded, never mutated. The {@code sequence} is the only
 * authority for relevance: a result is published only when its candidate's sequence equals the
 * session's latest issued sequence.
 *
 * @param fingerprint digest of normalized mode + text (+ compose options)
 * @param sequence session-scoped, strictly increasing
 * @param mode mode the text was entered in
 * @param text raw text as typed (normalization only affects the fingerprint)
 * @param options rewrite options in effect when stamped
 * @param createdAt stamp time
 * @param immediate {@code true} when the candidate represents explicit user intent
 *                  (mode switch, option change, refresh) and must bypass debounce
 */
public record RequestCandidate(
        Fingerprint fingerprint,
        long sequence,
        Mode mode,
        String text,
        RewriteOptions options,
        Instant createdAt,
        boolean immediate
) {

    public RequestCandidate {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive, got: " + sequence);
        }
    }

    /** True when there is nothing to send (empty after trimming). */
    public boolean isBlank() {
        return text.isBlank();
    }
}
