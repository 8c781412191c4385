package com.keyco.assist.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A successful outcome published to the input surface.
 *
 * @param sessionId owning session
 * @param sequence sequence of the candidate this answers
 * @param fingerprint fingerprint of the candidate this answers
 * @param mode mode the candidate was entered in
 * @param text result text, trimmed
 * @param usage backend usage metadata, {@link Usage#NONE} when absent
 * @param fromCache {@code true} when served from the response cache without a network call
 * @param completedAt publish time
 */
public record AssistResult(
        String sessionId,
        long sequence,
        Fingerprint fingerprint,
        Mode mode,
        String text,
        Usage usage,
        boolean fromCache,
        Instant completedAt
) {

    public AssistResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(text, "text must not be null");
        usage = usage == null ? Usage.NONE : usage;
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }
}
