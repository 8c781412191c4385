package com.keyco.assist.service.cache;

import com.keyco.assist.domain.Fingerprint;
import com.keyco.assist.domain.Usage;

import java.time.Instant;
import java.util.Objects;

/**
 * Last known backend answer for a fingerprint. Session-independent, so it can be replayed to any
 * session whose current input produces the same fingerprint.
 */
public record CacheEntry(Fingerprint fingerprint, String text, Usage usage, Instant storedAt) {

    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(text, "text must not be null");
        usage = usage == null ? Usage.NONE : usage;
        Objects.requireNonNull(storedAt, "storedAt must not be null");
    }
}
