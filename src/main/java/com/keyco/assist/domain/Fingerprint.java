package com.keyco.assist.domain;

import java.util.Objects;

/**
 * Deterministic digest of normalized (mode, text) input. Keys the response cache and
 * detects unchanged input.
 *
 * @param mode the mode the digest was computed for
 * @param digest lowercase hex SHA-256 digest
 */
public record Fingerprint(Mode mode, String digest) {

    public Fingerprint {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(digest, "digest must not be null");
        if (digest.isBlank()) {
            throw new IllegalArgumentException("digest must not be blank");
        }
    }

    /** Short form for log lines. */
    public String shortDigest() {
        return digest.length() <= 12 ? digest : digest.substring(0, 12);
    }

    @Override
    public String toString() {
        return mode.wireName() + ':' + shortDigest();
    }
}
