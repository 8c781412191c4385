package com.keyco.assist.service.sequence;

import com.keyco.assist.domain.Fingerprint;
import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RewriteOptions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes stable SHA-256 fingerprints over normalized (mode, text).
 *
 * <p>Compose-mode fingerprints also fold in the rewrite options, since tone, length and preset
 * change the answer for identical text. Other modes ignore options.
 *
 * <p>Stateless and thread-safe; a new {@link MessageDigest} is obtained per call.
 */
public class FingerprintCalculator {

    private static final char SEPARATOR = '\u001F';

    public Fingerprint compute(Mode mode, String text, RewriteOptions options) {
        String normalized = TextNormalizer.normalize(mode, text);
        StringBuilder canonical = new StringBuilder()
                .append(mode.wireName())
                .append(SEPARATOR)
                .append(normalized);
        if (mode == Mode.COMPOSE) {
            RewriteOptions effective = options == null ? RewriteOptions.DEFAULTS : options;
            canonical.append(SEPARATOR).append(effective.canonical());
        }
        return new Fingerprint(mode, sha256Hex(canonical.toString()));
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
