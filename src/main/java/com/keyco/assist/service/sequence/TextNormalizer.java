package com.keyco.assist.service.sequence;

import com.keyco.assist.domain.Mode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes user text before fingerprinting.
 *
 * <p>Rules applied to every mode: leading/trailing whitespace removed, internal whitespace runs
 * collapsed to a single space. Modes that are not {@link Mode#caseSensitive() case-sensitive} are
 * additionally lower-cased with {@link Locale#ROOT}.
 *
 * <p>Normalization only affects the fingerprint; the raw text is what gets sent.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {
        // Utility class - prevent instantiation
    }

    public static String normalize(Mode mode, String text) {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ");
        return mode.caseSensitive() ? collapsed : collapsed.toLowerCase(Locale.ROOT);
    }
}
