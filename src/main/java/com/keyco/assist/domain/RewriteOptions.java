package com.keyco.assist.domain;

import java.util.Objects;

/**
 * Compose-mode rewrite parameters chosen by the user.
 *
 * <p>Out-of-range values are accepted here and rejected by the coordinator as a client error, so a
 * bad slider value surfaces to the user instead of failing inside the input surface.
 *
 * @param tone 0 = casual, 1 = formal
 * @param length 0 = detailed, 1 = brief
 * @param preset optional preset identifier (e.g. "fix_grammar", "polish"), nullable
 * @param locale spelling locale sent to the backend, e.g. "en-GB"
 */
public record RewriteOptions(double tone, double length, String preset, String locale) {

    public static final String DEFAULT_LOCALE = "en-GB";

    public static final RewriteOptions DEFAULTS = new RewriteOptions(0.5, 0.5, null, DEFAULT_LOCALE);

    public RewriteOptions {
        if (preset != null && preset.isBlank()) {
            preset = null;
        }
        locale = (locale == null || locale.isBlank()) ? DEFAULT_LOCALE : locale.trim();
    }

    /** True when tone and length are both within [0, 1]. */
    public boolean isValid() {
        return inUnitRange(tone) && inUnitRange(length);
    }

    /**
     * Stable textual form folded into compose-mode fingerprints.
     *
     * @return canonical representation, two decimal places per slider
     */
    public String canonical() {
        return String.format(java.util.Locale.ROOT, "tone=%.2f;length=%.2f;preset=%s;locale=%s",
                tone, length, Objects.toString(preset, ""), locale);
    }

    private static boolean inUnitRange(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
