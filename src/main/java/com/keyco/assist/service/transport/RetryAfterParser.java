package com.keyco.assist.service.transport;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses throttling hints: the {@code Retry-After} header (delta-seconds or HTTP date) and the
 * ISO-8601 {@code resetAt} field some 429 bodies carry.
 */
final class RetryAfterParser {

    /** Hints are clamped to this; anything longer is treated as "not soon". */
    static final Duration MAX_HINT = Duration.ofDays(1);

    private RetryAfterParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @return the hint relative to {@code now} (never negative), or {@code null} if absent or unparsable
     */
    static Duration fromHeader(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return clamp(Duration.ofSeconds(Long.parseLong(trimmed)));
            } catch (NumberFormatException e) {
                // More digits than a long holds
                return MAX_HINT;
            }
        }
        try {
            Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            return nonNegative(Duration.between(now, at));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Duration fromResetAt(String isoInstant, Instant now) {
        if (isoInstant == null || isoInstant.isBlank()) {
            return null;
        }
        try {
            return nonNegative(Duration.between(now, Instant.parse(isoInstant.trim())));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Duration nonNegative(Duration d) {
        return d.isNegative() ? Duration.ZERO : clamp(d);
    }

    private static Duration clamp(Duration d) {
        return d.compareTo(MAX_HINT) > 0 ? MAX_HINT : d;
    }
}
