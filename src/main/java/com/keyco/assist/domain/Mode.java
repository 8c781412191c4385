package com.keyco.assist.domain;

import java.util.Locale;

/**
 * Operating modes of the input surface.
 *
 * <p>The set is closed: normalization, fingerprinting and routing switch over it exhaustively,
 * so adding a mode fails compilation until every rule covers it.
 *
 * <ul>
 *   <li>{@link #COMPOSE} - free-form writing rewritten by the backend (case-sensitive)</li>
 *   <li>{@link #SEARCH_QUERY} - web search query shaping (case-insensitive)</li>
 *   <li>{@link #CONVERSATIONAL} - conversational AI completion (case-sensitive)</li>
 *   <li>{@link #SNIPPET} - canned-snippet insertion, resolved locally (case-insensitive)</li>
 * </ul>
 */
public enum Mode {

    COMPOSE("compose"),
    SEARCH_QUERY("search-query"),
    CONVERSATIONAL("conversational"),
    SNIPPET("snippet");

    private final String wireName;

    Mode(String wireName) {
        this.wireName = wireName;
    }

    /** Name used on the wire, in configuration keys and in metric tags. */
    public String wireName() {
        return wireName;
    }

    /**
     * Whether letter case is significant for this mode's fingerprint.
     *
     * @return {@code true} when "Hello" and "hello" must be treated as different input
     */
    public boolean caseSensitive() {
        return switch (this) {
            case COMPOSE, CONVERSATIONAL -> true;
            case SEARCH_QUERY, SNIPPET -> false;
        };
    }

    /**
     * Whether requests in this mode leave the process.
     *
     * @return {@code false} for modes answered from local shared storage
     */
    public boolean remote() {
        return switch (this) {
            case COMPOSE, SEARCH_QUERY, CONVERSATIONAL -> true;
            case SNIPPET -> false;
        };
    }

    /**
     * Resolves a mode from its wire name or enum constant name, ignoring case.
     *
     * @param value e.g. {@code "search-query"} or {@code "SEARCH_QUERY"}
     * @return the matching mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static Mode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode must not be blank");
        }
        String candidate = value.trim().toLowerCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.wireName.equals(candidate) || mode.name().equalsIgnoreCase(candidate)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + value);
    }
}
