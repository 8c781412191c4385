package com.keyco.assist.domain;

/**
 * Failure taxonomy for backend resolutions.
 *
 * <p>Each kind decides three things: whether the retry scheduler may try again, whether the
 * failure counts toward the circuit breaker's consecutive failures, and what the user is told.
 */
public enum FailureKind {

    /** Unreachable host or connection failure. */
    NETWORK(true, true, "You appear to be offline. Check your connection and try again."),

    /** Request exceeded its deadline. */
    TIMEOUT(true, true, "Taking too long. Please try again."),

    /** HTTP 429. The backend is healthy, just throttling. */
    RATE_LIMITED(true, false, "Too many requests. Please wait a moment and try again."),

    /** HTTP 5xx or an unusable success body. */
    SERVER_ERROR(true, true, "AI isn't responding. Please try again shortly."),

    /** HTTP 4xx other than 429, or a request rejected before sending. Not retried. */
    CLIENT_ERROR(false, false, "Couldn't process that. Please edit your text and try again."),

    /** Breaker rejected the call; no attempt was made. */
    CIRCUIT_OPEN(false, false, "The assistant is temporarily unavailable. Please try again shortly."),

    /** Superseded by newer input. Never shown to the user. */
    CANCELLED(false, false, "");

    private final boolean retryable;
    private final boolean breakerFailure;
    private final String userMessage;

    FailureKind(boolean retryable, boolean breakerFailure, String userMessage) {
        this.retryable = retryable;
        this.breakerFailure = breakerFailure;
        this.userMessage = userMessage;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /** Whether a terminal failure of this kind increments the breaker's consecutive failures. */
    public boolean countsAsBreakerFailure() {
        return breakerFailure;
    }

    public String userMessage() {
        return userMessage;
    }

    /** Lowercase tag for metrics and logs, e.g. {@code rate_limited}. */
    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
