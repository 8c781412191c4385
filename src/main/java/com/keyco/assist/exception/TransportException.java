package com.keyco.assist.exception;

import com.keyco.assist.domain.FailureKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown (or used to complete a future exceptionally) when a backend call fails.
 *
 * <p>Carries the classification the retry scheduler and circuit breaker act on. Never
 * {@link FailureKind#CANCELLED} or {@link FailureKind#CIRCUIT_OPEN}: those are decided by the
 * coordinator, not by a transport.
 */
public class TransportException extends AssistException {

    private final FailureKind kind;
    private final String endpoint;
    private final int statusCode;
    private final Duration retryAfter;

    public TransportException(FailureKind kind, String message) {
        this(kind, message, "unknown", 0, null, null);
    }

    public TransportException(FailureKind kind, String message, Throwable cause) {
        this(kind, message, "unknown", 0, null, cause);
    }

    public TransportException(FailureKind kind,
                              String message,
                              String endpoint,
                              int statusCode,
                              Duration retryAfter,
                              Throwable cause) {
        super(message + " (endpoint: " + (endpoint == null ? "unknown" : endpoint) + ")", cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.endpoint = endpoint == null ? "unknown" : endpoint;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** HTTP status when the backend answered, otherwise 0. */
    public int getStatusCode() {
        return statusCode;
    }

    /** Backend-supplied retry hint, or {@code null}. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
