package com.keyco.assist.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A terminal failure published to the input surface.
 *
 * <p>{@code userMessage} is safe to display; {@code detail} is diagnostic and must not be shown
 * verbatim. {@link FailureKind#CANCELLED} is never published.
 *
 * @param sessionId owning session
 * @param sequence sequence of the candidate this answers
 * @param mode mode the candidate was entered in
 * @param kind failure classification
 * @param userMessage actionable message for the user
 * @param detail technical detail for logs, may be empty
 * @param attempts number of transport attempts made (0 for fail-fast paths)
 * @param statusCode HTTP status when known, otherwise 0
 * @param retryAfter backend-supplied retry hint, nullable
 * @param failedAt publish time
 */
public record AssistFailure(
        String sessionId,
        long sequence,
        Mode mode,
        FailureKind kind,
        String userMessage,
        String detail,
        int attempts,
        int statusCode,
        Duration retryAfter,
        Instant failedAt
) {

    public AssistFailure {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        userMessage = userMessage == null ? kind.userMessage() : userMessage;
        detail = detail == null ? "" : detail;
        Objects.requireNonNull(failedAt, "failedAt must not be null");
    }
}
