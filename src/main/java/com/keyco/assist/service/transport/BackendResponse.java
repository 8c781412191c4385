package com.keyco.assist.service.transport;

import com.keyco.assist.domain.Usage;

import java.util.Objects;

/**
 * Successful backend answer.
 *
 * @param text result text, already trimmed
 * @param usage usage metadata, {@link Usage#NONE} when absent
 */
public record BackendResponse(String text, Usage usage) {

    public BackendResponse {
        Objects.requireNonNull(text, "text must not be null");
        usage = usage == null ? Usage.NONE : usage;
    }
}
