package com.keyco.assist.service.transport;

import com.keyco.assist.domain.Mode;
import com.keyco.assist.domain.RewriteOptions;

import java.util.Objects;

/**
 * One transport attempt's payload.
 *
 * @param mode request mode
 * @param text raw user text
 * @param contextLength number of characters of context being sent
 * @param options rewrite options (only sent in compose mode)
 */
public record BackendRequest(Mode mode, String text, int contextLength, RewriteOptions options) {

    public BackendRequest {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(text, "text must not be null");
        options = options == null ? RewriteOptions.DEFAULTS : options;
        if (contextLength < 0) {
            throw new IllegalArgumentException("contextLength must be >= 0");
        }
    }
}
