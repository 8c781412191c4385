package com.keyco.assist.service.sink.event;

import com.keyco.assist.domain.AssistResult;

import java.util.Objects;

/**
 * Spring application event carrying a published result.
 */
public record AssistResultPublishedEvent(AssistResult result) {
    public AssistResultPublishedEvent {
        Objects.requireNonNull(result, "result");
    }
}
