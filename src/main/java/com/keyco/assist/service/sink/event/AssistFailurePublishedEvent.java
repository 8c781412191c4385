package com.keyco.assist.service.sink.event;

import com.keyco.assist.domain.AssistFailure;

import java.util.Objects;

/**
 * Spring application event carrying a published failure. PII note: carries no user text.
 */
public record AssistFailurePublishedEvent(AssistFailure failure) {
    public AssistFailurePublishedEvent {
        Objects.requireNonNull(failure, "failure");
    }
}
