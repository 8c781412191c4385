package com.keyco.assist.service.sink;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;
import com.keyco.assist.service.sink.event.AssistFailurePublishedEvent;
import com.keyco.assist.service.sink.event.AssistResultPublishedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * {@link ResultSink} that re-publishes outcomes as Spring application events, decoupling the
 * orchestration core from whichever surface consumes them.
 */
public class EventPublishingResultSink implements ResultSink {

    private final ApplicationEventPublisher publisher;

    public EventPublishingResultSink(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void publish(AssistResult result) {
        publisher.publishEvent(new AssistResultPublishedEvent(result));
    }

    @Override
    public void publish(AssistFailure failure) {
        publisher.publishEvent(new AssistFailurePublishedEvent(failure));
    }
}
