package com.keyco.assist.service.sink;

import com.keyco.assist.domain.AssistFailure;
import com.keyco.assist.domain.AssistResult;

/**
 * Receives published outcomes on behalf of the input surface.
 *
 * <p>The coordinator calls at most one of these methods per candidate, never while holding
 * session state locks. Implementations must not block.
 */
public interface ResultSink {

    void publish(AssistResult result);

    void publish(AssistFailure failure);
}
