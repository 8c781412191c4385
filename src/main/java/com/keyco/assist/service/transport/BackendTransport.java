package com.keyco.assist.service.transport;

import com.keyco.assist.domain.Mode;

import java.util.concurrent.CompletableFuture;

/**
 * Network call abstraction used by the request coordinator.
 *
 * <p>Implementations must never block the caller. Failures complete the future exceptionally with
 * a {@link com.keyco.assist.exception.TransportException} classifying the failure; any other
 * exception type is treated as a network failure. Cancelling the returned future is a best-effort
 * abort: the coordinator discards whatever arrives afterwards.
 */
public interface BackendTransport {

    CompletableFuture<BackendResponse> send(BackendRequest request);

    /**
     * Name of the circuit-breaker endpoint that guards calls for {@code mode}. Modes that share a
     * backend path share a breaker.
     */
    String endpointFor(Mode mode);
}
