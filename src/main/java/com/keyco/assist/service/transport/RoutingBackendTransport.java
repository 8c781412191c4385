package com.keyco.assist.service.transport;

import com.keyco.assist.domain.Mode;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Sends remote modes to the HTTP backend and snippet mode to the local snippet container.
 */
public class RoutingBackendTransport implements BackendTransport {

    private final BackendTransport remote;
    private final BackendTransport local;

    public RoutingBackendTransport(BackendTransport remote, BackendTransport local) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.local = Objects.requireNonNull(local, "local");
    }

    @Override
    public CompletableFuture<BackendResponse> send(BackendRequest request) {
        return route(request.mode()).send(request);
    }

    @Override
    public String endpointFor(Mode mode) {
        return route(mode).endpointFor(mode);
    }

    private BackendTransport route(Mode mode) {
        return mode.remote() ? remote : local;
    }
}
