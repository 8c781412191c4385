package com.keyco.assist.service.transport;

import com.keyco.assist.domain.Mode;
import com.keyco.assist.testutil.ControllableTransport;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingBackendTransportTest {

    private final ControllableTransport remote = new ControllableTransport(mode -> "remote-" + mode.wireName());
    private final ControllableTransport local = new ControllableTransport(mode -> "local");
    private final RoutingBackendTransport routing = new RoutingBackendTransport(remote, local);

    @Test
    void shouldSendRemoteModesToRemoteTransport() {
        routing.send(new BackendRequest(Mode.COMPOSE, "a", 1, null));
        routing.send(new BackendRequest(Mode.SEARCH_QUERY, "b", 1, null));
        routing.send(new BackendRequest(Mode.CONVERSATIONAL, "c", 1, null));

        assertThat(remote.callCount()).isEqualTo(3);
        assertThat(local.callCount()).isZero();
    }

    @Test
    void shouldSendSnippetModeToLocalTransport() {
        routing.send(new BackendRequest(Mode.SNIPPET, "sig", 3, null));

        assertThat(local.callCount()).isEqualTo(1);
        assertThat(remote.callCount()).isZero();
    }

    @Test
    void shouldDelegateEndpointResolution() {
        assertThat(routing.endpointFor(Mode.COMPOSE)).isEqualTo("remote-compose");
        assertThat(routing.endpointFor(Mode.SNIPPET)).isEqualTo("local");
    }
}
