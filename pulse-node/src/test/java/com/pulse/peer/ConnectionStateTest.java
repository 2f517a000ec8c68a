package com.pulse.peer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ConnectionStateTest {

    @Test
    void idleMayStartEitherSideOfNegotiation() {
        assertThat(ConnectionState.IDLE.canTransitionTo(ConnectionState.OFFERING)).isTrue();
        assertThat(ConnectionState.IDLE.canTransitionTo(ConnectionState.ANSWERING)).isTrue();
        assertThat(ConnectionState.IDLE.canTransitionTo(ConnectionState.CONNECTED)).isFalse();
    }

    @Test
    void failedMayOnlyReconnectOrClose() {
        assertThat(ConnectionState.FAILED.canTransitionTo(ConnectionState.CONNECTING)).isTrue();
        assertThat(ConnectionState.FAILED.canTransitionTo(ConnectionState.CLOSED)).isTrue();
        assertThat(ConnectionState.FAILED.canTransitionTo(ConnectionState.OFFERING)).isFalse();
        assertThat(ConnectionState.FAILED.canTransitionTo(ConnectionState.CONNECTED)).isFalse();
    }

    @Test
    void closedIsFinal() {
        for (ConnectionState target : ConnectionState.values()) {
            assertThat(ConnectionState.CLOSED.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void connectedCannotGoBackToNegotiation() {
        assertThat(ConnectionState.CONNECTED.canTransitionTo(ConnectionState.CONNECTING)).isFalse();
        assertThat(ConnectionState.CONNECTED.canTransitionTo(ConnectionState.OFFERING)).isFalse();
        assertThat(ConnectionState.CONNECTED.canTransitionTo(ConnectionState.FAILED)).isTrue();
    }

    @Test
    void activeStatesBlockRedial() {
        assertThat(ConnectionState.OFFERING.isActive()).isTrue();
        assertThat(ConnectionState.CONNECTING.isActive()).isTrue();
        assertThat(ConnectionState.CONNECTED.isActive()).isTrue();
        assertThat(ConnectionState.IDLE.isActive()).isFalse();
        assertThat(ConnectionState.FAILED.isActive()).isFalse();
    }

    @Test
    void peerConnectionRejectsIllegalEdge() {
        PeerConnection connection = new PeerConnection("peer-b", 0);
        connection.transitionTo(ConnectionState.OFFERING);

        assertThatThrownBy(() -> connection.transitionTo(ConnectionState.CONNECTED))
                .isInstanceOf(IllegalPeerStateTransitionException.class)
                .hasMessageContaining("offering")
                .hasMessageContaining("connected");
        assertThat(connection.getState()).isEqualTo(ConnectionState.OFFERING);
    }

    @Test
    void sameStateTransitionIsIgnored() {
        PeerConnection connection = new PeerConnection("peer-b", 0);
        connection.transitionTo(ConnectionState.ANSWERING);
        connection.transitionTo(ConnectionState.CONNECTING);
        connection.transitionTo(ConnectionState.CONNECTING);

        assertThat(connection.getState()).isEqualTo(ConnectionState.CONNECTING);
    }
}
