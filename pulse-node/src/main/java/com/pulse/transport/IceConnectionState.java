package com.pulse.transport;

/**
 * 트랜스포트의 ICE 연결 상태.
 */
public enum IceConnectionState {
    NEW,
    CHECKING,
    CONNECTED,
    COMPLETED,
    FAILED,
    DISCONNECTED,
    CLOSED;

    public boolean isConnected() {
        return this == CONNECTED || this == COMPLETED;
    }
}
