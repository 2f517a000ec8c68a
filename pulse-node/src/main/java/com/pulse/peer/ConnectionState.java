package com.pulse.peer;

import java.util.EnumSet;
import java.util.Set;

/**
 * 피어 연결 상태와 허용되는 전이 표. 표에 없는 전이는 구현 결함으로 본다.
 */
public enum ConnectionState {
    IDLE,
    OFFERING,
    ANSWERING,
    CONNECTING,
    CONNECTED,
    FAILED,
    CLOSED;

    private Set<ConnectionState> targets;

    static {
        IDLE.targets = EnumSet.of(OFFERING, ANSWERING, FAILED, CLOSED);
        OFFERING.targets = EnumSet.of(CONNECTING, FAILED, CLOSED);
        ANSWERING.targets = EnumSet.of(CONNECTING, FAILED, CLOSED);
        CONNECTING.targets = EnumSet.of(CONNECTED, FAILED, CLOSED);
        CONNECTED.targets = EnumSet.of(FAILED, CLOSED);
        FAILED.targets = EnumSet.of(CONNECTING, CLOSED);
        CLOSED.targets = EnumSet.noneOf(ConnectionState.class);
    }

    public boolean canTransitionTo(ConnectionState target) {
        return targets.contains(target);
    }

    /**
     * 협상이 진행 중이거나 이미 연결된 상태. 이 상태에서는 새 다이얼을 하지 않는다.
     */
    public boolean isActive() {
        return this == OFFERING || this == ANSWERING || this == CONNECTING || this == CONNECTED;
    }

    public boolean isTerminal() {
        return this == FAILED || this == CLOSED;
    }

    public String toValue() {
        return name().toLowerCase();
    }
}
