package com.pulse.peer;

public class IllegalPeerStateTransitionException extends IllegalStateException {

    private final String peerId;
    private final ConnectionState from;
    private final ConnectionState to;

    public IllegalPeerStateTransitionException(String peerId, ConnectionState from, ConnectionState to) {
        super("Illegal transition for peer " + peerId + ": " + from.toValue() + " -> " + to.toValue());
        this.peerId = peerId;
        this.from = from;
        this.to = to;
    }

    public String getPeerId() {
        return peerId;
    }

    public ConnectionState getFrom() {
        return from;
    }

    public ConnectionState getTo() {
        return to;
    }
}
