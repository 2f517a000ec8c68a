package com.pulse.transport;

import java.util.Objects;

/**
 * SDP offer/answer 한 건.
 */
public class SessionDescription {

    public enum Type {
        OFFER,
        ANSWER
    }

    private final Type type;
    private final String sdp;

    public SessionDescription(Type type, String sdp) {
        this.type = Objects.requireNonNull(type, "type");
        this.sdp = Objects.requireNonNull(sdp, "sdp");
    }

    public Type getType() {
        return type;
    }

    public String getSdp() {
        return sdp;
    }

    @Override
    public String toString() {
        return "SessionDescription{type=" + type + ", sdp=" + sdp.length() + " chars}";
    }
}
