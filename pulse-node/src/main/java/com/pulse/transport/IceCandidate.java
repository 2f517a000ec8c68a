package com.pulse.transport;

import java.util.Objects;

public class IceCandidate {

    private final String candidate;
    private final String sdpMid;
    private final int sdpMLineIndex;

    public IceCandidate(String candidate, String sdpMid, int sdpMLineIndex) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.sdpMid = sdpMid;
        this.sdpMLineIndex = sdpMLineIndex;
    }

    public String getCandidate() {
        return candidate;
    }

    public String getSdpMid() {
        return sdpMid;
    }

    public int getSdpMLineIndex() {
        return sdpMLineIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IceCandidate)) {
            return false;
        }
        IceCandidate other = (IceCandidate) o;
        return sdpMLineIndex == other.sdpMLineIndex
                && candidate.equals(other.candidate)
                && Objects.equals(sdpMid, other.sdpMid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, sdpMid, sdpMLineIndex);
    }

    @Override
    public String toString() {
        return "IceCandidate{" + sdpMid + ":" + sdpMLineIndex + " " + candidate + "}";
    }
}
