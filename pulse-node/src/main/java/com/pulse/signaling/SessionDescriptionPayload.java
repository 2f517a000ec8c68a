package com.pulse.signaling;

/**
 * offer/answer 시그널의 data 필드.
 */
public class SessionDescriptionPayload {

    private String type;
    private String sdp;

    public SessionDescriptionPayload() {
    }

    public SessionDescriptionPayload(String type, String sdp) {
        this.type = type;
        this.sdp = sdp;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSdp() {
        return sdp;
    }

    public void setSdp(String sdp) {
        this.sdp = sdp;
    }
}
