package com.pulse.signaling;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 참가자 사이에 주고받는 시그널 한 건. data는 type별 페이로드다.
 */
public class SignalMessage {

    /** 방 전체 브로드캐스트 수신자 표기. */
    public static final String BROADCAST = "*";

    private String from;
    private String to;
    private SignalType type;
    private JsonNode data;

    public SignalMessage() {
    }

    public SignalMessage(String from, String to, SignalType type, JsonNode data) {
        this.from = from;
        this.to = to;
        this.type = type;
        this.data = data;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public SignalType getType() {
        return type;
    }

    public void setType(SignalType type) {
        this.type = type;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    @Override
    public String toString() {
        return "SignalMessage{" + type + " " + from + " -> " + to + "}";
    }
}
