package com.pulse.signaling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 시그널 메시지 종류. 와이어 표기는 소문자 하이픈 형식이다.
 */
public enum SignalType {
    OFFER("offer"),
    ANSWER("answer"),
    ICE("ice"),
    HOST_ELECTED("host-elected");

    private final String value;

    SignalType(String value) {
        this.value = value;
    }

    @JsonCreator
    public static SignalType fromValue(String value) {
        for (SignalType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown signal type: " + value);
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
