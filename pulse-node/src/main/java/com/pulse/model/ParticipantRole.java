package com.pulse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 참가자가 presence에 선언하는 역할(호스트/클라이언트)을 구분한다.
 */
public enum ParticipantRole {
    HOST,
    CLIENT;

    /**
     * 직렬화된 문자열을 열거형으로 변환한다.
     */
    @JsonCreator
    public static ParticipantRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ParticipantRole role : values()) {
            if (role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown participant role: " + value);
    }

    /**
     * presence 메타데이터에 기록되는 소문자 값.
     */
    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
