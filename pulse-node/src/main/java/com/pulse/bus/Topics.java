package com.pulse.bus;

/**
 * 버스 토픽/이벤트 이름 규칙.
 */
public final class Topics {

    public static final String EVENT_SIGNAL = "signal";
    public static final String EVENT_HOST_UPDATE = "host-update";
    public static final String EVENT_INSERT = "INSERT";
    public static final String EVENT_DELETE = "DELETE";
    public static final String EVENT_UPDATE = "UPDATE";

    private Topics() {
    }

    public static String presence(String roomId) {
        return "presence:" + roomId;
    }

    public static String room(String roomId) {
        return "room:" + roomId;
    }

    /**
     * 참가자 개인 수신함. 해당 참가자에게 주소 지정된 시그널이 이 토픽으로 전달된다.
     */
    public static String inbox(String userId) {
        return "user:" + userId;
    }

    public static String members(String roomId) {
        return "room-members:" + roomId;
    }

    public static String roomOwner(String roomId) {
        return "room:" + roomId + ":host";
    }
}
