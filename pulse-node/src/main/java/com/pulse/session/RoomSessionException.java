package com.pulse.session;

/**
 * 방 생성/참가/퇴장처럼 방 단위 작업이 실패했을 때 원인을 요약해서 전달한다.
 */
public class RoomSessionException extends RuntimeException {

    private final String roomId;

    public RoomSessionException(String roomId, String message) {
        super(message);
        this.roomId = roomId;
    }

    public RoomSessionException(String roomId, String message, Throwable cause) {
        super(message, cause);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
