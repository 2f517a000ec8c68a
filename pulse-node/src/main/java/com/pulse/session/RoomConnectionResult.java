package com.pulse.session;

import com.pulse.model.ParticipantRole;

/**
 * 방 생성/참가 결과. 참가자는 요청한 역할과 상관없이 선출 결과에 따라 호스트가 될 수 있다.
 */
public class RoomConnectionResult {

    private final String roomId;
    private final String participantId;
    private final ParticipantRole role;
    private final boolean host;
    private final boolean autoConnect;

    public RoomConnectionResult(String roomId, String participantId, ParticipantRole role, boolean host,
            boolean autoConnect) {
        this.roomId = roomId;
        this.participantId = participantId;
        this.role = role;
        this.host = host;
        this.autoConnect = autoConnect;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getParticipantId() {
        return participantId;
    }

    public ParticipantRole getRole() {
        return role;
    }

    public boolean isHost() {
        return host;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    @Override
    public String toString() {
        return "RoomConnectionResult{roomId=" + roomId + ", participantId=" + participantId + ", role="
                + role.toValue() + ", host=" + host + ", autoConnect=" + autoConnect + "}";
    }
}
