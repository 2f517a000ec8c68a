package com.pulse.model;

/**
 * 기존 방에 참가할 때 전달하는 요청 정보. 역할을 생략하면 클라이언트로 참가한다.
 */
public class JoinRoomRequest {

    private ParticipantRole role;

    public ParticipantRole getRole() {
        return role;
    }

    public void setRole(ParticipantRole role) {
        this.role = role;
    }
}
