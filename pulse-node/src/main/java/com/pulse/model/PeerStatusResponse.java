package com.pulse.model;

import java.util.List;
import java.util.Map;

/**
 * 세션의 피어 연결 상태 스냅샷. peers는 피어 ID별 연결 상태 문자열이다.
 */
public class PeerStatusResponse {

    private String roomId;
    private boolean host;
    private String currentHostId;
    private Map<String, String> peers;
    private List<String> connected;

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public boolean isHost() {
        return host;
    }

    public void setHost(boolean host) {
        this.host = host;
    }

    public String getCurrentHostId() {
        return currentHostId;
    }

    public void setCurrentHostId(String currentHostId) {
        this.currentHostId = currentHostId;
    }

    public Map<String, String> getPeers() {
        return peers;
    }

    public void setPeers(Map<String, String> peers) {
        this.peers = peers;
    }

    public List<String> getConnected() {
        return connected;
    }

    public void setConnected(List<String> connected) {
        this.connected = connected;
    }
}
