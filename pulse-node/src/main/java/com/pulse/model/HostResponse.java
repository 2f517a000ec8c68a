package com.pulse.model;

public class HostResponse {

    private String roomId;
    private String hostId;

    public HostResponse() {
    }

    public HostResponse(String roomId, String hostId) {
        this.roomId = roomId;
        this.hostId = hostId;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }
}
