package com.pulse.signaling;

/**
 * host-elected 브로드캐스트의 data 필드.
 */
public class HostAnnouncement {

    private String userId;
    private String roomId;
    private long timestamp;

    public HostAnnouncement() {
    }

    public HostAnnouncement(String userId, String roomId, long timestamp) {
        this.userId = userId;
        this.roomId = roomId;
        this.timestamp = timestamp;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }
}
