package com.pulse.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;

/**
 * 방의 내구성 레코드. owner 값이 현재 호스트를 나타내는 유일한 기준이다.
 */
@Entity
@Table(name = "rooms")
public class Room {

    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "room_name", length = 200)
    private String roomName;

    // 조건부 UPDATE로만 변경된다.
    @Column(name = "owner", length = 100)
    private String owner;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Room() {
    }

    public Room(String id, String roomName, String owner, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "room id must not be null");
        this.roomName = roomName;
        this.owner = owner;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public String getId() {
        return id;
    }

    public String getRoomName() {
        return roomName;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
