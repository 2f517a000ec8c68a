package com.pulse.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Objects;

/**
 * 방 멤버십 행. 행이 존재하면 해당 참가자가 현재 방에 참여 중인 것으로 본다.
 */
@Entity
@Table(name = "room_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_room_members_room_user", columnNames = {"room_id", "user_id"}))
public class RoomMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 100)
    private String roomId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    protected RoomMember() {
    }

    public RoomMember(String roomId, String userId, Instant joinedAt) {
        this.roomId = Objects.requireNonNull(roomId, "roomId must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.joinedAt = joinedAt == null ? Instant.now() : joinedAt;
    }

    public Long getId() {
        return id;
    }

    public String getRoomId() {
        return roomId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }
}
