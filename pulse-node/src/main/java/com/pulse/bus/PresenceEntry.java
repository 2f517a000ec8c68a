package com.pulse.bus;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * presence 메타데이터. 구독이 유지되는 동안만 존재한다.
 */
public class PresenceEntry {

    @JsonProperty("user_id")
    private String userId;

    private String role;

    public PresenceEntry() {
    }

    public PresenceEntry(String userId, String role) {
        this.userId = userId;
        this.role = role;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PresenceEntry)) {
            return false;
        }
        PresenceEntry other = (PresenceEntry) o;
        return Objects.equals(userId, other.userId) && Objects.equals(role, other.role);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, role);
    }

    @Override
    public String toString() {
        return "PresenceEntry{userId=" + userId + ", role=" + role + "}";
    }
}
