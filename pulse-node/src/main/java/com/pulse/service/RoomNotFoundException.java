package com.pulse.service;

/**
 * 존재하지 않는 방을 대상으로 한 작업에서 던진다.
 */
public class RoomNotFoundException extends RuntimeException {

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
    }
}
