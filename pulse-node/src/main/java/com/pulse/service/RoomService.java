package com.pulse.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.model.Room;
import com.pulse.repository.RoomRepository;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 방 레코드와 owner 컬럼을 관리한다. owner가 바뀔 때마다 변경 이벤트를 발행한다.
 */
@Service
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    private final RoomRepository roomRepository;
    private final RealtimeBus bus;
    private final ObjectMapper objectMapper;

    public RoomService(RoomRepository roomRepository, RealtimeBus bus, ObjectMapper objectMapper) {
        this.roomRepository = roomRepository;
        this.bus = bus;
        this.objectMapper = objectMapper;
    }

    /**
     * 새 방을 생성한다. 같은 ID의 방이 이미 있으면 false를 반환한다.
     */
    public boolean createRoom(String roomId, String roomName, String owner) {
        if (roomRepository.existsById(roomId)) {
            return false;
        }
        try {
            roomRepository.saveAndFlush(new Room(roomId, roomName, owner, Instant.now()));
        } catch (DataIntegrityViolationException ex) {
            // 동시에 다른 참가자가 같은 방을 만들었다.
            log.debug("Room {} created concurrently: {}", roomId, ex.getMessage());
            return false;
        }
        log.info("Room {} created with owner {}", roomId, owner);
        if (owner != null) {
            publishOwnerChange(roomId, owner, null);
        }
        return true;
    }

    public Optional<Room> getRoom(String roomId) {
        return roomRepository.findById(roomId);
    }

    public boolean roomExists(String roomId) {
        return roomRepository.existsById(roomId);
    }

    /**
     * 현재 owner를 읽는다. 방이 없거나 owner가 비어 있으면 null.
     */
    public String getOwner(String roomId) {
        return roomRepository.findOwnerById(roomId);
    }

    /**
     * owner가 비어 있을 때만 candidate로 설정한다.
     */
    public boolean claimOwner(String roomId, String candidate) {
        boolean applied = roomRepository.claimOwner(roomId, candidate) == 1;
        if (applied) {
            publishOwnerChange(roomId, candidate, null);
        }
        return applied;
    }

    /**
     * owner가 expected와 같을 때만 candidate로 바꾼다. candidate가 null이면 owner를 비운다.
     */
    public boolean compareAndSetOwner(String roomId, String expected, String candidate) {
        boolean applied = roomRepository.compareAndSetOwner(roomId, expected, candidate) == 1;
        if (applied) {
            publishOwnerChange(roomId, candidate, expected);
        }
        return applied;
    }

    private void publishOwnerChange(String roomId, String owner, String previous) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("id", roomId);
        payload.put("owner", owner);
        payload.put("previous", previous);
        bus.publish(Topics.roomOwner(roomId), Topics.EVENT_UPDATE, payload);
    }
}
